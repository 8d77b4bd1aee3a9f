package hdlopt.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Instantiation of a module definition.
 * Inputs are bound to expressions, outputs to signals of the instantiating module. The iteration order of the bindings is not significant.
 * Outputs may be left unbound and read through {@link Expression.InstanceOutputRef} instead.
 */
public record Instance(String name, String moduleName, Map<String, Expression> inputs, Map<String, String> outputs, StableIndex index) {
  public Instance {
    inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
  }

  public Instance withInputs(Map<String, Expression> newInputs) { return new Instance(name, moduleName, newInputs, outputs, index); }
}
