package hdlopt.ir;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Module arena of a design: all module definitions by name plus the name of the top module.
 * Instances refer to definitions by name.
 */
public final class Design {
  private final Map<String, HdlModule> modules;
  private final String top;

  public Design(Collection<HdlModule> modules, String top) {
    TreeMap<String, HdlModule> moduleMap = new TreeMap<>();
    for (HdlModule module : modules) {
      if (moduleMap.put(module.getName(), module) != null)
        throw new IllegalArgumentException("duplicate module definition " + module.getName());
    }
    if (!moduleMap.containsKey(top))
      throw new IllegalArgumentException("top module " + top + " is not defined");
    this.modules = Collections.unmodifiableMap(moduleMap);
    this.top = top;
  }

  public static Design of(String top, HdlModule... modules) { return new Design(List.of(modules), top); }

  /** Module definitions, sorted by name. */
  public Map<String, HdlModule> getModules() { return modules; }
  public String getTop() { return top; }
  public HdlModule getTopModule() { return modules.get(top); }
  public Optional<HdlModule> getModule(String name) { return Optional.ofNullable(modules.get(name)); }

  /** Scope for width lookups inside one of this design's modules. */
  public ModuleScope scope(HdlModule module) { return new ModuleScope(this, module); }

  public Design withModule(HdlModule module) {
    LinkedHashMap<String, HdlModule> newModules = new LinkedHashMap<>(modules);
    newModules.put(module.getName(), module);
    return new Design(newModules.values(), top);
  }

  public Design withModules(Collection<HdlModule> replacements) {
    LinkedHashMap<String, HdlModule> newModules = new LinkedHashMap<>(modules);
    replacements.forEach(module -> newModules.put(module.getName(), module));
    return new Design(newModules.values(), top);
  }

  /** Drops module definitions that the top module does not instantiate, directly or transitively. */
  public Design retainReachable() {
    Set<String> reachable = new LinkedHashSet<>();
    Deque<String> worklist = new ArrayDeque<>();
    worklist.add(top);
    while (!worklist.isEmpty()) {
      String name = worklist.poll();
      if (!reachable.add(name))
        continue;
      HdlModule module = modules.get(name);
      if (module != null)
        module.getInstances().forEach(instance -> worklist.add(instance.moduleName()));
    }
    return new Design(modules.values().stream().filter(module -> reachable.contains(module.getName())).collect(Collectors.toList()), top);
  }

  @Override
  public int hashCode() {
    return Objects.hash(modules, top);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Design other = (Design)obj;
    return top.equals(other.top) && modules.equals(other.modules);
  }

  @Override
  public String toString() {
    return "Design " + top + " " + modules.keySet();
  }
}
