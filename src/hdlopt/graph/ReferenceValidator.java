package hdlopt.graph;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.diag.OptimizerException;
import hdlopt.ir.ContinuousAssignment;
import hdlopt.ir.Design;
import hdlopt.ir.Expression;
import hdlopt.ir.Expression.InstanceOutputRef;
import hdlopt.ir.Expression.SignalRef;
import hdlopt.ir.Expression.Slice;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Instance;
import hdlopt.ir.ModuleScope;
import hdlopt.ir.Port;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Sensitivity;
import hdlopt.ir.Statement;
import hdlopt.ir.Statement.Assign;
import hdlopt.ir.Statement.Loop;

/**
 * Rejects IR that refers to names that do not exist. Nothing is guessed: the first unresolved name aborts.
 */
public class ReferenceValidator {
  private final Design design;
  private final HdlModule module;

  public ReferenceValidator(Design design, HdlModule module) {
    this.design = design;
    this.module = module;
  }

  /** Validates every module of the design. */
  public static void validateAll(Design design) throws OptimizerException {
    for (HdlModule module : design.getModules().values())
      new ReferenceValidator(design, module).validate();
  }

  public void validate() throws OptimizerException {
    for (Instance instance : module.getInstances())
      checkInstance(instance);
    for (ContinuousAssignment assignment : module.getAssignments()) {
      checkSignal(assignment.target(), "assignment target");
      checkExpression(assignment.source(), Set.of(), "assignment to " + assignment.target());
    }
    for (ProcessBlock process : module.getProcesses()) {
      for (Sensitivity.Entry entry : process.sensitivity().entries())
        checkSignal(entry.signal(), "sensitivity list of process " + process.name());
      checkStatements(process.body(), new HashSet<>(), process.name());
    }
  }

  private void checkStatements(List<Statement> statements, Set<String> loopIndices, String processName) throws OptimizerException {
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        String target = ((Assign)statement).target();
        if (loopIndices.contains(target))
          fail(target, "process " + processName + " assigns loop index " + target);
        checkSignal(target, "assignment target in process " + processName);
      }
      for (Expression expr : statement.expressions())
        checkExpression(expr, loopIndices, "process " + processName);
      if (statement instanceof Loop) {
        Loop loop = (Loop)statement;
        if (module.getSignal(loop.indexName()).isPresent())
          fail(loop.indexName(), "loop index " + loop.indexName() + " in process " + processName + " shadows a signal");
        Set<String> inner = new HashSet<>(loopIndices);
        inner.add(loop.indexName());
        checkStatements(loop.body(), inner, processName);
      } else {
        for (List<Statement> branch : statement.branches())
          checkStatements(branch, loopIndices, processName);
      }
    }
  }

  private void checkExpression(Expression expr, Set<String> loopIndices, String where) throws OptimizerException {
    if (expr instanceof SignalRef) {
      String name = ((SignalRef)expr).name();
      if (!loopIndices.contains(name))
        checkSignal(name, where);
      return;
    }
    if (expr instanceof InstanceOutputRef) {
      InstanceOutputRef ref = (InstanceOutputRef)expr;
      Instance instance = module.getInstance(ref.instance()).orElse(null);
      if (instance == null)
        fail(ref.instance(), where + " reads unknown instance " + ref.instance());
      HdlModule target = design.getModule(instance.moduleName()).orElse(null);
      if (target == null)
        fail(instance.name(), "instance " + instance.name() + " refers to unknown module " + instance.moduleName());
      Port port = target.getPort(ref.port()).orElse(null);
      if (port == null || port.direction() == Port.Direction.in)
        fail(ref.instance(), where + " reads " + ref.instance() + "." + ref.port() + ", which is not an output of " + target.getName());
      return;
    }
    for (Expression child : expr.children())
      checkExpression(child, loopIndices, where);
    if (expr instanceof Slice && loopIndices.isEmpty()) {
      Slice slice = (Slice)expr;
      int operandWidth = slice.operand().width(new ModuleScope(design, module));
      if (slice.msb() >= operandWidth)
        fail(where, where + " slices [" + slice.msb() + ":" + slice.lsb() + "] out of a " + operandWidth + "-bit value");
    }
  }

  private void checkInstance(Instance instance) throws OptimizerException {
    HdlModule target = design.getModule(instance.moduleName()).orElse(null);
    if (target == null)
      fail(instance.name(), "instance " + instance.name() + " refers to unknown module " + instance.moduleName());
    for (Map.Entry<String, Expression> binding : instance.inputs().entrySet()) {
      Port port = target.getPort(binding.getKey()).orElse(null);
      if (port == null || port.direction() != Port.Direction.in)
        fail(instance.name(), "instance " + instance.name() + " binds " + binding.getKey() + ", which is not an input of " +
                                  target.getName());
      checkExpression(binding.getValue(), Set.of(), "input " + binding.getKey() + " of instance " + instance.name());
    }
    List<Port> unbound = target.inputPorts().filter(port -> !instance.inputs().containsKey(port.name())).collect(Collectors.toList());
    if (!unbound.isEmpty())
      fail(instance.name(), "instance " + instance.name() + " leaves input " + unbound.get(0).name() + " unbound");
    for (Map.Entry<String, String> binding : instance.outputs().entrySet()) {
      Port port = target.getPort(binding.getKey()).orElse(null);
      if (port == null || port.direction() == Port.Direction.in)
        fail(instance.name(), "instance " + instance.name() + " binds " + binding.getKey() + ", which is not an output of " +
                                  target.getName());
      checkSignal(binding.getValue(), "output " + binding.getKey() + " of instance " + instance.name());
    }
  }

  private void checkSignal(String name, String where) throws OptimizerException {
    if (module.getSignal(name).isEmpty())
      fail(name, where + " refers to undeclared signal " + name);
  }

  private void fail(String location, String detail) throws OptimizerException {
    throw new OptimizerException(DiagnosticCategory.UndeclaredReference, module.getName(), location, detail);
  }
}
