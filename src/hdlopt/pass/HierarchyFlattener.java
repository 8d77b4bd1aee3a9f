package hdlopt.pass;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import hdlopt.diag.OptimizerException;
import hdlopt.graph.HierarchyChecker;
import hdlopt.ir.ContinuousAssignment;
import hdlopt.ir.Design;
import hdlopt.ir.Expression;
import hdlopt.ir.Expression.InstanceOutputRef;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Instance;
import hdlopt.ir.Port;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Sensitivity;
import hdlopt.ir.Signal;
import hdlopt.ir.Statement;
import hdlopt.ir.Statement.Assign;
import hdlopt.ir.Statement.Case;
import hdlopt.ir.Statement.CaseArm;
import hdlopt.ir.Statement.If;
import hdlopt.ir.Statement.Loop;
import hdlopt.ir.Statements;

/**
 * Replaces every instance by a renamed copy of the module it instantiates, bottom-up, leaving only the top module.
 * <p>
 * Signals of an inlined instance {@code u0} are renamed to {@code u0__<name>} (with a numeric suffix if that name is taken),
 *   so nested instances produce path-scoped names such as {@code u0__u1__<name>}.
 * Input port bindings become continuous assignments to the renamed input port signal, output port bindings become
 *   continuous assignments from the renamed output port signal, and reads of instance outputs become signal references.
 * Every inlined element's stable index is nested under the index of the instance it replaces.
 */
public class HierarchyFlattener {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  static final String SEPARATOR = "__";

  public Design flatten(Design design) throws OptimizerException {
    Map<String, HdlModule> flattened = new HashMap<>();
    for (String name : HierarchyChecker.bottomUpOrder(design)) {
      HdlModule module = design.getModule(name).orElseThrow();
      for (Instance instance : module.getInstances())
        module = inline(module, instance, flattened.get(instance.moduleName()));
      flattened.put(name, module);
    }
    HdlModule top = flattened.get(design.getTop());
    logger.info("Flattened {} into {} signals", design.getTop(), top.getSignals().size());
    return design.withModule(top).retainReachable();
  }

  /** Inlines one instance of an already flattened module into the parent. */
  HdlModule inline(HdlModule parent, Instance instance, HdlModule child) {
    logger.debug("Inlining {} ({}) into {}", instance.name(), child.getName(), parent.getName());
    Set<String> taken = new HashSet<>(parent.getSignals().keySet());
    parent.getProcesses().forEach(process -> collectLoopIndices(process.body(), taken));
    Map<String, String> renames = new LinkedHashMap<>();
    for (String name : child.getSignals().keySet())
      renames.put(name, freshName(instance.name() + SEPARATOR + name, taken));
    UnaryOperator<String> rename = name -> renames.getOrDefault(name, name);

    List<Signal> signals = new ArrayList<>(parent.getSignals().values());
    for (Signal signal : child.getSignals().values()) {
      Signal.Kind kind = child.getPort(signal.name()).map(port -> port.direction() == Port.Direction.in).orElse(false)
                             ? Signal.Kind.wire
                             : signal.kind();
      signals.add(new Signal(rename.apply(signal.name()), signal.width(), kind, instance.index().nested(signal.index())));
    }

    UnaryOperator<Expression> outputRefs = expr -> expr.rewrite(node -> {
      if (node instanceof InstanceOutputRef && ((InstanceOutputRef)node).instance().equals(instance.name()))
        return Expression.ref(rename.apply(((InstanceOutputRef)node).port()));
      return node;
    });

    List<ContinuousAssignment> assignments = new ArrayList<>();
    for (ContinuousAssignment assignment : parent.getAssignments())
      assignments.add(assignment.withSource(outputRefs.apply(assignment.source())));
    for (Port port : child.getPorts()) {
      Signal portSignal = child.getSignal(port.name()).orElseThrow();
      Expression binding = instance.inputs().get(port.name());
      if (binding != null)
        assignments.add(new ContinuousAssignment(rename.apply(port.name()), outputRefs.apply(binding),
                                                 instance.index().nested(portSignal.index())));
      String bound = instance.outputs().get(port.name());
      if (bound != null)
        assignments.add(new ContinuousAssignment(bound, Expression.ref(rename.apply(port.name())),
                                                 instance.index().nested(portSignal.index())));
    }
    for (ContinuousAssignment assignment : child.getAssignments())
      assignments.add(new ContinuousAssignment(rename.apply(assignment.target()), renameExpression(assignment.source(), rename),
                                               instance.index().nested(assignment.index())));

    List<ProcessBlock> processes = new ArrayList<>();
    for (ProcessBlock process : parent.getProcesses())
      processes.add(process.withBody(Statements.mapExpressions(process.body(), outputRefs)));
    for (ProcessBlock process : child.getProcesses()) {
      processes.add(new ProcessBlock(instance.name() + SEPARATOR + process.name(), renameStatements(process.body(), rename, taken),
                                     renameSensitivity(process.sensitivity(), rename), instance.index().nested(process.index())));
    }

    List<Instance> instances = new ArrayList<>();
    for (Instance other : parent.getInstances()) {
      if (other.name().equals(instance.name()))
        continue;
      Map<String, Expression> inputs = new LinkedHashMap<>();
      other.inputs().forEach((port, expr) -> inputs.put(port, outputRefs.apply(expr)));
      instances.add(other.withInputs(inputs));
    }
    return new HdlModule(parent.getName(), parent.getPorts(), signals, processes, assignments, instances);
  }

  private static String freshName(String base, Set<String> taken) {
    String name = base;
    for (int suffix = 1; !taken.add(name); ++suffix)
      name = base + "_" + suffix;
    return name;
  }

  private static void collectLoopIndices(List<Statement> statements, Set<String> out) {
    for (Statement statement : statements) {
      if (statement instanceof Loop)
        out.add(((Loop)statement).indexName());
      statement.branches().forEach(branch -> collectLoopIndices(branch, out));
    }
  }

  private static Expression renameExpression(Expression expr, UnaryOperator<String> rename) {
    return expr.substitute(name -> {
      String renamed = rename.apply(name);
      return renamed.equals(name) ? null : Expression.ref(renamed);
    });
  }

  /** Renames targets, reads and loop indices of a statement tree. */
  private static List<Statement> renameStatements(List<Statement> statements, UnaryOperator<String> rename, Set<String> taken) {
    List<Statement> result = new ArrayList<>(statements.size());
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        result.add(new Assign(rename.apply(assign.target()), renameExpression(assign.source(), rename), assign.kind()));
      } else if (statement instanceof If) {
        If ifStmt = (If)statement;
        result.add(new If(renameExpression(ifStmt.cond(), rename), renameStatements(ifStmt.thenBranch(), rename, taken),
                          renameStatements(ifStmt.elseBranch(), rename, taken)));
      } else if (statement instanceof Case) {
        Case caseStmt = (Case)statement;
        List<CaseArm> arms = new ArrayList<>();
        for (CaseArm arm : caseStmt.arms())
          arms.add(new CaseArm(arm.pattern(), renameStatements(arm.body(), rename, taken)));
        result.add(new Case(renameExpression(caseStmt.selector(), rename), arms,
                            caseStmt.defaultBranch().map(body -> renameStatements(body, rename, taken))));
      } else if (statement instanceof Loop) {
        Loop loop = (Loop)statement;
        String index = taken.contains(loop.indexName()) ? freshName(loop.indexName(), taken) : loop.indexName();
        taken.add(index);
        UnaryOperator<String> inner = name -> name.equals(loop.indexName()) ? index : rename.apply(name);
        result.add(new Loop(index, loop.indexWidth(), loop.tripCount(), renameStatements(loop.body(), inner, taken)));
      }
    }
    return result;
  }

  private static Sensitivity renameSensitivity(Sensitivity sensitivity, UnaryOperator<String> rename) {
    if (sensitivity.allReads())
      return sensitivity;
    return new Sensitivity(false, sensitivity.entries()
                                      .stream()
                                      .map(entry -> new Sensitivity.Entry(entry.edge(), rename.apply(entry.signal())))
                                      .collect(Collectors.toList()));
  }
}
