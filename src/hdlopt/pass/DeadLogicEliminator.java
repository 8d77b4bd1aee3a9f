package hdlopt.pass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import hdlopt.diag.OptimizerException;
import hdlopt.graph.DependencyGraph;
import hdlopt.graph.DependencyGraph.Node;
import hdlopt.graph.DependencyGraphBuilder;
import hdlopt.ir.BitVector;
import hdlopt.ir.ContinuousAssignment;
import hdlopt.ir.Expression.Literal;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Instance;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Signal;
import hdlopt.ir.Statement;
import hdlopt.ir.Statement.Case;
import hdlopt.ir.Statement.CaseArm;
import hdlopt.ir.Statement.If;
import hdlopt.ir.Statements;

/**
 * Removes logic that cannot influence an observable signal.
 * <p>
 * The observable set starts from the output ports (plus any pinned signals of the incoming context) and grows backwards
 * through the dependency graph. Continuous assignments, process assignments, instances and instance output bindings that
 * drive nothing observable are removed, followed by signals nothing refers to any more. Before each round, If and Case
 * statements with a literal condition or selector are replaced by the branch they take.
 * Rounds repeat until nothing changes, since removing a driver can make its inputs unobservable.
 */
public class DeadLogicEliminator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Observability context threaded through successive invocations.
   * @param pinned signals kept observable in addition to the output ports
   * @param nodes the observable signals and instances computed by the last invocation
   */
  public record ObservableSet(Set<String> pinned, Set<Node> nodes) {
    public ObservableSet {
      pinned = Set.copyOf(pinned);
      nodes = Set.copyOf(nodes);
    }

    public static ObservableSet empty() { return new ObservableSet(Set.of(), Set.of()); }
    public static ObservableSet pinning(Set<String> signals) { return new ObservableSet(signals, Set.of()); }

    public boolean containsSignal(String name) { return nodes.contains(Node.signal(name)); }
    public boolean containsInstance(String name) { return nodes.contains(Node.instance(name)); }
  }

  public record Result(HdlModule module, ObservableSet observable, boolean changed) {}

  /**
   * @param context observability context of the previous invocation on this module; only its pinned signals are reused
   * @throws OptimizerException if the module violates a driver invariant
   */
  public Result run(HdlModule module, ObservableSet context) throws OptimizerException {
    HdlModule current = module;
    ObservableSet observable;
    while (true) {
      HdlModule pruned = eliminateDeadBranches(current);
      DependencyGraph graph = new DependencyGraphBuilder(pruned).build();
      List<Node> roots = new ArrayList<>();
      pruned.outputPorts().forEach(port -> roots.add(Node.signal(port.name())));
      context.pinned().stream().filter(name -> pruned.getSignal(name).isPresent()).forEach(name -> roots.add(Node.signal(name)));
      observable = new ObservableSet(context.pinned(), graph.backwardClosure(roots));
      HdlModule next = removeUnobservable(pruned, observable);
      if (next.equals(current))
        break;
      current = next;
    }
    boolean changed = !current.equals(module);
    if (changed)
      logger.debug("Module {}: {} of {} signals observable", module.getName(), current.getSignals().size(), module.getSignals().size());
    return new Result(current, observable, changed);
  }

  private HdlModule removeUnobservable(HdlModule module, ObservableSet observable) {
    String moduleName = module.getName();
    List<ContinuousAssignment> assignments = new ArrayList<>();
    for (ContinuousAssignment assignment : module.getAssignments()) {
      if (observable.containsSignal(assignment.target()))
        assignments.add(assignment);
      else
        logger.trace("Module {}: removing assignment to {}", moduleName, assignment.target());
    }

    List<Instance> instances = new ArrayList<>();
    for (Instance instance : module.getInstances()) {
      if (!observable.containsInstance(instance.name())) {
        logger.debug("Module {}: removing unobserved instance {} of {}", moduleName, instance.name(), instance.moduleName());
        continue;
      }
      Map<String, String> outputs = new LinkedHashMap<>(instance.outputs());
      outputs.values().removeIf(bound -> !observable.containsSignal(bound));
      instances.add(outputs.size() == instance.outputs().size()
                        ? instance
                        : new Instance(instance.name(), instance.moduleName(), instance.inputs(), outputs, instance.index()));
    }

    List<ProcessBlock> processes = new ArrayList<>();
    for (ProcessBlock process : module.getProcesses()) {
      List<Statement> body = Statements.retainTargets(process.body(), observable::containsSignal);
      if (body.isEmpty())
        logger.debug("Module {}: removing process {} without observable targets", moduleName, process.name());
      else
        processes.add(body.equals(process.body()) ? process : process.withBody(body));
    }

    HdlModule reduced = module.with(processes, assignments, instances);
    Set<String> referenced = referencedSignals(reduced);
    List<Signal> signals = new ArrayList<>();
    for (Signal signal : reduced.getSignals().values()) {
      if (reduced.isPort(signal.name()) || observable.containsSignal(signal.name()) || referenced.contains(signal.name()))
        signals.add(signal);
      else
        logger.trace("Module {}: removing signal {}", moduleName, signal.name());
    }
    return signals.size() == reduced.getSignals().size() ? reduced : reduced.withSignals(signals);
  }

  private static Set<String> referencedSignals(HdlModule module) {
    Set<String> result = new LinkedHashSet<>();
    for (ContinuousAssignment assignment : module.getAssignments()) {
      result.add(assignment.target());
      result.addAll(assignment.source().readSignals());
    }
    for (Instance instance : module.getInstances()) {
      instance.inputs().values().forEach(expr -> result.addAll(expr.readSignals()));
      result.addAll(instance.outputs().values());
    }
    for (ProcessBlock process : module.getProcesses()) {
      result.addAll(Statements.readSignals(process.body()));
      result.addAll(process.assignedTargets());
      result.addAll(process.sensitivity().signals());
    }
    return result;
  }

  /** Replaces If and Case statements whose condition or selector is a literal by the branch they take. */
  static HdlModule eliminateDeadBranches(HdlModule module) {
    List<ProcessBlock> processes = new ArrayList<>();
    boolean changed = false;
    for (ProcessBlock process : module.getProcesses()) {
      List<Statement> body = eliminateDeadBranches(process.body());
      if (!body.equals(process.body())) {
        changed = true;
        logger.trace("Module {}: pruned constant branches in process {}", module.getName(), process.name());
        processes.add(process.withBody(body));
      } else {
        processes.add(process);
      }
    }
    return changed ? module.withProcesses(processes) : module;
  }

  static List<Statement> eliminateDeadBranches(List<Statement> statements) {
    List<Statement> result = new ArrayList<>(statements.size());
    for (Statement statement : statements) {
      if (statement instanceof If && ((If)statement).cond() instanceof Literal) {
        If ifStmt = (If)statement;
        boolean taken = ((Literal)ifStmt.cond()).value().isTrue();
        result.addAll(eliminateDeadBranches(taken ? ifStmt.thenBranch() : ifStmt.elseBranch()));
      } else if (statement instanceof Case && ((Case)statement).selector() instanceof Literal) {
        Case caseStmt = (Case)statement;
        BitVector selector = ((Literal)caseStmt.selector()).value();
        Optional<List<Statement>> taken =
            caseStmt.arms().stream().filter(arm -> arm.pattern().matches(selector)).findFirst().map(CaseArm::body);
        if (taken.isEmpty())
          taken = caseStmt.defaultBranch();
        taken.ifPresent(body -> result.addAll(eliminateDeadBranches(body)));
      } else {
        result.add(Statements.mapBranches(statement, DeadLogicEliminator::eliminateDeadBranches));
      }
    }
    return result;
  }
}
