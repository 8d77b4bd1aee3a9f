package hdlopt.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.diag.OptimizerException;
import hdlopt.graph.DependencyGraph.Driver;
import hdlopt.graph.DependencyGraph.DriverKind;
import hdlopt.graph.DependencyGraph.Node;
import hdlopt.ir.ContinuousAssignment;
import hdlopt.ir.Expression;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Instance;
import hdlopt.ir.Port;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Signal;
import hdlopt.ir.Statement;
import hdlopt.ir.Statement.Assign;
import hdlopt.ir.Statement.AssignKind;
import hdlopt.ir.Statement.Case;
import hdlopt.ir.Statement.If;
import hdlopt.ir.Statements;

/**
 * Derives the dependency graph of a module and checks its driver invariants:
 * <ul>
 * <li>a wire has at most one driver (continuous assignment or instance output), and is never written by a process;</li>
 * <li>a variable is written by at most one process per domain, and never driven continuously;</li>
 * <li>an input port is not driven inside its module;</li>
 * <li>continuous assignments and combinational processes form no cycle. Feedback through an edge-triggered process is legal.</li>
 * </ul>
 */
public class DependencyGraphBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final HdlModule module;

  public DependencyGraphBuilder(HdlModule module) { this.module = module; }

  public DependencyGraph build() throws OptimizerException {
    Map<String, List<Driver>> drivers = new LinkedHashMap<>();
    Map<String, Set<Node>> instanceDeps = new LinkedHashMap<>();

    for (ContinuousAssignment assignment : module.getAssignments()) {
      Signal target = signal(assignment.target());
      if (target.kind() != Signal.Kind.wire)
        conflict(target.name(), "variable " + target.name() + " is driven by a continuous assignment");
      drivers.computeIfAbsent(target.name(), key -> new ArrayList<>())
          .add(new Driver(DriverKind.continuous, target.name(), nodesRead(assignment.source())));
    }

    for (Instance instance : module.getInstances()) {
      Set<Node> deps = new LinkedHashSet<>();
      instance.inputs().values().forEach(expr -> deps.addAll(nodesRead(expr)));
      instanceDeps.put(instance.name(), deps);
      for (String bound : instance.outputs().values()) {
        Signal target = signal(bound);
        if (target.kind() != Signal.Kind.wire)
          conflict(target.name(), "variable " + target.name() + " is bound to an output of instance " + instance.name());
        drivers.computeIfAbsent(target.name(), key -> new ArrayList<>())
            .add(new Driver(DriverKind.instance, instance.name(), Set.of(Node.instance(instance.name()))));
      }
    }

    Map<String, Map<ProcessBlock.Domain, String>> writers = new HashMap<>();
    for (ProcessBlock process : module.getProcesses()) {
      for (String targetName : process.assignedTargets()) {
        Signal target = signal(targetName);
        if (target.kind() != Signal.Kind.variable)
          conflict(targetName, "wire " + targetName + " is written by process " + process.name());
        String previous = writers.computeIfAbsent(targetName, key -> new EnumMap<>(ProcessBlock.Domain.class))
                              .putIfAbsent(process.domain(), process.name());
        if (previous != null)
          conflict(targetName, "variable " + targetName + " is written by " + process.domain() + " processes " + previous + " and " +
                                   process.name());
        Set<Node> deps = new LinkedHashSet<>();
        Statements.readsFor(process.body(), targetName).forEach(name -> deps.add(Node.signal(name)));
        Statements.instanceReadsFor(process.body(), targetName).forEach(name -> deps.add(Node.instance(name)));
        process.sensitivity().signals().forEach(name -> deps.add(Node.signal(name)));
        drivers.computeIfAbsent(targetName, key -> new ArrayList<>()).add(new Driver(DriverKind.process, process.name(), deps));
      }
    }

    for (Map.Entry<String, List<Driver>> entry : drivers.entrySet()) {
      String signalName = entry.getKey();
      List<Driver> signalDrivers = entry.getValue();
      if (module.getPort(signalName).map(port -> port.direction() == Port.Direction.in).orElse(false))
        conflict(signalName, "input port " + signalName + " is driven inside the module by " + describe(signalDrivers));
      if (signal(signalName).kind() == Signal.Kind.wire && signalDrivers.size() > 1)
        conflict(signalName, "wire " + signalName + " has " + signalDrivers.size() + " drivers: " + describe(signalDrivers));
    }

    checkCombinationalLoops();
    DependencyGraph graph = new DependencyGraph(module.getName(), drivers, instanceDeps);
    logger.trace("Module {}: dependency graph with {} driven signals, {} instances", module.getName(), drivers.size(), instanceDeps.size());
    return graph;
  }

  /**
   * Depth-first search over the edges of continuous assignments and combinational processes, reporting the first cycle found.
   * A process contributes an edge from a target to each signal whose value from before the evaluation reaches it.
   */
  private void checkCombinationalLoops() throws OptimizerException {
    Map<String, List<String>> edges = new LinkedHashMap<>();
    for (ContinuousAssignment assignment : module.getAssignments())
      edges.computeIfAbsent(assignment.target(), key -> new ArrayList<>()).addAll(assignment.source().readSignals());
    for (ProcessBlock process : module.getProcesses()) {
      if (process.isCombinational())
        entryReads(process).forEach((target, reads) -> edges.computeIfAbsent(target, key -> new ArrayList<>()).addAll(reads));
    }

    Map<String, Integer> status = new HashMap<>();
    for (String start : edges.keySet()) {
      if (status.getOrDefault(start, 0) != 0)
        continue;
      List<String> path = new ArrayList<>();
      List<Integer> nextEdge = new ArrayList<>();
      path.add(start);
      nextEdge.add(0);
      status.put(start, 1);
      while (!path.isEmpty()) {
        int top = path.size() - 1;
        String current = path.get(top);
        List<String> successors = edges.getOrDefault(current, List.of());
        int i = nextEdge.get(top);
        if (i >= successors.size()) {
          status.put(current, 2);
          path.remove(top);
          nextEdge.remove(top);
          continue;
        }
        nextEdge.set(top, i + 1);
        String next = successors.get(i);
        int nextStatus = status.getOrDefault(next, 0);
        if (nextStatus == 1) {
          // Edges point from a target to what it reads, so the path is reversed signal flow.
          List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
          cycle.add(next);
          Collections.reverse(cycle);
          throw new OptimizerException(DiagnosticCategory.CombinationalLoopError, module.getName(), next,
                                       "combinational loop: " + String.join(" -> ", cycle));
        }
        if (nextStatus == 0) {
          status.put(next, 1);
          path.add(next);
          nextEdge.add(0);
        }
      }
    }
  }

  // stands for the value a variable held before the evaluation
  private static final String ENTRY = "";

  /** Values reaching each variable so far; a variable missing from a map still holds its entry value. */
  private static class FlowState {
    final Map<String, Set<String>> blocking = new HashMap<>();
    final Map<String, Set<String>> deferred = new HashMap<>();

    FlowState copy() {
      FlowState result = new FlowState();
      blocking.forEach((name, deps) -> result.blocking.put(name, new LinkedHashSet<>(deps)));
      deferred.forEach((name, deps) -> result.deferred.put(name, new LinkedHashSet<>(deps)));
      return result;
    }

    FlowState merge(FlowState other) {
      FlowState result = new FlowState();
      mergeInto(result.blocking, blocking, other.blocking);
      mergeInto(result.deferred, deferred, other.deferred);
      return result;
    }

    private static void mergeInto(Map<String, Set<String>> out, Map<String, Set<String>> a, Map<String, Set<String>> b) {
      Set<String> names = new LinkedHashSet<>(a.keySet());
      names.addAll(b.keySet());
      for (String name : names) {
        Set<String> deps = new LinkedHashSet<>(a.getOrDefault(name, Set.of(ENTRY)));
        deps.addAll(b.getOrDefault(name, Set.of(ENTRY)));
        out.put(name, deps);
      }
    }
  }

  /**
   * For each target of a combinational process, the signals whose values from before one evaluation reach the target at its end.
   * Reads of a variable after its blocking assignment follow that assignment instead, and a target that merely keeps its
   *   previous value on some path does not depend on itself.
   */
  static Map<String, Set<String>> entryReads(ProcessBlock process) {
    FlowState state = walkFlow(Statements.unroll(process.body()), new FlowState(), Set.of());
    Map<String, Set<String>> result = new LinkedHashMap<>();
    for (String target : process.assignedTargets()) {
      Set<String> deps = new LinkedHashSet<>(state.blocking.getOrDefault(target, Set.of()));
      deps.addAll(state.deferred.getOrDefault(target, Set.of()));
      deps.remove(ENTRY);
      result.put(target, deps);
    }
    return result;
  }

  private static FlowState walkFlow(List<Statement> statements, FlowState state, Set<String> control) {
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        Set<String> deps = resolve(assign.source(), state, control);
        (assign.kind() == AssignKind.blocking ? state.blocking : state.deferred).put(assign.target(), deps);
      } else if (statement instanceof If) {
        If ifStmt = (If)statement;
        Set<String> inner = resolve(ifStmt.cond(), state, control);
        FlowState thenState = walkFlow(ifStmt.thenBranch(), state.copy(), inner);
        state = thenState.merge(walkFlow(ifStmt.elseBranch(), state.copy(), inner));
      } else if (statement instanceof Case) {
        Case caseStmt = (Case)statement;
        Set<String> inner = resolve(caseStmt.selector(), state, control);
        // no arm taken without a default: every variable keeps its value
        FlowState merged = caseStmt.defaultBranch().isPresent() ? null : state.copy();
        List<List<Statement>> bodies = new ArrayList<>();
        caseStmt.arms().forEach(arm -> bodies.add(arm.body()));
        caseStmt.defaultBranch().ifPresent(bodies::add);
        for (List<Statement> body : bodies) {
          FlowState armState = walkFlow(body, state.copy(), inner);
          merged = merged == null ? armState : merged.merge(armState);
        }
        state = merged == null ? state : merged;
      }
    }
    return state;
  }

  private static Set<String> resolve(Expression expr, FlowState state, Set<String> control) {
    Set<String> result = new LinkedHashSet<>(control);
    for (String name : expr.readSignals()) {
      Set<String> current = state.blocking.get(name);
      if (current == null) {
        result.add(name);
        continue;
      }
      for (String dep : current)
        result.add(dep.equals(ENTRY) ? name : dep);
    }
    return result;
  }

  private static Set<Node> nodesRead(Expression expr) {
    Set<Node> result = new LinkedHashSet<>();
    expr.readSignals().forEach(name -> result.add(Node.signal(name)));
    expr.readInstances().forEach(name -> result.add(Node.instance(name)));
    return result;
  }

  private static String describe(List<Driver> drivers) {
    return drivers.stream().map(driver -> driver.kind() + " " + driver.name()).collect(Collectors.joining(", "));
  }

  private Signal signal(String name) throws OptimizerException {
    Signal signal = module.getSignal(name).orElse(null);
    if (signal == null)
      throw new OptimizerException(DiagnosticCategory.UndeclaredReference, module.getName(), name, "undeclared signal " + name);
    return signal;
  }

  private void conflict(String location, String detail) throws OptimizerException {
    throw new OptimizerException(DiagnosticCategory.MultipleDriverConflict, module.getName(), location, detail);
  }
}
