package hdlopt.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Signal-level dependency graph of one module.
 * Nodes are signals and instances; an edge points from each node a driver reads to the node it drives.
 */
public class DependencyGraph {
  public enum NodeKind { signal, instance }

  public record Node(NodeKind kind, String name) {
    public static Node signal(String name) { return new Node(NodeKind.signal, name); }
    public static Node instance(String name) { return new Node(NodeKind.instance, name); }
    @Override
    public String toString() {
      return kind == NodeKind.signal ? name : "<" + name + ">";
    }
  }

  public enum DriverKind { continuous, process, instance }

  /**
   * One driver of a signal.
   * @param name process or instance name; the target name for continuous assignments
   * @param dependencies nodes whose value reaches the driven signal through this driver
   */
  public record Driver(DriverKind kind, String name, Set<Node> dependencies) {}

  private final String moduleName;
  private final Map<String, List<Driver>> driversBySignal;
  private final Map<String, Set<Node>> instanceDependencies;
  private final Map<Node, Set<Node>> readers = new LinkedHashMap<>();

  DependencyGraph(String moduleName, Map<String, List<Driver>> driversBySignal, Map<String, Set<Node>> instanceDependencies) {
    this.moduleName = moduleName;
    this.driversBySignal = driversBySignal;
    this.instanceDependencies = instanceDependencies;
    driversBySignal.forEach((signal, drivers) -> {
      for (Driver driver : drivers)
        driver.dependencies().forEach(dep -> readers.computeIfAbsent(dep, key -> new LinkedHashSet<>()).add(Node.signal(signal)));
    });
    instanceDependencies.forEach(
        (instance, deps) -> deps.forEach(dep -> readers.computeIfAbsent(dep, key -> new LinkedHashSet<>()).add(Node.instance(instance))));
  }

  public String getModuleName() { return moduleName; }

  public List<Driver> driversOf(String signal) { return driversBySignal.getOrDefault(signal, List.of()); }

  /** Nodes the given node reads from. */
  public Set<Node> dependenciesOf(Node node) {
    if (node.kind() == NodeKind.instance)
      return instanceDependencies.getOrDefault(node.name(), Set.of());
    Set<Node> result = new LinkedHashSet<>();
    driversOf(node.name()).forEach(driver -> result.addAll(driver.dependencies()));
    return result;
  }

  /** Nodes that read the given node. */
  public Set<Node> readersOf(Node node) { return Collections.unmodifiableSet(readers.getOrDefault(node, Set.of())); }

  /** All nodes reachable backwards from the roots, roots included. */
  public Set<Node> backwardClosure(Collection<Node> roots) {
    Set<Node> visited = new LinkedHashSet<>();
    Deque<Node> worklist = new ArrayDeque<>(roots);
    while (!worklist.isEmpty()) {
      Node node = worklist.poll();
      if (visited.add(node))
        worklist.addAll(dependenciesOf(node));
    }
    return visited;
  }
}
