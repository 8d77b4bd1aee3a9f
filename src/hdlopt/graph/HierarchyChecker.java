package hdlopt.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.diag.OptimizerException;
import hdlopt.ir.Design;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Instance;

/**
 * Verifies that the instance hierarchy is a DAG and computes a bottom-up module order.
 * Uses an explicit stack over the module arena instead of recursion.
 */
public class HierarchyChecker {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final int UNVISITED = 0;
  private static final int ON_STACK = 1;
  private static final int DONE = 2;

  /**
   * Returns the names of all modules reachable from the top module, each after every module it instantiates.
   * @throws OptimizerException HierarchyCycleError if a module instantiates itself directly or transitively,
   *     UndeclaredReference if an instance names an unknown module
   */
  public static List<String> bottomUpOrder(Design design) throws OptimizerException {
    Map<String, Integer> status = new HashMap<>();
    List<String> order = new ArrayList<>();
    record Frame(HdlModule module, int nextInstance) {}
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(design.getTopModule(), 0));
    status.put(design.getTop(), ON_STACK);

    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      List<Instance> instances = frame.module().getInstances();
      if (frame.nextInstance() >= instances.size()) {
        status.put(frame.module().getName(), DONE);
        order.add(frame.module().getName());
        continue;
      }
      stack.push(new Frame(frame.module(), frame.nextInstance() + 1));
      Instance instance = instances.get(frame.nextInstance());
      HdlModule child = design.getModule(instance.moduleName()).orElse(null);
      if (child == null)
        throw new OptimizerException(DiagnosticCategory.UndeclaredReference, frame.module().getName(), instance.name(),
                                     "instance " + instance.name() + " refers to unknown module " + instance.moduleName());
      int childStatus = status.getOrDefault(child.getName(), UNVISITED);
      if (childStatus == ON_STACK) {
        // The stack holds the current instantiation path, innermost first.
        List<String> path = new ArrayList<>();
        for (Frame onPath : stack)
          path.add(0, onPath.module().getName());
        int cycleStart = path.indexOf(child.getName());
        List<String> cycle = new ArrayList<>(path.subList(cycleStart, path.size()));
        cycle.add(child.getName());
        throw new OptimizerException(DiagnosticCategory.HierarchyCycleError, child.getName(), instance.name(),
                                     "module instantiates itself: " + String.join(" -> ", cycle));
      }
      if (childStatus == UNVISITED) {
        status.put(child.getName(), ON_STACK);
        stack.push(new Frame(child, 0));
      }
    }
    logger.debug("Module order (bottom-up): {}", order.stream().collect(Collectors.joining(", ")));
    return order;
  }
}
