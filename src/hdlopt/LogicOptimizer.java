package hdlopt;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.diag.DiagnosticCollector;
import hdlopt.diag.OptimizerException;
import hdlopt.drc.CompletenessAnalyzer;
import hdlopt.drc.OrderHazardAnalyzer;
import hdlopt.emit.NetlistEmitter;
import hdlopt.emit.NetlistWriter;
import hdlopt.graph.DependencyGraphBuilder;
import hdlopt.graph.HierarchyChecker;
import hdlopt.graph.ReferenceValidator;
import hdlopt.ir.Design;
import hdlopt.ir.HdlModule;
import hdlopt.pass.ConstantPropagation;
import hdlopt.pass.DeadLogicEliminator;
import hdlopt.pass.DeadLogicEliminator.ObservableSet;
import hdlopt.pass.HierarchyFlattener;
import hdlopt.pass.WireInliner;
import hdlopt.ui.OptimizerConfig;

/**
 * Pipeline driver.
 * <ol>
 * <li>hierarchy check, reference validation and dependency graph construction of every module</li>
 * <li>constant propagation, wire inlining and dead-logic elimination per module, repeated until nothing changes</li>
 * <li>completeness and order-hazard analysis</li>
 * <li>optional flattening followed by another round of step 2 on the flattened design</li>
 * <li>netlist emission</li>
 * </ol>
 * A fatal diagnostic aborts the run; the result then carries the diagnostics collected so far but no design.
 */
public class LogicOptimizer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final OptimizerConfig cfg;

  public LogicOptimizer() { this(new OptimizerConfig()); }
  public LogicOptimizer(OptimizerConfig cfg) { this.cfg = cfg; }

  public OptimizationResult optimize(Design design) {
    DiagnosticCollector diagnostics = new DiagnosticCollector(cfg.warnings_as_errors);
    try {
      Design optimized = run(design, diagnostics);
      String netlist = new NetlistEmitter().emit(optimized);
      logger.info("Optimized design {}: {} diagnostics", design.getTop(), diagnostics.getDiagnostics().size());
      return new OptimizationResult(Optional.of(optimized), Optional.of(netlist), diagnostics.getDiagnostics());
    } catch (OptimizerException e) {
      diagnostics.report(e.getDiagnostic());
      logger.error("Optimization of design {} aborted", design.getTop());
      return new OptimizationResult(Optional.empty(), Optional.empty(), diagnostics.getDiagnostics());
    }
  }

  /** Optimizes the design and writes the netlist to outPath unless the run was aborted. */
  public OptimizationResult optimize(Design design, String outPath) throws IOException {
    OptimizationResult result = optimize(design);
    if (result.netlist().isPresent())
      new NetlistWriter(outPath).write(result.netlist().get());
    return result;
  }

  private Design run(Design design, DiagnosticCollector diagnostics) throws OptimizerException {
    logger.info("Optimizing design {}", design.getTop());
    HierarchyChecker.bottomUpOrder(design);
    Design reachable = design.retainReachable();
    if (reachable.getModules().size() != design.getModules().size())
      logger.info("Dropping {} modules not instantiated by {}", design.getModules().size() - reachable.getModules().size(),
                  design.getTop());
    ReferenceValidator.validateAll(reachable);
    for (HdlModule module : reachable.getModules().values())
      new DependencyGraphBuilder(module).build();

    Design optimized = optimizeModules(reachable);

    CompletenessAnalyzer completeness = new CompletenessAnalyzer(optimized, cfg);
    OrderHazardAnalyzer orderHazards = new OrderHazardAnalyzer();
    for (HdlModule module : optimized.getModules().values()) {
      completeness.analyze(module, diagnostics);
      orderHazards.analyze(module, diagnostics);
    }

    if (cfg.flatten) {
      optimized = new HierarchyFlattener().flatten(optimized);
      // Flattening can close loops through former port boundaries.
      new DependencyGraphBuilder(optimized.getTopModule()).build();
      optimized = optimizeModules(optimized);
    }
    return optimized;
  }

  /**
   * Optimizes every module against the same read-only design snapshot, on worker_threads threads.
   * Results are merged in module name order, so the outcome does not depend on scheduling.
   */
  Design optimizeModules(Design design) throws OptimizerException {
    List<HdlModule> modules = new ArrayList<>(design.getModules().values());
    List<HdlModule> optimized = new ArrayList<>(modules.size());
    if (cfg.worker_threads <= 1 || modules.size() <= 1) {
      for (HdlModule module : modules)
        optimized.add(optimizeModule(design, module));
    } else {
      AtomicInteger threadNumber = new AtomicInteger();
      ExecutorService workers = Executors.newFixedThreadPool(Math.min(cfg.worker_threads, modules.size()), runnable -> {
        Thread thread = new Thread(runnable, "hdlopt-worker-" + threadNumber.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      });
      try {
        List<Future<HdlModule>> futures = new ArrayList<>();
        for (HdlModule module : modules)
          futures.add(workers.submit(() -> optimizeModule(design, module)));
        for (Future<HdlModule> future : futures)
          optimized.add(awaitModule(future));
      } finally {
        workers.shutdownNow();
      }
    }
    return design.withModules(optimized).retainReachable();
  }

  private static HdlModule awaitModule(Future<HdlModule> future) throws OptimizerException {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while optimizing modules", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof OptimizerException)
        throw (OptimizerException)e.getCause();
      if (e.getCause() instanceof RuntimeException)
        throw (RuntimeException)e.getCause();
      throw new IllegalStateException(e.getCause());
    }
  }

  /** Alternates propagation, inlining and elimination on one module until a round changes nothing. */
  HdlModule optimizeModule(Design design, HdlModule module) throws OptimizerException {
    logger.debug("Optimizing module {}", module.getName());
    ConstantPropagation propagation = new ConstantPropagation(design, cfg.max_iterations);
    WireInliner inliner = new WireInliner(design);
    DeadLogicEliminator eliminator = new DeadLogicEliminator();
    ObservableSet observable = ObservableSet.empty();
    for (int round = 1;; ++round) {
      if (round > cfg.max_iterations)
        throw new OptimizerException(DiagnosticCategory.NonConvergenceError, module.getName(), "optimization",
                                     "no fixpoint after " + cfg.max_iterations + " rounds");
      ConstantPropagation.Result propagated = propagation.run(module);
      HdlModule current = propagated.module();
      if (cfg.inline_wires)
        current = inliner.run(current);
      DeadLogicEliminator.Result eliminated = eliminator.run(current, observable);
      observable = eliminated.observable();
      current = eliminated.module();
      if (current.equals(module)) {
        logger.debug("Module {} converged after {} rounds", module.getName(), round);
        return module;
      }
      logger.trace("Module {}: round {} changed the module", module.getName(), round);
      module = current;
    }
  }
}
