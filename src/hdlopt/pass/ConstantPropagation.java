package hdlopt.pass;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.diag.OptimizerException;
import hdlopt.eval.CaseCoverage;
import hdlopt.eval.Evaluator;
import hdlopt.eval.ExpressionFolder;
import hdlopt.ir.BitVector;
import hdlopt.ir.CasePattern;
import hdlopt.ir.ContinuousAssignment;
import hdlopt.ir.Design;
import hdlopt.ir.Expression;
import hdlopt.ir.Expression.Literal;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Instance;
import hdlopt.ir.Port;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Signal;
import hdlopt.ir.StableIndex;
import hdlopt.ir.Statement;
import hdlopt.ir.Statement.Assign;
import hdlopt.ir.Statement.Case;
import hdlopt.ir.Statement.CaseArm;
import hdlopt.ir.Statement.If;
import hdlopt.ir.Statement.Loop;
import hdlopt.ir.Statements;
import hdlopt.ir.WidthResolver;

/**
 * Monotone fixpoint over "signal s is known to hold value V".
 * <p>
 * A signal becomes constant once every driver reaching it resolves to the same literal under the constants known so far.
 * Process drivers only count if the signal is assigned on every path that the known constants leave reachable.
 * Inside a process, reads of that process's own targets are never replaced by their constants.
 * Instances are specialized: the instantiated module is propagated with the constant input bindings fixed.
 *   If every output becomes constant the instance is replaced by constant assignments.
 * Once a signal is constant it is never revisited; a round without new constants ends the analysis.
 */
public class ConstantPropagation {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Outcome of {@link #run(HdlModule)}. */
  public record Result(HdlModule module, Map<String, BitVector> constants, boolean changed) {}

  /** Constants of one module: signal values plus known instance output values. */
  public record Analysis(Map<String, BitVector> signals, Map<String, Map<String, BitVector>> instanceOutputs) {}

  private record SpecializationKey(String module, Map<String, BitVector> inputs) {}

  private final Design design;
  private final int maxIterations;
  /** Output constants of specialized modules, keyed by module and constant inputs. */
  private final Map<SpecializationKey, Map<String, BitVector>> specializations;

  public ConstantPropagation(Design design, int maxIterations) { this(design, maxIterations, new ConcurrentHashMap<>()); }

  private ConstantPropagation(Design design, int maxIterations, Map<SpecializationKey, Map<String, BitVector>> specializations) {
    this.design = design;
    this.maxIterations = maxIterations;
    this.specializations = specializations;
  }

  /** Propagates constants through the module and rewrites it with all known constants substituted. */
  public Result run(HdlModule module) throws OptimizerException {
    Analysis analysis = analyze(module, Map.of());
    HdlModule rewritten = rewrite(module, analysis);
    boolean changed = !rewritten.equals(module);
    if (changed)
      logger.debug("Module {}: {} constant signals", module.getName(), analysis.signals().size());
    return new Result(rewritten, analysis.signals(), changed);
  }

  /**
   * Computes the constants of a module.
   * @param fixedInputs values of input ports that are tied to constants by the instantiating module
   * @throws OptimizerException NonConvergenceError if the iteration cap is exceeded
   */
  public Analysis analyze(HdlModule module, Map<String, BitVector> fixedInputs) throws OptimizerException {
    Map<String, BitVector> known = new LinkedHashMap<>(fixedInputs);
    Map<String, Map<String, BitVector>> instanceOutputs = new LinkedHashMap<>();
    Map<String, Map<String, BitVector>> specializedWith = new LinkedHashMap<>();
    WidthResolver scope = design.scope(module);
    Evaluator.Values values = valuesOf(known, instanceOutputs);

    for (int round = 1;; ++round) {
      if (round > maxIterations)
        throw new OptimizerException(DiagnosticCategory.NonConvergenceError, module.getName(), "constant propagation",
                                     "no fixpoint after " + maxIterations + " rounds");
      boolean progress = false;
      ExpressionFolder folder = new ExpressionFolder(scope, values);

      for (Instance instance : module.getInstances()) {
        Map<String, BitVector> inputs = constantInputs(instance, folder);
        if (inputs.equals(specializedWith.get(instance.name())))
          continue;
        specializedWith.put(instance.name(), inputs);
        Map<String, BitVector> outputs = specialize(instance.moduleName(), inputs);
        if (!outputs.equals(instanceOutputs.getOrDefault(instance.name(), Map.of()))) {
          instanceOutputs.put(instance.name(), outputs);
          progress = true;
        }
      }

      for (Signal signal : module.getSignals().values()) {
        if (known.containsKey(signal.name()) || isInput(module, signal.name()))
          continue;
        Optional<BitVector> value = resolveSignal(module, signal, folder, values, scope, instanceOutputs);
        if (value.isPresent()) {
          known.put(signal.name(), value.get());
          progress = true;
          logger.trace("Module {}: {} = {} (round {})", module.getName(), signal.name(), value.get(), round);
        }
      }
      if (!progress)
        break;
    }
    return new Analysis(known, instanceOutputs);
  }

  private static boolean isInput(HdlModule module, String name) {
    return module.getPort(name).map(port -> port.direction() != Port.Direction.out).orElse(false);
  }

  private static Evaluator.Values valuesOf(Map<String, BitVector> known, Map<String, Map<String, BitVector>> instanceOutputs) {
    return new Evaluator.Values() {
      @Override
      public Optional<BitVector> signal(String name) {
        return Optional.ofNullable(known.get(name));
      }
      @Override
      public Optional<BitVector> instanceOutput(String instance, String port) {
        return Optional.ofNullable(instanceOutputs.getOrDefault(instance, Map.of()).get(port));
      }
    };
  }

  /**
   * Hides the targets of a process from its own reads.
   * A constant target holds its value at the end of the process; a read before the last blocking assignment sees another value.
   */
  private static Evaluator.Values excluding(Evaluator.Values values, Set<String> hidden) {
    return new Evaluator.Values() {
      @Override
      public Optional<BitVector> signal(String name) {
        return hidden.contains(name) ? Optional.empty() : values.signal(name);
      }
      @Override
      public Optional<BitVector> instanceOutput(String instance, String port) {
        return values.instanceOutput(instance, port);
      }
    };
  }

  /** Input bindings of the instance that fold to literals under the current constants. */
  private Map<String, BitVector> constantInputs(Instance instance, ExpressionFolder folder) {
    HdlModule target = design.getModule(instance.moduleName()).orElseThrow();
    Map<String, BitVector> inputs = new LinkedHashMap<>();
    for (Map.Entry<String, Expression> binding : instance.inputs().entrySet()) {
      int width = target.getPort(binding.getKey()).orElseThrow().width();
      Expression folded = folder.foldAssigned(binding.getValue(), width);
      if (folded instanceof Literal)
        inputs.put(binding.getKey(), ((Literal)folded).value());
    }
    return inputs;
  }

  /**
   * Propagates constants through a module definition with some inputs fixed; returns the output ports that became constant.
   * Outputs that do not depend on the unfixed inputs can become constant too.
   */
  private Map<String, BitVector> specialize(String moduleName, Map<String, BitVector> inputs) throws OptimizerException {
    SpecializationKey key = new SpecializationKey(moduleName, inputs);
    Map<String, BitVector> cached = specializations.get(key);
    if (cached != null)
      return cached;
    HdlModule target = design.getModule(moduleName).orElseThrow();
    Analysis inner = new ConstantPropagation(design, maxIterations, specializations).analyze(target, inputs);
    Map<String, BitVector> outputs = new LinkedHashMap<>();
    target.outputPorts().forEach(port -> {
      BitVector value = inner.signals().get(port.name());
      if (value != null)
        outputs.put(port.name(), value);
    });
    logger.debug("Specialized {} with inputs {}: constant outputs {}", moduleName, inputs, outputs);
    specializations.put(key, outputs);
    return outputs;
  }

  private Optional<BitVector> resolveSignal(HdlModule module, Signal signal, ExpressionFolder folder, Evaluator.Values values,
                                            WidthResolver scope, Map<String, Map<String, BitVector>> instanceOutputs) {
    BitVector value = null;
    boolean anyDriver = false;
    for (ContinuousAssignment assignment : module.getAssignments()) {
      if (!assignment.target().equals(signal.name()))
        continue;
      anyDriver = true;
      Expression folded = folder.foldAssigned(assignment.source(), signal.width());
      if (!(folded instanceof Literal))
        return Optional.empty();
      BitVector driven = ((Literal)folded).value();
      if (value != null && !value.equals(driven))
        return Optional.empty();
      value = driven;
    }
    for (Instance instance : module.getInstances()) {
      for (Map.Entry<String, String> binding : instance.outputs().entrySet()) {
        if (!binding.getValue().equals(signal.name()))
          continue;
        anyDriver = true;
        BitVector driven = instanceOutputs.getOrDefault(instance.name(), Map.of()).get(binding.getKey());
        if (driven == null || (value != null && !value.equals(driven.resize(signal.width()))))
          return Optional.empty();
        value = driven.resize(signal.width());
      }
    }
    for (ProcessBlock process : module.getProcesses()) {
      if (!process.assignedTargets().contains(signal.name()))
        continue;
      anyDriver = true;
      ExpressionFolder processFolder = new ExpressionFolder(scope, excluding(values, process.assignedTargets()));
      PathValue result = walk(Statements.unroll(process.body()), signal, PathValue.UNASSIGNED, scope, processFolder);
      if (result.maybeUnassigned || result.maybeVariable || result.values.size() != 1)
        return Optional.empty();
      BitVector driven = result.values.iterator().next();
      if (value != null && !value.equals(driven))
        return Optional.empty();
      value = driven;
    }
    return anyDriver ? Optional.ofNullable(value) : Optional.empty();
  }

  /**
   * Abstract value of a target at some point of a process body, merged over all reachable paths.
   * @param maybeUnassigned some path reaches this point without assigning the target
   * @param maybeVariable some path assigned a value that did not fold to a literal
   * @param values the literal values assigned on the remaining paths
   */
  private record PathValue(boolean maybeUnassigned, boolean maybeVariable, Set<BitVector> values) {
    static final PathValue UNASSIGNED = new PathValue(true, false, Set.of());

    PathValue merge(PathValue other) {
      Set<BitVector> union = new HashSet<>(values);
      union.addAll(other.values);
      return new PathValue(maybeUnassigned || other.maybeUnassigned, maybeVariable || other.maybeVariable, union);
    }
  }

  private PathValue walk(List<Statement> statements, Signal target, PathValue state, WidthResolver scope, ExpressionFolder folder) {
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        if (!assign.target().equals(target.name()))
          continue;
        Expression folded = folder.foldAssigned(assign.source(), target.width());
        state = folded instanceof Literal ? new PathValue(false, false, Set.of(((Literal)folded).value()))
                                          : new PathValue(false, true, Set.of());
      } else if (statement instanceof If) {
        If ifStmt = (If)statement;
        Expression cond = folder.fold(ifStmt.cond());
        if (cond instanceof Literal)
          state = walk(((Literal)cond).value().isTrue() ? ifStmt.thenBranch() : ifStmt.elseBranch(), target, state, scope, folder);
        else
          state = walk(ifStmt.thenBranch(), target, state, scope, folder).merge(walk(ifStmt.elseBranch(), target, state, scope, folder));
      } else if (statement instanceof Case) {
        Case caseStmt = (Case)statement;
        Expression selector = folder.fold(caseStmt.selector());
        if (selector instanceof Literal) {
          BitVector selectorValue = ((Literal)selector).value();
          Optional<List<Statement>> taken =
              caseStmt.arms().stream().filter(arm -> arm.pattern().matches(selectorValue)).findFirst().map(CaseArm::body);
          if (taken.isEmpty())
            taken = caseStmt.defaultBranch();
          // No arm and no default: the previous value is held.
          if (taken.isPresent())
            state = walk(taken.get(), target, state, scope, folder);
        } else {
          PathValue merged = null;
          for (CaseArm arm : caseStmt.arms()) {
            PathValue armState = walk(arm.body(), target, state, scope, folder);
            merged = merged == null ? armState : merged.merge(armState);
          }
          if (caseStmt.defaultBranch().isPresent()) {
            PathValue defaultState = walk(caseStmt.defaultBranch().get(), target, state, scope, folder);
            merged = merged == null ? defaultState : merged.merge(defaultState);
          } else if (!CaseCoverage.isComplete(patterns(caseStmt), selector.width(scope))) {
            merged = merged == null ? state : merged.merge(state);
          }
          state = merged == null ? state : merged;
        }
      } else if (statement instanceof Loop) {
        state = walk(Statements.unroll(List.of(statement)), target, state, scope, folder);
      }
    }
    return state;
  }

  static List<CasePattern> patterns(Case caseStmt) {
    List<CasePattern> result = new ArrayList<>();
    caseStmt.arms().forEach(arm -> result.add(arm.pattern()));
    return result;
  }

  /** Substitutes the analysis results into the module. */
  HdlModule rewrite(HdlModule module, Analysis analysis) {
    WidthResolver scope = design.scope(module);
    ExpressionFolder folder = new ExpressionFolder(scope, valuesOf(analysis.signals(), analysis.instanceOutputs()));

    List<ContinuousAssignment> assignments = new ArrayList<>();
    for (ContinuousAssignment assignment : module.getAssignments())
      assignments.add(assignment.withSource(folder.foldAssigned(assignment.source(), scope.signalWidth(assignment.target()))));

    List<Instance> instances = new ArrayList<>();
    for (Instance instance : module.getInstances()) {
      HdlModule target = design.getModule(instance.moduleName()).orElseThrow();
      Map<String, BitVector> outputs = analysis.instanceOutputs().getOrDefault(instance.name(), Map.of());
      if (target.outputPorts().allMatch(port -> outputs.containsKey(port.name()))) {
        int k = 0;
        for (Map.Entry<String, String> binding : instance.outputs().entrySet()) {
          BitVector value = outputs.get(binding.getKey()).resize(scope.signalWidth(binding.getValue()));
          assignments.add(new ContinuousAssignment(binding.getValue(), new Literal(value), instance.index().nested(StableIndex.of(k++))));
        }
        logger.debug("Module {}: instance {} of {} replaced by constants {}", module.getName(), instance.name(), instance.moduleName(),
                     outputs);
        continue;
      }
      Map<String, Expression> inputs = new LinkedHashMap<>();
      instance.inputs().forEach(
          (port, expr) -> inputs.put(port, folder.foldAssigned(expr, target.getPort(port).orElseThrow().width())));
      instances.add(instance.withInputs(inputs));
    }

    List<ProcessBlock> processes = new ArrayList<>();
    for (ProcessBlock process : module.getProcesses()) {
      Evaluator.Values visible = excluding(valuesOf(analysis.signals(), analysis.instanceOutputs()), process.assignedTargets());
      processes.add(process.withBody(foldStatements(process.body(), scope, visible)));
    }

    return module.with(processes, assignments, instances);
  }

  /** Folds every expression of a statement tree, using the target width as context of each right-hand side. */
  static List<Statement> foldStatements(List<Statement> statements, WidthResolver scope, Evaluator.Values values) {
    ExpressionFolder folder = new ExpressionFolder(scope, values);
    List<Statement> result = new ArrayList<>(statements.size());
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        result.add(new Assign(assign.target(), folder.foldAssigned(assign.source(), scope.signalWidth(assign.target())), assign.kind()));
      } else if (statement instanceof If) {
        If ifStmt = (If)statement;
        result.add(new If(folder.fold(ifStmt.cond()), foldStatements(ifStmt.thenBranch(), scope, values),
                          foldStatements(ifStmt.elseBranch(), scope, values)));
      } else if (statement instanceof Case) {
        Case caseStmt = (Case)statement;
        List<CaseArm> arms = new ArrayList<>();
        for (CaseArm arm : caseStmt.arms())
          arms.add(new CaseArm(arm.pattern(), foldStatements(arm.body(), scope, values)));
        result.add(new Case(folder.fold(caseStmt.selector()), arms,
                            caseStmt.defaultBranch().map(body -> foldStatements(body, scope, values))));
      } else if (statement instanceof Loop) {
        Loop loop = (Loop)statement;
        result.add(new Loop(loop.indexName(), loop.indexWidth(), loop.tripCount(),
                            foldStatements(loop.body(), scope.withLocal(loop.indexName(), loop.indexWidth()), values)));
      }
    }
    return result;
  }
}
