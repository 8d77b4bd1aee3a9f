package hdlopt.drc;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.diag.DiagnosticCollector;
import hdlopt.diag.Severity;
import hdlopt.emit.ExpressionPrinter;
import hdlopt.eval.CaseCoverage;
import hdlopt.ir.BitVector;
import hdlopt.ir.CasePattern;
import hdlopt.ir.Design;
import hdlopt.ir.Expression;
import hdlopt.ir.Expression.Literal;
import hdlopt.ir.Expression.SignalRef;
import hdlopt.ir.Expression.Unary;
import hdlopt.ir.Expression.UnaryOp;
import hdlopt.ir.HdlModule;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Sensitivity;
import hdlopt.ir.Statement;
import hdlopt.ir.Statement.Assign;
import hdlopt.ir.Statement.Case;
import hdlopt.ir.Statement.CaseArm;
import hdlopt.ir.Statement.If;
import hdlopt.ir.Statement.Loop;
import hdlopt.ir.Statements;
import hdlopt.ir.WidthResolver;
import hdlopt.ui.OptimizerConfig;

/**
 * Design rule checks on the control flow of process blocks:
 * <ul>
 * <li>LatchInferred: a combinational process leaves a target unassigned on some path. The diagnostic names the
 *     disjunction of the path predicates under which the previous value is held.</li>
 * <li>AmbiguousCaseOverlap: two arms of a case statement match a common selector encoding but have different bodies.</li>
 * <li>SensitivityMismatch: the sensitivity list does not describe what actually triggers the process.</li>
 * </ul>
 */
public class CompletenessAnalyzer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Design design;
  private final boolean strictCaseOverlap;
  private final int maxPathsPerSignal;

  public CompletenessAnalyzer(Design design, OptimizerConfig config) {
    this.design = design;
    this.strictCaseOverlap = config.strict_case_overlap;
    this.maxPathsPerSignal = config.max_paths_per_signal;
  }

  private static class PathLimitExceeded extends Exception {
    private static final long serialVersionUID = 1L;
  }

  public void analyze(HdlModule module, DiagnosticCollector diagnostics) {
    logger.debug("Module {}: completeness analysis of {} processes", module.getName(), module.getProcesses().size());
    for (ProcessBlock process : module.getProcesses()) {
      if (process.isCombinational())
        checkLatches(module, process, diagnostics);
      checkCaseOverlaps(module, process, process.body(), diagnostics);
      checkSensitivity(module, process, diagnostics);
    }
  }

  private void checkLatches(HdlModule module, ProcessBlock process, DiagnosticCollector diagnostics) {
    for (String target : process.assignedTargets()) {
      Optional<List<PathPredicate>> paths = unassignedPaths(module, process, target);
      if (paths.isEmpty()) {
        diagnostics.warn(DiagnosticCategory.AnalysisLimitExceeded, module.getName(), target,
                         "latch analysis of " + target + " in process " + process.name() + " skipped, more than " + maxPathsPerSignal +
                             " paths");
        continue;
      }
      if (!paths.get().isEmpty())
        diagnostics.warn(DiagnosticCategory.LatchInferred, module.getName(), target,
                         target + " holds its previous value in process " + process.name() + " when " +
                             PathPredicate.disjunction(paths.get()));
    }
  }

  /**
   * Enumerates the control-flow paths of the process on which target is never assigned.
   * Contradictory decisions prune a path, literal conditions and selectors only follow the branch they take.
   * @return the distinct path predicates, or an empty Optional if more than max_paths_per_signal paths were open at once
   */
  public Optional<List<PathPredicate>> unassignedPaths(HdlModule module, ProcessBlock process, String target) {
    try {
      List<PathPredicate> open = walk(Statements.unroll(process.body()), target, List.of(PathPredicate.TRUE), design.scope(module));
      return Optional.of(new ArrayList<>(new LinkedHashSet<>(open)));
    } catch (PathLimitExceeded e) {
      return Optional.empty();
    }
  }

  private List<PathPredicate> walk(List<Statement> statements, String target, List<PathPredicate> open, WidthResolver scope)
      throws PathLimitExceeded {
    for (Statement statement : statements) {
      if (open.isEmpty())
        break;
      if (statement instanceof Assign) {
        if (((Assign)statement).target().equals(target))
          open = List.of();
      } else if (statement instanceof If) {
        If ifStmt = (If)statement;
        if (ifStmt.cond() instanceof Literal) {
          open = walk(((Literal)ifStmt.cond()).value().isTrue() ? ifStmt.thenBranch() : ifStmt.elseBranch(), target, open, scope);
          continue;
        }
        String cond = ExpressionPrinter.print(ifStmt.cond());
        List<PathPredicate> next = new ArrayList<>(walk(ifStmt.thenBranch(), target, extend(open, new PathPredicate.Decision(cond, true)), scope));
        next.addAll(walk(ifStmt.elseBranch(), target, extend(open, new PathPredicate.Decision(cond, false)), scope));
        open = next;
      } else if (statement instanceof Case) {
        open = walkCase((Case)statement, target, open, scope);
      } else if (statement instanceof Loop) {
        open = walk(Statements.unroll(List.of(statement)), target, open, scope);
      }
      if (open.size() > maxPathsPerSignal)
        throw new PathLimitExceeded();
    }
    return open;
  }

  private List<PathPredicate> walkCase(Case caseStmt, String target, List<PathPredicate> open, WidthResolver scope)
      throws PathLimitExceeded {
    if (caseStmt.selector() instanceof Literal) {
      BitVector selector = ((Literal)caseStmt.selector()).value();
      Optional<List<Statement>> taken =
          caseStmt.arms().stream().filter(arm -> arm.pattern().matches(selector)).findFirst().map(CaseArm::body);
      if (taken.isEmpty())
        taken = caseStmt.defaultBranch();
      return taken.isPresent() ? walk(taken.get(), target, open, scope) : open;
    }
    String selector = ExpressionPrinter.print(caseStmt.selector());
    List<PathPredicate> next = new ArrayList<>();
    List<PathPredicate> fallThrough = open;
    List<CasePattern> patterns = new ArrayList<>();
    for (CaseArm arm : caseStmt.arms()) {
      PathPredicate.Decision matches = new PathPredicate.Decision(matchText(selector, arm.pattern()), true);
      next.addAll(walk(arm.body(), target, extend(open, matches), scope));
      fallThrough = extend(fallThrough, matches.negate());
      patterns.add(arm.pattern());
    }
    if (caseStmt.defaultBranch().isPresent())
      next.addAll(walk(caseStmt.defaultBranch().get(), target, fallThrough, scope));
    else if (!CaseCoverage.isComplete(patterns, caseStmt.selector().width(scope)))
      next.addAll(fallThrough);
    return next;
  }

  private static String matchText(String selector, CasePattern pattern) {
    return selector + (pattern.hasDontCare() ? " ==? " : " == ") + pattern;
  }

  private static List<PathPredicate> extend(List<PathPredicate> open, PathPredicate.Decision decision) {
    List<PathPredicate> result = new ArrayList<>(open.size());
    for (PathPredicate path : open) {
      PathPredicate extended = path.and(decision);
      if (extended != null)
        result.add(extended);
    }
    return result;
  }

  private void checkCaseOverlaps(HdlModule module, ProcessBlock process, List<Statement> statements, DiagnosticCollector diagnostics) {
    for (Statement statement : statements) {
      if (statement instanceof Case) {
        Case caseStmt = (Case)statement;
        List<CaseArm> arms = caseStmt.arms();
        for (int i = 0; i < arms.size(); ++i) {
          for (int j = i + 1; j < arms.size(); ++j) {
            CaseArm first = arms.get(i);
            CaseArm second = arms.get(j);
            if (first.pattern().overlaps(second.pattern()) && !first.body().equals(second.body()))
              diagnostics.report(DiagnosticCategory.AmbiguousCaseOverlap, strictCaseOverlap ? Severity.error : Severity.warning,
                                 module.getName(), process.name(),
                                 "case (" + ExpressionPrinter.print(caseStmt.selector()) + "): patterns " + first.pattern() + " and " +
                                     second.pattern() + " overlap with different branches; the first listed wins");
          }
        }
      }
      statement.branches().forEach(branch -> checkCaseOverlaps(module, process, branch, diagnostics));
    }
  }

  private void checkSensitivity(HdlModule module, ProcessBlock process, DiagnosticCollector diagnostics) {
    Sensitivity sensitivity = process.sensitivity();
    if (sensitivity.allReads())
      return;
    String moduleName = module.getName();
    Set<String> reads = signalReads(module, process.body());
    if (!sensitivity.hasEdges()) {
      List<String> missing = reads.stream().filter(read -> !sensitivity.signals().contains(read)).collect(Collectors.toList());
      if (!missing.isEmpty())
        diagnostics.warn(DiagnosticCategory.SensitivityMismatch, moduleName, process.name(),
                         "process " + process.name() + " reads " + String.join(", ", missing) + ", which its sensitivity list omits");
      return;
    }
    List<String> levels = sensitivity.entries()
                              .stream()
                              .filter(entry -> entry.edge() == Sensitivity.Edge.level)
                              .map(Sensitivity.Entry::signal)
                              .collect(Collectors.toList());
    if (!levels.isEmpty())
      diagnostics.warn(DiagnosticCategory.SensitivityMismatch, moduleName, process.name(),
                       "process " + process.name() + " mixes edge-triggered entries with level-sensitive " + String.join(", ", levels));
    List<String> edges = sensitivity.entries()
                             .stream()
                             .filter(entry -> entry.edge() != Sensitivity.Edge.level)
                             .map(Sensitivity.Entry::signal)
                             .collect(Collectors.toList());
    List<String> unreferenced = edges.stream().filter(edge -> !reads.contains(edge)).collect(Collectors.toList());
    if (unreferenced.size() > 1)
      diagnostics.warn(DiagnosticCategory.SensitivityMismatch, moduleName, process.name(),
                       "process " + process.name() + " has ambiguous clock: edge signals " + String.join(", ", unreferenced) +
                           " are never read");
    Set<String> dataReads = new LinkedHashSet<>();
    collectDataReads(process.body(), dataReads);
    for (String edge : edges) {
      if (dataReads.contains(edge))
        diagnostics.warn(DiagnosticCategory.SensitivityMismatch, moduleName, process.name(),
                         "edge signal " + edge + " of process " + process.name() + " is read outside of an if condition");
    }
  }

  /** Signals read by the statements; loop indices are not signals and are left out. */
  private static Set<String> signalReads(HdlModule module, List<Statement> statements) {
    return Statements.readSignals(statements)
        .stream()
        .filter(name -> module.getSignal(name).isPresent())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /** Reads other than an if condition that consists of a signal or its negation. */
  private static void collectDataReads(List<Statement> statements, Set<String> out) {
    for (Statement statement : statements) {
      if (statement instanceof If && isDirectCondition(((If)statement).cond())) {
        statement.branches().forEach(branch -> collectDataReads(branch, out));
        continue;
      }
      statement.expressions().forEach(expr -> out.addAll(expr.readSignals()));
      statement.branches().forEach(branch -> collectDataReads(branch, out));
    }
  }

  private static boolean isDirectCondition(Expression cond) {
    if (cond instanceof SignalRef)
      return true;
    if (cond instanceof Unary) {
      Unary unary = (Unary)cond;
      return (unary.op() == UnaryOp.not || unary.op() == UnaryOp.logicalNot) && unary.operand() instanceof SignalRef;
    }
    return false;
  }
}
