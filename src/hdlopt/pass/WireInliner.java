package hdlopt.pass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import hdlopt.eval.Evaluator;
import hdlopt.eval.ExpressionFolder;
import hdlopt.ir.ContinuousAssignment;
import hdlopt.ir.Design;
import hdlopt.ir.Expression;
import hdlopt.ir.Expression.Literal;
import hdlopt.ir.Expression.SignalRef;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Instance;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Signal;
import hdlopt.ir.Statement;
import hdlopt.ir.Statement.Assign;
import hdlopt.ir.Statement.Case;
import hdlopt.ir.Statement.If;
import hdlopt.ir.Statement.Loop;
import hdlopt.ir.Statements;
import hdlopt.ir.WidthResolver;

/**
 * Copy propagation over internal wires.
 * <p>
 * A non-port wire with exactly one continuous driver is replaced by its driving expression in all readers if
 * <ul>
 * <li>the driver is a literal or a plain signal reference, or</li>
 * <li>the wire is read at exactly one site.</li>
 * </ul>
 * The replacement must evaluate identically at every site, and must not be moved into a process block that writes one of
 * the signals it reads. Wires named in a sensitivity list are kept.
 */
public class WireInliner {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Design design;

  public WireInliner(Design design) { this.design = design; }

  /** Returns the module with all inlinable wires substituted and removed; returns the same module if nothing was inlined. */
  public HdlModule run(HdlModule module) {
    HdlModule current = module;
    for (Signal signal : module.getSignals().values()) {
      if (signal.kind() != Signal.Kind.wire || current.isPort(signal.name()))
        continue;
      HdlModule inlined = tryInline(current, signal);
      if (inlined != null) {
        logger.debug("Module {}: inlined wire {}", module.getName(), signal.name());
        current = inlined;
      }
    }
    return current;
  }

  /** A reading site: the context width the wire is evaluated in, and the process the site belongs to (null outside processes). */
  private record Site(int ctx, ProcessBlock process) {}

  private HdlModule tryInline(HdlModule module, Signal wire) {
    String name = wire.name();
    List<ContinuousAssignment> drivers =
        module.getAssignments().stream().filter(assignment -> assignment.target().equals(name)).collect(Collectors.toList());
    if (drivers.size() != 1)
      return null;
    if (module.getInstances().stream().anyMatch(instance -> instance.outputs().containsValue(name)))
      return null;
    if (module.getProcesses().stream().anyMatch(process -> process.sensitivity().signals().contains(name)))
      return null;
    ContinuousAssignment driver = drivers.get(0);
    WidthResolver scope = design.scope(module);
    Expression source = driver.source();
    if (source instanceof Literal)
      source = new Literal(((Literal)source).value().resize(wire.width()));
    if (source.readSignals().contains(name))
      return null;

    List<Site> sites = new ArrayList<>();
    for (ContinuousAssignment assignment : module.getAssignments()) {
      if (assignment != driver)
        collectSites(assignment.source(), scope.signalWidth(assignment.target()), scope, name, null, sites);
    }
    for (Instance instance : module.getInstances()) {
      HdlModule target = design.getModule(instance.moduleName()).orElseThrow();
      instance.inputs().forEach(
          (port, expr) -> collectSites(expr, target.getPort(port).orElseThrow().width(), scope, name, null, sites));
    }
    for (ProcessBlock process : module.getProcesses())
      collectSites(process.body(), scope, name, process, sites);
    if (sites.isEmpty())
      return null;

    boolean copy = source instanceof Literal || source instanceof SignalRef;
    if (!copy && sites.size() != 1)
      return null;
    Set<String> sourceReads = source.readSignals();
    for (Site site : sites) {
      if (!ExpressionFolder.isMovable(source, wire.width(), site.ctx(), scope))
        return null;
      if (site.process() != null && site.process().assignedTargets().stream().anyMatch(sourceReads::contains))
        return null;
    }

    Expression replacement = ExpressionFolder.widen(source, wire.width(), scope);
    UnaryOperator<Expression> substitution =
        expr -> expr.substitute(signal -> signal.equals(name) ? replacement : null);
    List<ContinuousAssignment> assignments = new ArrayList<>();
    for (ContinuousAssignment assignment : module.getAssignments()) {
      if (assignment != driver)
        assignments.add(assignment.withSource(substitution.apply(assignment.source())));
    }
    List<Instance> instances = new ArrayList<>();
    for (Instance instance : module.getInstances()) {
      Map<String, Expression> inputs = new LinkedHashMap<>();
      instance.inputs().forEach((port, expr) -> inputs.put(port, substitution.apply(expr)));
      instances.add(instance.withInputs(inputs));
    }
    List<ProcessBlock> processes = new ArrayList<>();
    for (ProcessBlock process : module.getProcesses())
      processes.add(process.withBody(Statements.mapExpressions(process.body(), substitution)));
    List<Signal> signals = module.getSignals().values().stream().filter(signal -> !signal.name().equals(name)).collect(Collectors.toList());
    return module.with(processes, assignments, instances).withSignals(signals);
  }

  private static void collectSites(List<Statement> statements, WidthResolver scope, String name, ProcessBlock process, List<Site> sites) {
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        collectSites(assign.source(), scope.signalWidth(assign.target()), scope, name, process, sites);
      } else if (statement instanceof If) {
        If ifStmt = (If)statement;
        collectSites(ifStmt.cond(), 0, scope, name, process, sites);
        collectSites(ifStmt.thenBranch(), scope, name, process, sites);
        collectSites(ifStmt.elseBranch(), scope, name, process, sites);
      } else if (statement instanceof Case) {
        Case caseStmt = (Case)statement;
        collectSites(caseStmt.selector(), 0, scope, name, process, sites);
        statement.branches().forEach(branch -> collectSites(branch, scope, name, process, sites));
      } else if (statement instanceof Loop) {
        Loop loop = (Loop)statement;
        collectSites(loop.body(), scope.withLocal(loop.indexName(), loop.indexWidth()), name, process, sites);
      }
    }
  }

  private static void collectSites(Expression expr, int ctx, WidthResolver scope, String name, ProcessBlock process, List<Site> sites) {
    if (expr instanceof SignalRef) {
      if (((SignalRef)expr).name().equals(name))
        sites.add(new Site(ctx, process));
      return;
    }
    List<Expression> children = expr.children();
    if (children.isEmpty())
      return;
    List<Integer> contexts = Evaluator.operandContexts(expr, Math.max(expr.width(scope), ctx), scope);
    for (int i = 0; i < children.size(); ++i)
      collectSites(children.get(i), contexts.get(i), scope, name, process, sites);
  }
}
