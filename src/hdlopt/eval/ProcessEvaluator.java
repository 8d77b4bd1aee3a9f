package hdlopt.eval;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import hdlopt.ir.BitVector;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Statement;
import hdlopt.ir.Statement.Assign;
import hdlopt.ir.Statement.AssignKind;
import hdlopt.ir.Statement.Case;
import hdlopt.ir.Statement.CaseArm;
import hdlopt.ir.Statement.If;
import hdlopt.ir.Statement.Loop;
import hdlopt.ir.WidthResolver;

/**
 * Executes a single evaluation of a process block.
 * <p>
 * Blocking assignments update the environment immediately, so later statements see the new value.
 * Non-blocking assignments compute their value immediately but are applied together after the whole body has run;
 *   reads within the same evaluation still observe the value from before the evaluation.
 * <p>
 * This is the reference semantics for one trigger of a process, not an event-driven simulator.
 */
public class ProcessEvaluator {
  private final WidthResolver widths;

  public ProcessEvaluator(WidthResolver widths) { this.widths = widths; }

  /**
   * Runs the process body once.
   * @param before values of all signals the body reads, before the evaluation
   * @return values after the evaluation, including unchanged inputs
   */
  public Map<String, BitVector> run(ProcessBlock process, Map<String, BitVector> before) {
    Map<String, BitVector> env = new LinkedHashMap<>(before);
    Map<String, BitVector> deferred = new LinkedHashMap<>();
    execute(process.body(), env, deferred, new HashMap<>());
    env.putAll(deferred);
    return env;
  }

  private void execute(List<Statement> statements, Map<String, BitVector> env, Map<String, BitVector> deferred,
                       Map<String, BitVector> loopIndices) {
    WidthResolver scope = widths;
    for (Map.Entry<String, BitVector> index : loopIndices.entrySet())
      scope = scope.withLocal(index.getKey(), index.getValue().width());
    Evaluator evaluator = new Evaluator(scope, name -> {
      BitVector index = loopIndices.get(name);
      return index != null ? Optional.of(index) : Optional.ofNullable(env.get(name));
    });
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        BitVector value = evaluator.evaluateAssigned(assign.source(), scope.signalWidth(assign.target()));
        if (assign.kind() == AssignKind.blocking)
          env.put(assign.target(), value);
        else
          deferred.put(assign.target(), value);
      } else if (statement instanceof If) {
        If ifStmt = (If)statement;
        execute(evaluator.evaluateCondition(ifStmt.cond()) ? ifStmt.thenBranch() : ifStmt.elseBranch(), env, deferred, loopIndices);
      } else if (statement instanceof Case) {
        Case caseStmt = (Case)statement;
        BitVector selector = evaluator.evaluate(caseStmt.selector(), 0);
        Optional<List<Statement>> taken = caseStmt.arms()
                                              .stream()
                                              .filter(arm -> arm.pattern().matches(selector))
                                              .findFirst()
                                              .map(CaseArm::body);
        if (taken.isEmpty())
          taken = caseStmt.defaultBranch();
        if (taken.isPresent())
          execute(taken.get(), env, deferred, loopIndices);
      } else if (statement instanceof Loop) {
        Loop loop = (Loop)statement;
        for (int i = 0; i < loop.tripCount(); ++i) {
          Map<String, BitVector> innerIndices = new HashMap<>(loopIndices);
          innerIndices.put(loop.indexName(), BitVector.of(loop.indexWidth(), i));
          execute(loop.body(), env, deferred, innerIndices);
        }
      }
    }
  }
}
