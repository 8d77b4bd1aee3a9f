package hdlopt.ir;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import hdlopt.ir.Statement.Assign;
import hdlopt.ir.Statement.Case;
import hdlopt.ir.Statement.CaseArm;
import hdlopt.ir.Statement.If;
import hdlopt.ir.Statement.Loop;

/**
 * Utility functions over statement trees. All of them return new trees.
 */
public final class Statements {
  private Statements() {}

  /** Replaces each loop by tripCount copies of its body with the index replaced by literals. */
  public static List<Statement> unroll(List<Statement> statements) {
    List<Statement> result = new ArrayList<>(statements.size());
    for (Statement statement : statements) {
      if (statement instanceof Loop) {
        Loop loop = (Loop)statement;
        List<Statement> body = unroll(loop.body());
        for (int i = 0; i < loop.tripCount(); ++i) {
          Expression indexValue = Expression.lit(loop.indexWidth(), i);
          result.addAll(mapExpressions(body, expr -> expr.substitute(name -> name.equals(loop.indexName()) ? indexValue : null)));
        }
      } else {
        result.add(mapBranches(statement, Statements::unroll));
      }
    }
    return result;
  }

  /** Applies fn to every expression of the tree (conditions, selectors, right-hand sides). */
  public static List<Statement> mapExpressions(List<Statement> statements, UnaryOperator<Expression> fn) {
    List<Statement> result = new ArrayList<>(statements.size());
    for (Statement statement : statements)
      result.add(mapExpressions(statement, fn));
    return result;
  }

  public static Statement mapExpressions(Statement statement, UnaryOperator<Expression> fn) {
    if (statement instanceof Assign) {
      Assign assign = (Assign)statement;
      return new Assign(assign.target(), fn.apply(assign.source()), assign.kind());
    }
    if (statement instanceof If) {
      If ifStmt = (If)statement;
      return new If(fn.apply(ifStmt.cond()), mapExpressions(ifStmt.thenBranch(), fn), mapExpressions(ifStmt.elseBranch(), fn));
    }
    if (statement instanceof Case) {
      Case caseStmt = (Case)statement;
      List<CaseArm> arms = new ArrayList<>();
      for (CaseArm arm : caseStmt.arms())
        arms.add(new CaseArm(arm.pattern(), mapExpressions(arm.body(), fn)));
      return new Case(fn.apply(caseStmt.selector()), arms, caseStmt.defaultBranch().map(body -> mapExpressions(body, fn)));
    }
    Loop loop = (Loop)statement;
    return new Loop(loop.indexName(), loop.indexWidth(), loop.tripCount(), mapExpressions(loop.body(), fn));
  }

  /** Renames assignment targets. */
  public static List<Statement> mapTargets(List<Statement> statements, UnaryOperator<String> fn) {
    List<Statement> result = new ArrayList<>(statements.size());
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        result.add(new Assign(fn.apply(assign.target()), assign.source(), assign.kind()));
      } else {
        result.add(mapBranches(statement, branch -> mapTargets(branch, fn)));
      }
    }
    return result;
  }

  /** Rebuilds a compound statement with each nested branch list transformed by fn. Assignments are returned as is. */
  public static Statement mapBranches(Statement statement, UnaryOperator<List<Statement>> fn) {
    if (statement instanceof If) {
      If ifStmt = (If)statement;
      return new If(ifStmt.cond(), fn.apply(ifStmt.thenBranch()), fn.apply(ifStmt.elseBranch()));
    }
    if (statement instanceof Case) {
      Case caseStmt = (Case)statement;
      List<CaseArm> arms = new ArrayList<>();
      for (CaseArm arm : caseStmt.arms())
        arms.add(new CaseArm(arm.pattern(), fn.apply(arm.body())));
      return new Case(caseStmt.selector(), arms, caseStmt.defaultBranch().map(fn));
    }
    if (statement instanceof Loop) {
      Loop loop = (Loop)statement;
      return new Loop(loop.indexName(), loop.indexWidth(), loop.tripCount(), fn.apply(loop.body()));
    }
    return statement;
  }

  /** Visits all assignments in source order. */
  public static void forEachAssign(List<Statement> statements, Consumer<Assign> consumer) {
    for (Statement statement : statements) {
      if (statement instanceof Assign)
        consumer.accept((Assign)statement);
      else
        statement.branches().forEach(branch -> forEachAssign(branch, consumer));
    }
  }

  /** Targets of all assignments, in first-assignment order. */
  public static Set<String> assignedTargets(List<Statement> statements) {
    Set<String> result = new LinkedHashSet<>();
    forEachAssign(statements, assign -> result.add(assign.target()));
    return result;
  }

  /** Signals read anywhere in the tree, including conditions and selectors. */
  public static Set<String> readSignals(List<Statement> statements) {
    Set<String> result = new LinkedHashSet<>();
    collectReads(statements, result);
    return result;
  }

  private static void collectReads(List<Statement> statements, Set<String> out) {
    for (Statement statement : statements) {
      statement.expressions().forEach(expr -> out.addAll(expr.readSignals()));
      statement.branches().forEach(branch -> collectReads(branch, out));
    }
  }

  /** Instances whose outputs are read anywhere in the tree. */
  public static Set<String> readInstances(List<Statement> statements) {
    Set<String> result = new LinkedHashSet<>();
    for (Statement statement : statements) {
      statement.expressions().forEach(expr -> result.addAll(expr.readInstances()));
      statement.branches().forEach(branch -> result.addAll(readInstances(branch)));
    }
    return result;
  }

  /**
   * Reads that influence the value assigned to target: right-hand sides of its assignments plus the
   * conditions and selectors enclosing them.
   */
  public static Set<String> readsFor(List<Statement> statements, String target) {
    Set<String> result = new LinkedHashSet<>();
    collectReadsFor(statements, target, new ArrayList<>(), result);
    return result;
  }

  private static void collectReadsFor(List<Statement> statements, String target, List<Expression> enclosing, Set<String> out) {
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        if (assign.target().equals(target)) {
          out.addAll(assign.source().readSignals());
          enclosing.forEach(cond -> out.addAll(cond.readSignals()));
        }
        continue;
      }
      enclosing.addAll(statement.expressions());
      statement.branches().forEach(branch -> collectReadsFor(branch, target, enclosing, out));
      for (int i = 0; i < statement.expressions().size(); ++i)
        enclosing.remove(enclosing.size() - 1);
    }
  }

  /** Same as {@link #readsFor(List, String)}, but for instance output references. */
  public static Set<String> instanceReadsFor(List<Statement> statements, String target) {
    Set<String> result = new LinkedHashSet<>();
    collectInstanceReadsFor(statements, target, new ArrayList<>(), result);
    return result;
  }

  private static void collectInstanceReadsFor(List<Statement> statements, String target, List<Expression> enclosing, Set<String> out) {
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        if (assign.target().equals(target)) {
          out.addAll(assign.source().readInstances());
          enclosing.forEach(cond -> out.addAll(cond.readInstances()));
        }
        continue;
      }
      enclosing.addAll(statement.expressions());
      statement.branches().forEach(branch -> collectInstanceReadsFor(branch, target, enclosing, out));
      for (int i = 0; i < statement.expressions().size(); ++i)
        enclosing.remove(enclosing.size() - 1);
    }
  }

  /** Removes assignments whose target fails the filter; compound statements left without assignments are dropped. */
  public static List<Statement> retainTargets(List<Statement> statements, Predicate<String> keep) {
    List<Statement> result = new ArrayList<>(statements.size());
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        if (keep.test(((Assign)statement).target()))
          result.add(statement);
        continue;
      }
      Statement pruned = mapBranches(statement, branch -> retainTargets(branch, keep));
      if (!assignedTargets(List.of(pruned)).isEmpty())
        result.add(pruned);
    }
    return result;
  }
}
