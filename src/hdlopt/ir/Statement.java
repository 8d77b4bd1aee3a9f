package hdlopt.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statement inside a process block. Control flow is a recursive tree of If/Case/Loop nodes.
 */
public interface Statement {

  enum AssignKind {
    blocking("="),
    nonBlocking("<=");

    public final String symbol;
    private AssignKind(String symbol) { this.symbol = symbol; }
  }

  /** Expressions read directly by this statement (conditions, selectors, right-hand sides), excluding nested statements. */
  List<Expression> expressions();

  /** Nested statement lists, in source order. */
  List<List<Statement>> branches();

  record Assign(String target, Expression source, AssignKind kind) implements Statement {
    public List<Expression> expressions() { return List.of(source); }
    public List<List<Statement>> branches() { return List.of(); }
  }

  /** If statement. An absent else branch is an empty list. */
  record If(Expression cond, List<Statement> thenBranch, List<Statement> elseBranch) implements Statement {
    public If {
      thenBranch = List.copyOf(thenBranch);
      elseBranch = List.copyOf(elseBranch);
    }
    public List<Expression> expressions() { return List.of(cond); }
    public List<List<Statement>> branches() { return List.of(thenBranch, elseBranch); }
  }

  record CaseArm(CasePattern pattern, List<Statement> body) {
    public CaseArm { body = List.copyOf(body); }
  }

  /** Case statement with first-match-wins arms and an optional default. */
  record Case(Expression selector, List<CaseArm> arms, Optional<List<Statement>> defaultBranch) implements Statement {
    public Case {
      arms = List.copyOf(arms);
      defaultBranch = defaultBranch.map(List::copyOf);
    }
    public List<Expression> expressions() { return List.of(selector); }
    public List<List<Statement>> branches() {
      List<List<Statement>> result = new ArrayList<>();
      arms.forEach(arm -> result.add(arm.body()));
      defaultBranch.ifPresent(result::add);
      return result;
    }
  }

  /** Bounded loop with a compile-time constant trip count; the index counts 0..tripCount-1. */
  record Loop(String indexName, int indexWidth, int tripCount, List<Statement> body) implements Statement {
    public Loop {
      if (tripCount < 0)
        throw new IllegalArgumentException("loop trip count must not be negative");
      if (indexWidth < 1)
        throw new IllegalArgumentException("loop index width must be positive");
      body = List.copyOf(body);
    }
    public List<Expression> expressions() { return List.of(); }
    public List<List<Statement>> branches() { return List.of(body); }
  }

  // Factories

  static Assign blocking(String target, Expression source) { return new Assign(target, source, AssignKind.blocking); }
  static Assign nonBlocking(String target, Expression source) { return new Assign(target, source, AssignKind.nonBlocking); }
  static If ifThen(Expression cond, Statement... thenBranch) { return new If(cond, List.of(thenBranch), List.of()); }
  static If ifElse(Expression cond, List<Statement> thenBranch, List<Statement> elseBranch) { return new If(cond, thenBranch, elseBranch); }
  static CaseArm arm(String pattern, Statement... body) { return new CaseArm(CasePattern.parse(pattern), List.of(body)); }
}
