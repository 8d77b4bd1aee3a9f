package hdlopt.ir;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Immutable expression tree. Folding and renaming build new trees, never mutate existing ones.
 */
public interface Expression {

  enum UnaryOp {
    not("~"),
    logicalNot("!"),
    negate("-"),
    reduceAnd("&"),
    reduceOr("|"),
    reduceXor("^");

    public final String symbol;
    private UnaryOp(String symbol) { this.symbol = symbol; }

    /** Reductions and logical negation always yield one bit. */
    public boolean isOneBit() { return this != not && this != negate; }
  }

  enum BinaryOp {
    mul("*", 11, true),
    add("+", 10, true),
    sub("-", 10, false),
    shl("<<", 9, false),
    shr(">>", 9, false),
    lt("<", 8, false),
    le("<=", 8, false),
    gt(">", 8, false),
    ge(">=", 8, false),
    eq("==", 7, false),
    ne("!=", 7, false),
    and("&", 6, true),
    xor("^", 5, true),
    or("|", 4, true),
    logicalAnd("&&", 3, true),
    logicalOr("||", 2, true);

    public final String symbol;
    /** Verilog binding strength, higher binds tighter. */
    public final int precedence;
    public final boolean associative;
    private BinaryOp(String symbol, int precedence, boolean associative) {
      this.symbol = symbol;
      this.precedence = precedence;
      this.associative = associative;
    }

    public boolean isComparison() { return this == lt || this == le || this == gt || this == ge || this == eq || this == ne; }
    public boolean isLogical() { return this == logicalAnd || this == logicalOr; }
    public boolean isShift() { return this == shl || this == shr; }
  }

  /** Direct sub-expressions in evaluation order. */
  List<Expression> children();

  /** Rebuilds this node with replaced children; the list has the same size as {@link #children()}. */
  Expression withChildren(List<Expression> newChildren);

  /** Self-determined width of the expression. */
  int width(WidthResolver widths);

  /** Bottom-up rewrite: children are rewritten first, then fn is applied to the rebuilt node. */
  default Expression rewrite(UnaryOperator<Expression> fn) {
    List<Expression> oldChildren = children();
    if (oldChildren.isEmpty())
      return fn.apply(this);
    List<Expression> newChildren = new ArrayList<>(oldChildren.size());
    boolean changed = false;
    for (Expression child : oldChildren) {
      Expression newChild = child.rewrite(fn);
      changed |= newChild != child;
      newChildren.add(newChild);
    }
    return fn.apply(changed ? withChildren(newChildren) : this);
  }

  /** Names of all signals read by this expression, in first-occurrence order. */
  default Set<String> readSignals() {
    Set<String> result = new LinkedHashSet<>();
    collectReads(this, result);
    return result;
  }

  /** Names of all instances whose outputs this expression reads. */
  default Set<String> readInstances() {
    Set<String> result = new LinkedHashSet<>();
    rewrite(expr -> {
      if (expr instanceof InstanceOutputRef)
        result.add(((InstanceOutputRef)expr).instance());
      return expr;
    });
    return result;
  }

  /** Replaces every reference to a signal by the expression returned from fn (or keeps it for null). */
  default Expression substitute(Function<String, Expression> fn) {
    return rewrite(expr -> {
      if (expr instanceof SignalRef) {
        Expression replacement = fn.apply(((SignalRef)expr).name());
        return replacement != null ? replacement : expr;
      }
      return expr;
    });
  }

  private static void collectReads(Expression expr, Set<String> out) {
    if (expr instanceof SignalRef) {
      out.add(((SignalRef)expr).name());
      return;
    }
    for (Expression child : expr.children())
      collectReads(child, out);
  }

  record Literal(BitVector value) implements Expression {
    public List<Expression> children() { return List.of(); }
    public Expression withChildren(List<Expression> newChildren) { return this; }
    public int width(WidthResolver widths) { return value.width(); }
  }

  record SignalRef(String name) implements Expression {
    public List<Expression> children() { return List.of(); }
    public Expression withChildren(List<Expression> newChildren) { return this; }
    public int width(WidthResolver widths) { return widths.signalWidth(name); }
  }

  record InstanceOutputRef(String instance, String port) implements Expression {
    public List<Expression> children() { return List.of(); }
    public Expression withChildren(List<Expression> newChildren) { return this; }
    public int width(WidthResolver widths) { return widths.instanceOutputWidth(instance, port); }
  }

  record Unary(UnaryOp op, Expression operand) implements Expression {
    public List<Expression> children() { return List.of(operand); }
    public Expression withChildren(List<Expression> newChildren) { return new Unary(op, newChildren.get(0)); }
    public int width(WidthResolver widths) { return op.isOneBit() ? 1 : operand.width(widths); }
  }

  record Binary(BinaryOp op, Expression left, Expression right) implements Expression {
    public List<Expression> children() { return List.of(left, right); }
    public Expression withChildren(List<Expression> newChildren) { return new Binary(op, newChildren.get(0), newChildren.get(1)); }
    public int width(WidthResolver widths) {
      if (op.isComparison() || op.isLogical())
        return 1;
      if (op.isShift())
        return left.width(widths);
      return Math.max(left.width(widths), right.width(widths));
    }
  }

  /** Concatenation, most significant part first. */
  record Concat(List<Expression> parts) implements Expression {
    public Concat {
      if (parts.isEmpty())
        throw new IllegalArgumentException("empty concatenation");
      parts = List.copyOf(parts);
    }
    public List<Expression> children() { return parts; }
    public Expression withChildren(List<Expression> newChildren) { return new Concat(newChildren); }
    public int width(WidthResolver widths) { return parts.stream().mapToInt(part -> part.width(widths)).sum(); }
  }

  /** Bit range msb..lsb of the operand. */
  record Slice(Expression operand, int msb, int lsb) implements Expression {
    public Slice {
      if (lsb < 0 || msb < lsb)
        throw new IllegalArgumentException("invalid slice [" + msb + ":" + lsb + "]");
    }
    public List<Expression> children() { return List.of(operand); }
    public Expression withChildren(List<Expression> newChildren) { return new Slice(newChildren.get(0), msb, lsb); }
    public int width(WidthResolver widths) { return msb - lsb + 1; }
  }

  record Ternary(Expression cond, Expression whenTrue, Expression whenFalse) implements Expression {
    public List<Expression> children() { return List.of(cond, whenTrue, whenFalse); }
    public Expression withChildren(List<Expression> newChildren) {
      return new Ternary(newChildren.get(0), newChildren.get(1), newChildren.get(2));
    }
    public int width(WidthResolver widths) { return Math.max(whenTrue.width(widths), whenFalse.width(widths)); }
  }

  // Factories, mostly for the parser collaborator and tests.

  static Literal lit(int width, long value) { return new Literal(BitVector.of(width, value)); }
  static Literal lit(BitVector value) { return new Literal(value); }
  static SignalRef ref(String name) { return new SignalRef(name); }
  static InstanceOutputRef instOut(String instance, String port) { return new InstanceOutputRef(instance, port); }
  static Unary not(Expression operand) { return new Unary(UnaryOp.not, operand); }
  static Unary logicalNot(Expression operand) { return new Unary(UnaryOp.logicalNot, operand); }
  static Binary binary(BinaryOp op, Expression left, Expression right) { return new Binary(op, left, right); }
  static Binary and(Expression left, Expression right) { return new Binary(BinaryOp.and, left, right); }
  static Binary or(Expression left, Expression right) { return new Binary(BinaryOp.or, left, right); }
  static Binary xor(Expression left, Expression right) { return new Binary(BinaryOp.xor, left, right); }
  static Binary add(Expression left, Expression right) { return new Binary(BinaryOp.add, left, right); }
  static Binary eq(Expression left, Expression right) { return new Binary(BinaryOp.eq, left, right); }
  static Ternary ternary(Expression cond, Expression whenTrue, Expression whenFalse) { return new Ternary(cond, whenTrue, whenFalse); }
  static Concat concat(Expression... parts) { return new Concat(List.of(parts)); }
  static Slice slice(Expression operand, int msb, int lsb) { return new Slice(operand, msb, lsb); }
}
