package hdlopt.eval;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import hdlopt.ir.BitVector;
import hdlopt.ir.Expression;
import hdlopt.ir.Expression.Binary;
import hdlopt.ir.Expression.BinaryOp;
import hdlopt.ir.Expression.Concat;
import hdlopt.ir.Expression.InstanceOutputRef;
import hdlopt.ir.Expression.Literal;
import hdlopt.ir.Expression.SignalRef;
import hdlopt.ir.Expression.Ternary;
import hdlopt.ir.Expression.Unary;
import hdlopt.ir.Expression.UnaryOp;
import hdlopt.ir.WidthResolver;

/**
 * Partial evaluation of expressions under a set of known values.
 * Constant subtrees become literals, a ternary with a constant condition becomes its taken branch, and
 *   identities such as {@code x & 1}, {@code x | 0} or {@code x & 0} are simplified.
 * A subtree is only replaced where the replacement evaluates identically in the context it lands in
 *   (see {@link Evaluator} for the width rules).
 */
public class ExpressionFolder {
  private final WidthResolver widths;
  private final Evaluator.Values knowns;

  public ExpressionFolder(WidthResolver widths, Evaluator.Values knowns) {
    this.widths = widths;
    this.knowns = knowns;
  }

  /** Folds the right-hand side of an assignment; a literal result is resized to the target width. */
  public Expression foldAssigned(Expression expr, int targetWidth) {
    Expression folded = fold(expr, targetWidth);
    if (folded instanceof Literal)
      return new Literal(((Literal)folded).value().resize(targetWidth));
    return folded;
  }

  /** Folds a self-determined expression such as a condition or selector. */
  public Expression fold(Expression expr) { return fold(expr, 0); }

  /** Folds the expression evaluated in the given context width. */
  public Expression fold(Expression expr, int ctx) {
    int selfWidth = expr.width(widths);
    int w = Math.max(selfWidth, ctx);
    if (expr instanceof Literal)
      return expr;
    if (expr instanceof SignalRef) {
      return knowns.signal(((SignalRef)expr).name()).<Expression>map(value -> new Literal(value.resize(selfWidth))).orElse(expr);
    }
    if (expr instanceof InstanceOutputRef) {
      InstanceOutputRef ref = (InstanceOutputRef)expr;
      return knowns.instanceOutput(ref.instance(), ref.port()).<Expression>map(value -> new Literal(value.resize(selfWidth))).orElse(expr);
    }
    Expression rebuilt = foldChildren(expr, w);
    if (rebuilt.children().stream().allMatch(child -> child instanceof Literal))
      return new Literal(new Evaluator(widths, name -> Optional.empty()).evaluate(rebuilt, ctx));
    return simplify(rebuilt, ctx);
  }

  private Expression foldChildren(Expression expr, int w) {
    List<Expression> children = expr.children();
    if (children.isEmpty())
      return expr;
    List<Integer> contexts = Evaluator.operandContexts(expr, w, widths);
    List<Expression> folded = new ArrayList<>(children.size());
    for (int i = 0; i < children.size(); ++i)
      folded.add(fold(children.get(i), contexts.get(i)));
    boolean changed = false;
    for (int i = 0; i < children.size(); ++i)
      changed |= folded.get(i) != children.get(i);
    return changed ? expr.withChildren(folded) : expr;
  }

  private Expression simplify(Expression expr, int ctx) {
    int selfWidth = expr.width(widths);
    if (expr instanceof Ternary) {
      Ternary ternary = (Ternary)expr;
      if (ternary.cond() instanceof Literal) {
        Expression taken = ((Literal)ternary.cond()).value().isTrue() ? ternary.whenTrue() : ternary.whenFalse();
        return replaceBy(expr, taken, selfWidth, ctx);
      }
      if (ternary.whenTrue().equals(ternary.whenFalse()))
        return replaceBy(expr, ternary.whenTrue(), selfWidth, ctx);
      return expr;
    }
    if (expr instanceof Unary) {
      Unary unary = (Unary)expr;
      if (unary.op() == UnaryOp.not && unary.operand() instanceof Unary && ((Unary)unary.operand()).op() == UnaryOp.not)
        return replaceBy(expr, ((Unary)unary.operand()).operand(), selfWidth, ctx);
      return expr;
    }
    if (!(expr instanceof Binary))
      return expr;
    Binary binary = (Binary)expr;
    BinaryOp op = binary.op();
    Literal leftLit = binary.left() instanceof Literal ? (Literal)binary.left() : null;
    Literal rightLit = binary.right() instanceof Literal ? (Literal)binary.right() : null;
    if (leftLit == null && rightLit == null)
      return expr;
    boolean commutative = op.associative;
    // Normalize so that the literal sits on the right for commutative operators.
    Expression other = rightLit != null ? binary.left() : binary.right();
    BitVector constant = rightLit != null ? rightLit.value() : leftLit.value();
    if (rightLit == null && !commutative)
      return expr;
    int otherWidth = other.width(widths);

    switch (op) {
    case and:
      if (constant.isZero())
        return Expression.lit(BitVector.zero(selfWidth));
      if (constant.isAllOnes() && constant.width() >= otherWidth)
        return replaceBy(expr, other, selfWidth, ctx);
      return expr;
    case or:
      if (constant.isZero())
        return replaceBy(expr, other, selfWidth, ctx);
      if (constant.isAllOnes() && constant.width() >= otherWidth && isMovable(other, selfWidth, ctx))
        return Expression.lit(constant.resize(selfWidth));
      return expr;
    case xor:
    case add:
      return constant.isZero() ? replaceBy(expr, other, selfWidth, ctx) : expr;
    case sub:
    case shl:
    case shr:
      return constant.isZero() ? replaceBy(expr, other, selfWidth, ctx) : expr;
    case mul:
      if (constant.isZero())
        return Expression.lit(BitVector.zero(selfWidth));
      if (constant.value().equals(BigInteger.ONE))
        return replaceBy(expr, other, selfWidth, ctx);
      return expr;
    case logicalAnd:
      if (constant.isZero())
        return Expression.lit(BitVector.zero(1));
      return otherWidth == 1 ? replaceBy(expr, other, 1, ctx) : expr;
    case logicalOr:
      if (constant.isTrue())
        return Expression.lit(BitVector.ones(1));
      return otherWidth == 1 ? replaceBy(expr, other, 1, ctx) : expr;
    default:
      return expr;
    }
  }

  private boolean isMovable(Expression replacement, int nodeWidth, int ctx) { return isMovable(replacement, nodeWidth, ctx, widths); }

  /** True if replacement can stand in for a node of width nodeWidth evaluated in context ctx. */
  public static boolean isMovable(Expression replacement, int nodeWidth, int ctx, WidthResolver widths) {
    int width = replacement.width(widths);
    if (Evaluator.isContextInsensitive(replacement))
      return width <= nodeWidth;
    return width == nodeWidth && ctx <= nodeWidth;
  }

  /** Replaces node by replacement if that keeps the value, zero-extending a narrower context-insensitive replacement. */
  private Expression replaceBy(Expression node, Expression replacement, int nodeWidth, int ctx) {
    if (!isMovable(replacement, nodeWidth, ctx))
      return node;
    return widen(replacement, nodeWidth, widths);
  }

  /** Zero-extends a context-insensitive expression to the given width. */
  public static Expression widen(Expression replacement, int nodeWidth, WidthResolver widths) {
    int width = replacement.width(widths);
    if (width == nodeWidth)
      return replacement;
    if (replacement instanceof Literal)
      return new Literal(((Literal)replacement).value().resize(nodeWidth));
    return new Concat(List.of(Expression.lit(BitVector.zero(nodeWidth - width)), replacement));
  }
}
