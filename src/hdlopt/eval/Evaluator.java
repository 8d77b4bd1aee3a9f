package hdlopt.eval;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import hdlopt.ir.BitVector;
import hdlopt.ir.Expression;
import hdlopt.ir.Expression.Binary;
import hdlopt.ir.Expression.BinaryOp;
import hdlopt.ir.Expression.Concat;
import hdlopt.ir.Expression.InstanceOutputRef;
import hdlopt.ir.Expression.Literal;
import hdlopt.ir.Expression.SignalRef;
import hdlopt.ir.Expression.Slice;
import hdlopt.ir.Expression.Ternary;
import hdlopt.ir.Expression.Unary;
import hdlopt.ir.WidthResolver;

/**
 * Two-state expression evaluation with Verilog-style width rules.
 * <p>
 * Bitwise, arithmetic and ternary operations are context-determined: operands are zero-extended to the larger of the
 *   operation's own width and the context width before computing, and the result keeps that width.
 * Comparisons, logical operators, reductions, concatenations and slices evaluate their operands self-determined and
 *   yield a value that is zero-extended into the context.
 * Assigning to a target truncates or zero-extends to the target's width; nothing is ever sign-extended.
 */
public class Evaluator {

  /** Supplies values of the leaves of an expression. */
  public interface Values {
    Optional<BitVector> signal(String name);
    default Optional<BitVector> instanceOutput(String instance, String port) { return Optional.empty(); }
  }

  private final WidthResolver widths;
  private final Values values;

  public Evaluator(WidthResolver widths, Values values) {
    this.widths = widths;
    this.values = values;
  }

  /** Evaluates the expression as the right-hand side of an assignment to a target of the given width. */
  public BitVector evaluateAssigned(Expression expr, int targetWidth) { return evaluate(expr, targetWidth).resize(targetWidth); }

  /** Evaluates the expression as a condition; nonzero is true. */
  public boolean evaluateCondition(Expression expr) { return evaluate(expr, 0).isTrue(); }

  /**
   * Evaluates the expression in the given context width (0 for self-determined).
   * @throws IllegalStateException if a leaf has no value
   */
  public BitVector evaluate(Expression expr, int ctx) {
    int w = Math.max(expr.width(widths), ctx);
    if (expr instanceof Literal)
      return ((Literal)expr).value().resize(w);
    if (expr instanceof SignalRef) {
      String name = ((SignalRef)expr).name();
      return values.signal(name).orElseThrow(() -> new IllegalStateException("no value for signal " + name)).resize(w);
    }
    if (expr instanceof InstanceOutputRef) {
      InstanceOutputRef ref = (InstanceOutputRef)expr;
      return values.instanceOutput(ref.instance(), ref.port())
          .orElseThrow(() -> new IllegalStateException("no value for " + ref.instance() + "." + ref.port()))
          .resize(w);
    }
    if (expr instanceof Unary) {
      Unary unary = (Unary)expr;
      if (unary.op().isOneBit())
        return applyUnary(unary.op(), evaluate(unary.operand(), 0), 0).resize(w);
      return applyUnary(unary.op(), evaluate(unary.operand(), w), w);
    }
    if (expr instanceof Binary) {
      Binary binary = (Binary)expr;
      BinaryOp op = binary.op();
      if (op.isLogical())
        return applyBinary(op, evaluate(binary.left(), 0), evaluate(binary.right(), 0), 1).resize(w);
      if (op.isComparison()) {
        int operandWidth = Math.max(binary.left().width(widths), binary.right().width(widths));
        return applyBinary(op, evaluate(binary.left(), operandWidth), evaluate(binary.right(), operandWidth), 1).resize(w);
      }
      if (op.isShift())
        return applyBinary(op, evaluate(binary.left(), w), evaluate(binary.right(), 0), w);
      return applyBinary(op, evaluate(binary.left(), w), evaluate(binary.right(), w), w);
    }
    if (expr instanceof Concat) {
      BigInteger value = BigInteger.ZERO;
      int total = 0;
      for (Expression part : ((Concat)expr).parts()) {
        BitVector partValue = evaluate(part, 0);
        value = value.shiftLeft(partValue.width()).or(partValue.value());
        total += partValue.width();
      }
      return new BitVector(total, value).resize(w);
    }
    if (expr instanceof Slice) {
      Slice slice = (Slice)expr;
      return evaluate(slice.operand(), 0).slice(slice.msb(), slice.lsb()).resize(w);
    }
    if (expr instanceof Ternary) {
      Ternary ternary = (Ternary)expr;
      Expression taken = evaluate(ternary.cond(), 0).isTrue() ? ternary.whenTrue() : ternary.whenFalse();
      return evaluate(taken, w).resize(w);
    }
    throw new IllegalArgumentException("unknown expression node " + expr);
  }

  /** Applies a unary operator; width is the result width for bitwise/arithmetic operators. */
  public static BitVector applyUnary(Expression.UnaryOp op, BitVector operand, int width) {
    switch (op) {
    case not:
      return new BitVector(width, operand.value().not());
    case negate:
      return new BitVector(width, operand.value().negate());
    case logicalNot:
      return BitVector.fromBoolean(operand.isZero());
    case reduceAnd:
      return BitVector.fromBoolean(operand.isAllOnes());
    case reduceOr:
      return BitVector.fromBoolean(!operand.isZero());
    case reduceXor:
      return BitVector.fromBoolean(operand.value().bitCount() % 2 == 1);
    default:
      throw new IllegalArgumentException("unknown unary operator " + op);
    }
  }

  /** Applies a binary operator to operands already extended to their evaluation width. */
  public static BitVector applyBinary(BinaryOp op, BitVector a, BitVector b, int width) {
    BigInteger x = a.value();
    BigInteger y = b.value();
    switch (op) {
    case mul:
      return new BitVector(width, x.multiply(y));
    case add:
      return new BitVector(width, x.add(y));
    case sub:
      return new BitVector(width, x.subtract(y));
    case shl:
      return y.bitLength() > 31 || y.intValue() >= width ? BitVector.zero(width) : new BitVector(width, x.shiftLeft(y.intValue()));
    case shr:
      return y.bitLength() > 31 ? BitVector.zero(width) : new BitVector(width, x.shiftRight(y.intValue()));
    case lt:
      return BitVector.fromBoolean(x.compareTo(y) < 0);
    case le:
      return BitVector.fromBoolean(x.compareTo(y) <= 0);
    case gt:
      return BitVector.fromBoolean(x.compareTo(y) > 0);
    case ge:
      return BitVector.fromBoolean(x.compareTo(y) >= 0);
    case eq:
      return BitVector.fromBoolean(x.equals(y));
    case ne:
      return BitVector.fromBoolean(!x.equals(y));
    case and:
      return new BitVector(width, x.and(y));
    case xor:
      return new BitVector(width, x.xor(y));
    case or:
      return new BitVector(width, x.or(y));
    case logicalAnd:
      return BitVector.fromBoolean(!a.isZero() && !b.isZero());
    case logicalOr:
      return BitVector.fromBoolean(!a.isZero() || !b.isZero());
    default:
      throw new IllegalArgumentException("unknown binary operator " + op);
    }
  }

  /**
   * True if evaluating the expression in a wider context only zero-extends its self-determined value.
   * Such expressions can be moved between contexts freely.
   */
  public static boolean isContextInsensitive(Expression expr) {
    if (expr instanceof Literal || expr instanceof SignalRef || expr instanceof InstanceOutputRef || expr instanceof Concat ||
        expr instanceof Slice)
      return true;
    if (expr instanceof Unary)
      return ((Unary)expr).op().isOneBit();
    if (expr instanceof Binary) {
      BinaryOp op = ((Binary)expr).op();
      return op.isComparison() || op.isLogical();
    }
    return false;
  }

  /**
   * Context widths in which the children of a node are evaluated, given the node's evaluation width w.
   * A context of 0 means self-determined.
   */
  public static List<Integer> operandContexts(Expression expr, int w, WidthResolver widths) {
    if (expr instanceof Unary)
      return List.of(((Unary)expr).op().isOneBit() ? 0 : w);
    if (expr instanceof Binary) {
      Binary binary = (Binary)expr;
      BinaryOp op = binary.op();
      if (op.isLogical())
        return List.of(0, 0);
      if (op.isComparison()) {
        int operandWidth = Math.max(binary.left().width(widths), binary.right().width(widths));
        return List.of(operandWidth, operandWidth);
      }
      if (op.isShift())
        return List.of(w, 0);
      return List.of(w, w);
    }
    if (expr instanceof Ternary)
      return List.of(0, w, w);
    return Collections.nCopies(expr.children().size(), 0);
  }

  /** Convenience for expressions without instance references. */
  public static Values ofMap(Map<String, BitVector> map) { return name -> Optional.ofNullable(map.get(name)); }
}
