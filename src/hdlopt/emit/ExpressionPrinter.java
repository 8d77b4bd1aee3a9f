package hdlopt.emit;

import java.util.stream.Collectors;
import hdlopt.ir.Expression;
import hdlopt.ir.Expression.Binary;
import hdlopt.ir.Expression.Concat;
import hdlopt.ir.Expression.InstanceOutputRef;
import hdlopt.ir.Expression.Literal;
import hdlopt.ir.Expression.SignalRef;
import hdlopt.ir.Expression.Slice;
import hdlopt.ir.Expression.Ternary;
import hdlopt.ir.Expression.Unary;

/**
 * Verilog-style rendering of expressions with minimal parentheses.
 * Chains of the same associative operator print flat, e.g. {@code a & b & c & d}.
 */
public final class ExpressionPrinter {
  private static final int PREC_TERNARY = 1;
  private static final int PREC_UNARY = 12;
  private static final int PREC_ATOM = 13;

  private ExpressionPrinter() {}

  public static String print(Expression expr) {
    if (expr instanceof Literal)
      return ((Literal)expr).value().toString();
    if (expr instanceof SignalRef)
      return ((SignalRef)expr).name();
    if (expr instanceof InstanceOutputRef) {
      InstanceOutputRef ref = (InstanceOutputRef)expr;
      return ref.instance() + "." + ref.port();
    }
    if (expr instanceof Unary) {
      Unary unary = (Unary)expr;
      return unary.op().symbol + wrap(unary.operand(), PREC_UNARY);
    }
    if (expr instanceof Binary) {
      Binary binary = (Binary)expr;
      int prec = binary.op().precedence;
      String left = wrap(binary.left(), prec);
      boolean flatRight = binary.right() instanceof Binary && ((Binary)binary.right()).op() == binary.op() && binary.op().associative;
      String right = flatRight ? print(binary.right()) : wrap(binary.right(), prec + 1);
      return left + " " + binary.op().symbol + " " + right;
    }
    if (expr instanceof Concat)
      return ((Concat)expr).parts().stream().map(ExpressionPrinter::print).collect(Collectors.joining(", ", "{", "}"));
    if (expr instanceof Slice) {
      Slice slice = (Slice)expr;
      String range = slice.msb() == slice.lsb() ? "[" + slice.msb() + "]" : "[" + slice.msb() + ":" + slice.lsb() + "]";
      return wrap(slice.operand(), PREC_ATOM) + range;
    }
    if (expr instanceof Ternary) {
      Ternary ternary = (Ternary)expr;
      return wrap(ternary.cond(), PREC_TERNARY + 1) + " ? " + wrap(ternary.whenTrue(), PREC_TERNARY + 1) + " : " +
          wrap(ternary.whenFalse(), PREC_TERNARY);
    }
    throw new IllegalArgumentException("unknown expression node " + expr);
  }

  /** Prints the expression, parenthesized if it binds weaker than minPrecedence. */
  private static String wrap(Expression expr, int minPrecedence) {
    String text = print(expr);
    return precedence(expr) < minPrecedence ? "(" + text + ")" : text;
  }

  private static int precedence(Expression expr) {
    if (expr instanceof Binary)
      return ((Binary)expr).op().precedence;
    if (expr instanceof Ternary)
      return PREC_TERNARY;
    if (expr instanceof Unary)
      return PREC_UNARY;
    return PREC_ATOM;
  }
}
