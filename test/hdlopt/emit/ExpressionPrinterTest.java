package hdlopt.emit;

import static hdlopt.ir.Expression.and;
import static hdlopt.ir.Expression.binary;
import static hdlopt.ir.Expression.concat;
import static hdlopt.ir.Expression.lit;
import static hdlopt.ir.Expression.not;
import static hdlopt.ir.Expression.or;
import static hdlopt.ir.Expression.ref;
import static hdlopt.ir.Expression.slice;
import static hdlopt.ir.Expression.ternary;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import hdlopt.ir.Expression.BinaryOp;

class ExpressionPrinterTest {

  @Test
  void testAssociativeChainsPrintFlat() {
    Assertions.assertEquals("a & b & c & d", ExpressionPrinter.print(and(and(and(ref("a"), ref("b")), ref("c")), ref("d"))));
    Assertions.assertEquals("a & b & c & d", ExpressionPrinter.print(and(ref("a"), and(ref("b"), and(ref("c"), ref("d"))))));
  }

  @Test
  void testParenthesesFollowPrecedence() {
    Assertions.assertEquals("(a | b) & c", ExpressionPrinter.print(and(or(ref("a"), ref("b")), ref("c"))));
    Assertions.assertEquals("a | b & c", ExpressionPrinter.print(or(ref("a"), and(ref("b"), ref("c")))));
    Assertions.assertEquals("a - (b - c)", ExpressionPrinter.print(binary(BinaryOp.sub, ref("a"), binary(BinaryOp.sub, ref("b"), ref("c")))));
    Assertions.assertEquals("~(a & b)", ExpressionPrinter.print(not(and(ref("a"), ref("b")))));
  }

  @Test
  void testOtherNodes() {
    Assertions.assertEquals("s ? {a, 1'b0} : b[3:1]", ExpressionPrinter.print(ternary(ref("s"), concat(ref("a"), lit(1, 0)), slice(ref("b"), 3, 1))));
    Assertions.assertEquals("(a & b)[0]", ExpressionPrinter.print(slice(and(ref("a"), ref("b")), 0, 0)));
  }
}
