package hdlopt.pass;

import static hdlopt.ir.Expression.add;
import static hdlopt.ir.Expression.and;
import static hdlopt.ir.Expression.lit;
import static hdlopt.ir.Expression.or;
import static hdlopt.ir.Expression.ref;
import static hdlopt.ir.Statement.blocking;
import static hdlopt.ir.Statement.nonBlocking;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import hdlopt.TestDesigns;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Sensitivity;

class WireInlinerTest {

  private static HdlModule inline(HdlModule module) { return new WireInliner(TestDesigns.single(module)).run(module); }

  @Test
  void testSingleReaderIsInlined() {
    HdlModule module = HdlModule.builder("m")
                           .input("a", 1)
                           .input("b", 1)
                           .input("c", 1)
                           .output("y", 1)
                           .wire("w", 1)
                           .assign("w", and(ref("a"), ref("b")))
                           .assign("y", or(ref("w"), ref("c")))
                           .build();
    HdlModule result = inline(module);
    Assertions.assertTrue(result.getSignal("w").isEmpty());
    Assertions.assertEquals(1, result.getAssignments().size());
    Assertions.assertEquals(or(and(ref("a"), ref("b")), ref("c")), result.getAssignments().get(0).source());
  }

  @Test
  void testCopyIsInlinedIntoEveryReader() {
    HdlModule module = HdlModule.builder("m")
                           .input("a", 1)
                           .output("y", 1)
                           .output("z", 1)
                           .wire("w", 1)
                           .assign("w", ref("a"))
                           .assign("y", ref("w"))
                           .assign("z", ref("w"))
                           .build();
    HdlModule result = inline(module);
    Assertions.assertTrue(result.getSignal("w").isEmpty());
    Assertions.assertEquals(ref("a"), result.getAssignments().get(0).source());
    Assertions.assertEquals(ref("a"), result.getAssignments().get(1).source());
  }

  @Test
  void testComputedWireWithTwoReadersIsKept() {
    HdlModule module = HdlModule.builder("m")
                           .input("a", 1)
                           .input("b", 1)
                           .output("y", 1)
                           .output("z", 1)
                           .wire("w", 1)
                           .assign("w", and(ref("a"), ref("b")))
                           .assign("y", ref("w"))
                           .assign("z", ref("w"))
                           .build();
    Assertions.assertSame(module, inline(module));
  }

  @Test
  void testCarryWouldLeakIntoWiderReader() {
    HdlModule module = HdlModule.builder("m")
                           .input("a", 1)
                           .input("b", 1)
                           .output("y", 2)
                           .wire("w", 1)
                           .assign("w", add(ref("a"), ref("b")))
                           .assign("y", add(ref("w"), lit(2, 0)))
                           .build();
    Assertions.assertSame(module, inline(module));
  }

  @Test
  void testSensitivityListWireIsKept() {
    HdlModule module = HdlModule.builder("m")
                           .input("clk_in", 1)
                           .input("d", 1)
                           .outputReg("q", 1)
                           .wire("clk", 1)
                           .assign("clk", ref("clk_in"))
                           .process("p", Sensitivity.posedge("clk"), nonBlocking("q", ref("d")))
                           .build();
    Assertions.assertSame(module, inline(module));
  }

  @Test
  void testNotMovedIntoProcessWritingItsOperands() {
    HdlModule module = HdlModule.builder("m")
                           .input("a", 1)
                           .outputReg("y", 1)
                           .variable("v", 1)
                           .wire("w", 1)
                           .assign("w", and(ref("v"), ref("a")))
                           .process("p", Sensitivity.star(), blocking("v", ref("a")), blocking("y", ref("w")))
                           .build();
    Assertions.assertSame(module, inline(module));
  }
}
