package hdlopt.graph;

import static hdlopt.ir.Expression.instOut;
import static hdlopt.ir.Expression.ref;
import static hdlopt.ir.Expression.slice;

import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import hdlopt.TestDesigns;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.diag.OptimizerException;
import hdlopt.ir.Design;
import hdlopt.ir.HdlModule;

class ReferenceValidatorTest {

  private static OptimizerException invalid(Design design) {
    OptimizerException e = Assertions.assertThrows(OptimizerException.class, () -> ReferenceValidator.validateAll(design));
    Assertions.assertEquals(DiagnosticCategory.UndeclaredReference, e.getDiagnostic().category());
    return e;
  }

  @Test
  void testValidDesigns() {
    Assertions.assertDoesNotThrow(() -> ReferenceValidator.validateAll(TestDesigns.andChain(ref("a"))));
    Assertions.assertDoesNotThrow(() -> ReferenceValidator.validateAll(TestDesigns.single(TestDesigns.counter(true))));
  }

  @Test
  void testUndeclaredSignal() {
    HdlModule module = HdlModule.builder("m").output("y", 1).assign("y", ref("ghost")).build();
    Assertions.assertEquals("ghost", invalid(TestDesigns.single(module)).getDiagnostic().location());
  }

  @Test
  void testUnboundInput() {
    HdlModule top = HdlModule.builder("top").input("a", 1).output("y", 1).instance("u0", "and2", Map.of("a", ref("a")), Map.of("y", "y")).build();
    var e = invalid(Design.of("top", top, TestDesigns.and2()));
    Assertions.assertTrue(e.getDiagnostic().detail().contains("leaves input b unbound"), e.getDiagnostic().detail());
  }

  @Test
  void testInstanceOutputOfInputPort() {
    HdlModule top = HdlModule.builder("top")
                        .input("a", 1)
                        .output("y", 1)
                        .instance("u0", "and2", Map.of("a", ref("a"), "b", ref("a")), Map.of())
                        .assign("y", instOut("u0", "a"))
                        .build();
    Assertions.assertEquals("u0", invalid(Design.of("top", top, TestDesigns.and2())).getDiagnostic().location());
  }

  @Test
  void testSliceOutOfRange() {
    HdlModule module = HdlModule.builder("m").input("a", 2).output("y", 1).assign("y", slice(ref("a"), 2, 2)).build();
    invalid(TestDesigns.single(module));
  }
}
