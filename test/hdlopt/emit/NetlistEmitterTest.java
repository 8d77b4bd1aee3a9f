package hdlopt.emit;

import static hdlopt.ir.Expression.add;
import static hdlopt.ir.Expression.lit;
import static hdlopt.ir.Expression.ref;
import static hdlopt.ir.Statement.blocking;
import static hdlopt.ir.Statement.ifElse;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import hdlopt.TestDesigns;
import hdlopt.ir.Design;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Sensitivity;

class NetlistEmitterTest {
  NetlistEmitter emitter;

  @BeforeEach
  void setUp() {
    emitter = new NetlistEmitter();
  }

  @Test
  void testModuleLayout() {
    HdlModule module = HdlModule.builder("top")
                           .input("a", 1)
                           .input("b", 4)
                           .outputReg("y", 4)
                           .wire("n", 4)
                           .assign("n", add(ref("b"), lit(4, 1)))
                           .process("p", Sensitivity.star(), ifElse(ref("a"), List.of(blocking("y", ref("n"))), List.of(blocking("y", lit(4, 0)))))
                           .build();
    String expected = "module top(input a, input [3:0] b, output reg [3:0] y);\n"
                      + "    wire [3:0] n;\n"
                      + "    assign n = b + 4'b0001;\n"
                      + "    always@(*) begin\n"
                      + "        if (a) begin\n"
                      + "            y = n;\n"
                      + "        end\n"
                      + "        else begin\n"
                      + "            y = 4'b0000;\n"
                      + "        end\n"
                      + "    end\n"
                      + "endmodule\n";
    Assertions.assertEquals(expected, emitter.emit(module));
  }

  @Test
  void testInstanceConnections() {
    HdlModule top = HdlModule.builder("top")
                        .input("a", 1)
                        .output("y", 1)
                        .instance("u0", "and2", Map.of("b", ref("a"), "a", lit(1, 1)), Map.of("y", "y"))
                        .build();
    Assertions.assertTrue(emitter.emit(top).contains("    and2 u0(.a(1'b1), .b(a), .y(y));\n"));
  }

  @Test
  void testModulesInNameOrder() {
    String text = emitter.emit(TestDesigns.andChain(ref("a")));
    Assertions.assertTrue(text.startsWith("module and2("));
    Assertions.assertTrue(text.indexOf("module top(") > text.indexOf("endmodule"));
  }

  @Test
  void testElementOrderFollowsStableIndex() {
    HdlModule module = HdlModule.builder("m").input("a", 1).output("y", 1).output("z", 1).assign("y", ref("a")).assign("z", ref("a")).build();
    HdlModule reversed = module.withAssignments(List.of(module.getAssignments().get(1), module.getAssignments().get(0)));
    Assertions.assertEquals(emitter.emit(module), emitter.emit(reversed));
    Assertions.assertEquals(emitter.emit(Design.of("m", module)), emitter.emit(Design.of("m", reversed)));
  }

  @Test
  void testAlignText() {
    Assertions.assertEquals("  a\n\n  b\n", NetlistEmitter.AlignText("  ", "a\n\nb\n"));
    Assertions.assertEquals("", NetlistEmitter.AlignText("  ", ""));
  }
}
