package hdlopt.pass;

import static hdlopt.ir.Expression.and;
import static hdlopt.ir.Expression.instOut;
import static hdlopt.ir.Expression.ref;
import static hdlopt.ir.Statement.nonBlocking;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import hdlopt.TestDesigns;
import hdlopt.diag.OptimizerException;
import hdlopt.ir.ContinuousAssignment;
import hdlopt.ir.Design;
import hdlopt.ir.HdlModule;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Sensitivity;
import hdlopt.ir.Signal;
import hdlopt.ir.StableIndex;

class HierarchyFlattenerTest {
  HierarchyFlattener flattener;

  @BeforeEach
  void setUp() {
    flattener = new HierarchyFlattener();
  }

  private static ContinuousAssignment assignmentTo(HdlModule module, String target) {
    return module.getAssignments().stream().filter(assignment -> assignment.target().equals(target)).findFirst().orElseThrow();
  }

  @Test
  void testChainIsInlined() throws OptimizerException {
    Design flat = flattener.flatten(TestDesigns.andChain(ref("a")));
    Assertions.assertEquals(List.of("top"), List.copyOf(flat.getModules().keySet()));
    HdlModule top = flat.getTopModule();
    Assertions.assertTrue(top.getInstances().isEmpty());

    // u0 has index 8, the and2 output y has index 2
    Signal inlinedOutput = top.getSignal("u0__y").orElseThrow();
    Assertions.assertEquals(StableIndex.of(8).nested(StableIndex.of(2)), inlinedOutput.index());
    Assertions.assertEquals(Signal.Kind.wire, top.getSignal("u0__a").orElseThrow().kind());

    Assertions.assertEquals(ref("u0__y"), assignmentTo(top, "n0").source());
    Assertions.assertEquals(ref("a"), assignmentTo(top, "u0__b").source());
    Assertions.assertEquals(and(ref("u0__a"), ref("u0__b")), assignmentTo(top, "u0__y").source());
    Assertions.assertEquals(ref("n2"), assignmentTo(top, "u3__a").source());
  }

  @Test
  void testTakenNameGetsSuffix() throws OptimizerException {
    HdlModule top = HdlModule.builder("top")
                        .input("a", 1)
                        .input("b", 1)
                        .output("y", 1)
                        .wire("u0__a", 1)
                        .assign("u0__a", ref("a"))
                        .instance("u0", "and2", Map.of("a", ref("u0__a"), "b", ref("b")), Map.of("y", "y"))
                        .build();
    HdlModule flat = flattener.flatten(Design.of("top", top, TestDesigns.and2())).getTopModule();
    Assertions.assertEquals(ref("u0__a"), assignmentTo(flat, "u0__a_1").source());
    Assertions.assertEquals(and(ref("u0__a_1"), ref("u0__b")), assignmentTo(flat, "u0__y").source());
  }

  @Test
  void testNestedInstancesGetPathNames() throws OptimizerException {
    HdlModule mid = HdlModule.builder("mid")
                        .input("a", 1)
                        .output("y", 1)
                        .instance("i", "and2", Map.of("a", ref("a"), "b", ref("a")), Map.of("y", "y"))
                        .build();
    HdlModule top = HdlModule.builder("top").input("x", 1).output("z", 1).instance("m", "mid", Map.of("a", ref("x")), Map.of("y", "z")).build();
    HdlModule flat = flattener.flatten(Design.of("top", top, mid, TestDesigns.and2())).getTopModule();
    Signal nested = flat.getSignal("m__i__y").orElseThrow();
    Assertions.assertEquals(List.of(2, 2, 2), nested.index().getPath());
    Assertions.assertEquals(ref("m__y"), assignmentTo(flat, "z").source());
    Assertions.assertEquals(ref("m__i__y"), assignmentTo(flat, "m__y").source());
  }

  @Test
  void testInstanceOutputReadsAndProcesses() throws OptimizerException {
    HdlModule reg = HdlModule.builder("reg1")
                        .input("clk", 1)
                        .input("d", 1)
                        .outputReg("q", 1)
                        .process("p", Sensitivity.posedge("clk"), nonBlocking("q", ref("d")))
                        .build();
    HdlModule top = HdlModule.builder("top")
                        .input("clk", 1)
                        .input("d", 1)
                        .output("y", 1)
                        .instance("r", "reg1", Map.of("clk", ref("clk"), "d", ref("d")), Map.of())
                        .assign("y", instOut("r", "q"))
                        .build();
    HdlModule flat = flattener.flatten(Design.of("top", top, reg)).getTopModule();
    Assertions.assertEquals(ref("r__q"), assignmentTo(flat, "y").source());
    ProcessBlock process = flat.getProcesses().get(0);
    Assertions.assertEquals("r__p", process.name());
    Assertions.assertEquals(Sensitivity.posedge("r__clk"), process.sensitivity());
    Assertions.assertEquals(List.of(nonBlocking("r__q", ref("r__d"))), process.body());
    Assertions.assertEquals(Signal.Kind.variable, flat.getSignal("r__q").orElseThrow().kind());
  }
}
