package hdlopt.graph;

import static hdlopt.ir.Expression.and;
import static hdlopt.ir.Expression.or;
import static hdlopt.ir.Expression.ref;
import static hdlopt.ir.Statement.blocking;
import static hdlopt.ir.Statement.ifThen;
import static hdlopt.ir.Statement.nonBlocking;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import hdlopt.TestDesigns;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.diag.OptimizerException;
import hdlopt.graph.DependencyGraph.Node;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Sensitivity;

class DependencyGraphBuilderTest {

  private static OptimizerException buildFails(HdlModule module) {
    return Assertions.assertThrows(OptimizerException.class, () -> new DependencyGraphBuilder(module).build());
  }

  @Test
  void testCombinationalLoop() {
    HdlModule module = HdlModule.builder("loop")
                           .input("a", 1)
                           .output("y", 1)
                           .wire("w1", 1)
                           .wire("w2", 1)
                           .assign("w1", and(ref("w2"), ref("a")))
                           .assign("w2", ref("w1"))
                           .assign("y", ref("w1"))
                           .build();
    OptimizerException e = buildFails(module);
    Assertions.assertEquals(DiagnosticCategory.CombinationalLoopError, e.getDiagnostic().category());
    Assertions.assertTrue(e.getDiagnostic().detail().contains("w1 -> w2 -> w1"), e.getDiagnostic().detail());
  }

  @Test
  void testLoopThroughCombinationalProcess() {
    HdlModule module = HdlModule.builder("loop")
                           .input("x", 1)
                           .input("y", 1)
                           .output("z", 1)
                           .wire("a", 1)
                           .variable("b", 1)
                           .assign("a", and(ref("b"), ref("x")))
                           .process("p", Sensitivity.star(), blocking("b", or(ref("a"), ref("y"))))
                           .assign("z", ref("a"))
                           .build();
    OptimizerException e = buildFails(module);
    Assertions.assertEquals(DiagnosticCategory.CombinationalLoopError, e.getDiagnostic().category());
    Assertions.assertTrue(e.getDiagnostic().detail().contains("a -> b -> a"), e.getDiagnostic().detail());
  }

  @Test
  void testReassignedTemporaryIsNoLoop() throws OptimizerException {
    HdlModule module = HdlModule.builder("tmp")
                           .input("a", 1)
                           .input("b", 1)
                           .input("en", 1)
                           .outputReg("y", 1)
                           .variable("t", 1)
                           .process("p", Sensitivity.star(), blocking("t", ref("a")), blocking("t", and(ref("t"), ref("b"))),
                                    ifThen(ref("en"), blocking("y", ref("t"))))
                           .build();
    new DependencyGraphBuilder(module).build();
    var reads = DependencyGraphBuilder.entryReads(module.getProcesses().get(0));
    Assertions.assertEquals(Set.of("a", "b"), reads.get("t"));
    Assertions.assertEquals(Set.of("a", "b", "en"), reads.get("y"));
  }

  @Test
  void testSelfReadInCombinationalProcess() {
    HdlModule module = HdlModule.builder("self")
                           .input("a", 1)
                           .outputReg("y", 1)
                           .process("p", Sensitivity.star(), blocking("y", and(ref("y"), ref("a"))))
                           .build();
    Assertions.assertEquals(DiagnosticCategory.CombinationalLoopError, buildFails(module).getDiagnostic().category());
  }

  @Test
  void testSequentialFeedbackIsLegal() throws OptimizerException {
    DependencyGraph graph = new DependencyGraphBuilder(TestDesigns.counter(true)).build();
    var deps = graph.dependenciesOf(Node.signal("count"));
    Assertions.assertTrue(deps.contains(Node.signal("count")));
    Assertions.assertTrue(deps.contains(Node.signal("rst")));
    Assertions.assertTrue(deps.contains(Node.signal("clk")));
    Assertions.assertTrue(graph.backwardClosure(List.of(Node.signal("q"))).contains(Node.signal("rst")));
  }

  @Test
  void testInstanceNodes() throws OptimizerException {
    DependencyGraph graph = new DependencyGraphBuilder(TestDesigns.andChain(ref("a")).getTopModule()).build();
    Assertions.assertEquals(Set.of(Node.instance("u3")), graph.dependenciesOf(Node.signal("y")));
    Assertions.assertTrue(graph.dependenciesOf(Node.instance("u3")).contains(Node.signal("n2")));
    Assertions.assertTrue(graph.readersOf(Node.signal("a")).contains(Node.instance("u0")));
  }

  @Test
  void testWireWithTwoDrivers() {
    HdlModule module = HdlModule.builder("m").input("a", 1).output("y", 1).assign("y", ref("a")).assign("y", ref("a")).build();
    OptimizerException e = buildFails(module);
    Assertions.assertEquals(DiagnosticCategory.MultipleDriverConflict, e.getDiagnostic().category());
    Assertions.assertEquals("y", e.getDiagnostic().location());
  }

  @Test
  void testTwoCombinationalWriters() {
    HdlModule module = HdlModule.builder("m")
                           .input("a", 1)
                           .outputReg("y", 1)
                           .process("p1", Sensitivity.star(), blocking("y", ref("a")))
                           .process("p2", Sensitivity.star(), blocking("y", ref("a")))
                           .build();
    Assertions.assertEquals(DiagnosticCategory.MultipleDriverConflict, buildFails(module).getDiagnostic().category());
  }

  @Test
  void testOneWriterPerDomainIsLegal() throws OptimizerException {
    HdlModule module = HdlModule.builder("m")
                           .input("clk", 1)
                           .input("a", 1)
                           .outputReg("y", 1)
                           .process("comb", Sensitivity.star(), blocking("y", ref("a")))
                           .process("seq", Sensitivity.posedge("clk"), nonBlocking("y", ref("a")))
                           .build();
    Assertions.assertEquals(2, new DependencyGraphBuilder(module).build().driversOf("y").size());
  }

  @Test
  void testProcessWritingWire() {
    HdlModule module = HdlModule.builder("m").input("a", 1).output("y", 1).process("p", Sensitivity.star(), blocking("y", ref("a"))).build();
    Assertions.assertEquals(DiagnosticCategory.MultipleDriverConflict, buildFails(module).getDiagnostic().category());
  }

  @Test
  void testDrivenInput() {
    HdlModule module = HdlModule.builder("m").input("a", 1).input("b", 1).assign("a", ref("b")).build();
    Assertions.assertEquals(DiagnosticCategory.MultipleDriverConflict, buildFails(module).getDiagnostic().category());
  }
}
