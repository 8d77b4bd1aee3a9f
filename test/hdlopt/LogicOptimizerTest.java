package hdlopt;

import static hdlopt.ir.Expression.and;
import static hdlopt.ir.Expression.lit;
import static hdlopt.ir.Expression.ref;
import static hdlopt.ir.Statement.blocking;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import hdlopt.diag.Diagnostic;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.ir.Design;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Instance;
import hdlopt.ir.Sensitivity;
import hdlopt.ui.OptimizerConfig;

class LogicOptimizerTest {
  OptimizerConfig cfg;

  @TempDir
  Path tempDir;

  @BeforeEach
  void setUp() {
    cfg = new OptimizerConfig();
  }

  /** Counter, latch and a foldable mask side by side, plus one module nothing instantiates. */
  private static Design mixedDesign() {
    HdlModule top = HdlModule.builder("top")
                        .input("clk", 1)
                        .input("rst", 1)
                        .input("a", 1)
                        .input("i0", 1)
                        .input("i1", 1)
                        .output("q", 1)
                        .output("z", 1)
                        .output("y", 1)
                        .instance("cnt", "counter", Map.of("clk", ref("clk"), "rst", ref("rst"), "a", ref("a")), Map.of("q", "q"))
                        .instance("lat", "latch", Map.of("i0", ref("i0"), "i1", ref("i1")), Map.of("y", "y"))
                        .assign("z", and(ref("a"), lit(1, 1)))
                        .build();
    HdlModule counter = rename(TestDesigns.counter(true), "counter");
    HdlModule latch = rename(TestDesigns.latch(), "latch");
    return Design.of("top", top, counter, latch, rename(TestDesigns.and2(), "unused"));
  }

  private static HdlModule rename(HdlModule module, String name) {
    return new HdlModule(name, module.getPorts(), module.getSignals().values(), module.getProcesses(), module.getAssignments(),
                         module.getInstances());
  }

  @ParameterizedTest
  @ValueSource(booleans = {false, true})
  void testIdempotent(boolean flatten) {
    cfg.flatten = flatten;
    LogicOptimizer optimizer = new LogicOptimizer(cfg);
    OptimizationResult first = optimizer.optimize(mixedDesign());
    Assertions.assertFalse(first.isAborted());
    OptimizationResult second = optimizer.optimize(first.design().orElseThrow());
    Assertions.assertEquals(first.design(), second.design());
    Assertions.assertEquals(first.netlist(), second.netlist());
    Set<String> added = flattenedFindings(second.diagnostics(), first.design().orElseThrow());
    added.removeAll(flattenedFindings(first.diagnostics(), mixedDesign()));
    Assertions.assertTrue(added.isEmpty(), added.toString());
    if (!flatten)
      Assertions.assertEquals(first.diagnostics(), second.diagnostics());
  }

  /** Category and location of each finding, named as it reads once its module is inlined into the top module. */
  private static Set<String> flattenedFindings(List<Diagnostic> diagnostics, Design design) {
    Set<String> result = new LinkedHashSet<>();
    for (Diagnostic diagnostic : diagnostics)
      result.add(diagnostic.category() + " " + instancePrefix(design, design.getTop(), diagnostic.module()) + diagnostic.location());
    return result;
  }

  /** Flattened name prefix of the first instance path from module down to target, empty for target itself. */
  private static String instancePrefix(Design design, String module, String target) {
    if (module.equals(target))
      return "";
    for (Instance instance : design.getModule(module).orElseThrow().getInstances()) {
      String inner = instancePrefix(design, instance.moduleName(), target);
      if (inner != null)
        return instance.name() + "__" + inner;
    }
    return null;
  }

  @Test
  void testMixedDesign() {
    OptimizationResult result = new LogicOptimizer(cfg).optimize(mixedDesign());
    Design design = result.design().orElseThrow();
    Assertions.assertEquals(Set.of("top", "counter", "latch"), design.getModules().keySet());
    Assertions.assertTrue(result.netlist().orElseThrow().contains("assign z = a;"));
    Assertions.assertEquals(1, result.diagnostics().size());
    Assertions.assertEquals(DiagnosticCategory.LatchInferred, result.diagnostics().get(0).category());
    Assertions.assertEquals("latch", result.diagnostics().get(0).module());
    Assertions.assertFalse(result.hasErrors());
  }

  @Test
  void testChainTiedHighCollapses() {
    cfg.flatten = true;
    OptimizationResult result = new LogicOptimizer(cfg).optimize(TestDesigns.andChain(lit(1, 1)));
    Design design = result.design().orElseThrow();
    Assertions.assertEquals(Set.of("top"), design.getModules().keySet());
    Assertions.assertTrue(design.getTopModule().getInstances().isEmpty());
    Assertions.assertEquals("module top(input a, input b, input c, input d, output y);\n"
                                + "    assign y = a & b & c & d;\n"
                                + "endmodule\n",
                            result.netlist().orElseThrow());
  }

  @ParameterizedTest
  @ValueSource(booleans = {false, true})
  void testChainTiedLowBecomesConstant(boolean flatten) {
    cfg.flatten = flatten;
    OptimizationResult result = new LogicOptimizer(cfg).optimize(TestDesigns.andChain(lit(1, 0)));
    Design design = result.design().orElseThrow();
    Assertions.assertEquals(Set.of("top"), design.getModules().keySet());
    HdlModule top = design.getTopModule();
    Assertions.assertTrue(top.getInstances().isEmpty());
    Assertions.assertEquals(1, top.getAssignments().size());
    Assertions.assertEquals(lit(1, 0), top.getAssignments().get(0).source());
    Assertions.assertTrue(result.netlist().orElseThrow().contains("assign y = 1'b0;"));
  }

  @Test
  void testReusedTemporaryIsNotFoldedEarly() {
    HdlModule module = HdlModule.builder("m")
                           .outputReg("out1", 1)
                           .outputReg("out2", 1)
                           .variable("tmp", 1)
                           .process("p", Sensitivity.star(), blocking("tmp", lit(1, 0)), blocking("out1", ref("tmp")),
                                    blocking("tmp", lit(1, 1)), blocking("out2", ref("tmp")))
                           .build();
    OptimizationResult result = new LogicOptimizer(cfg).optimize(TestDesigns.single(module));
    String netlist = result.netlist().orElseThrow();
    Assertions.assertFalse(netlist.contains("out1 = 1'b1"), netlist);
    Assertions.assertTrue(netlist.contains("out1 = tmp;"), netlist);
  }

  @Test
  void testUnobservedLogicIsRemoved() {
    OptimizationResult result = new LogicOptimizer(cfg).optimize(TestDesigns.single(TestDesigns.counter(false)));
    String netlist = result.netlist().orElseThrow();
    Assertions.assertFalse(netlist.contains("count"), netlist);
    Assertions.assertTrue(netlist.contains("assign z = a;"));
  }

  @Test
  void testObservedCounterIsKept() {
    OptimizationResult result = new LogicOptimizer(cfg).optimize(TestDesigns.single(TestDesigns.counter(true)));
    Assertions.assertEquals(TestDesigns.counter(true), result.design().orElseThrow().getTopModule());
    Assertions.assertTrue(result.diagnostics().isEmpty());
  }

  @Test
  void testFatalErrorAborts() {
    HdlModule loop = HdlModule.builder("top")
                         .input("a", 1)
                         .output("y", 1)
                         .wire("w1", 1)
                         .wire("w2", 1)
                         .assign("w1", and(ref("w2"), ref("a")))
                         .assign("w2", ref("w1"))
                         .assign("y", ref("w1"))
                         .build();
    OptimizationResult result = new LogicOptimizer(cfg).optimize(TestDesigns.single(loop));
    Assertions.assertTrue(result.isAborted());
    Assertions.assertTrue(result.netlist().isEmpty());
    Assertions.assertTrue(result.hasErrors());
    Assertions.assertEquals(DiagnosticCategory.CombinationalLoopError, result.diagnostics().get(result.diagnostics().size() - 1).category());
  }

  @Test
  void testNonConvergence() {
    cfg.max_iterations = 1;
    HdlModule module = HdlModule.builder("top")
                           .input("a", 1)
                           .output("y", 1)
                           .wire("n", 1)
                           .assign("n", lit(1, 1))
                           .assign("y", and(ref("n"), ref("a")))
                           .build();
    OptimizationResult result = new LogicOptimizer(cfg).optimize(TestDesigns.single(module));
    Assertions.assertTrue(result.isAborted());
    Assertions.assertEquals(DiagnosticCategory.NonConvergenceError, result.diagnostics().get(0).category());
  }

  @Test
  void testParallelMatchesSequential() {
    OptimizationResult sequential = new LogicOptimizer(cfg).optimize(mixedDesign());
    cfg.worker_threads = 4;
    OptimizationResult parallel = new LogicOptimizer(cfg).optimize(mixedDesign());
    Assertions.assertEquals(sequential.design(), parallel.design());
    Assertions.assertEquals(sequential.netlist(), parallel.netlist());
    Assertions.assertEquals(sequential.diagnostics(), parallel.diagnostics());
  }

  @Test
  void testWarningsAsErrors() {
    cfg.warnings_as_errors = true;
    OptimizationResult result = new LogicOptimizer(cfg).optimize(TestDesigns.single(TestDesigns.latch()));
    Assertions.assertFalse(result.isAborted());
    Assertions.assertTrue(result.hasErrors());
  }

  @Test
  void testWritesNetlist() throws IOException {
    Path out = tempDir.resolve("out").resolve("top.v");
    OptimizationResult result = new LogicOptimizer(cfg).optimize(TestDesigns.single(TestDesigns.latch()), out.toString());
    Assertions.assertEquals(result.netlist().orElseThrow(), Files.readString(out));
  }
}
