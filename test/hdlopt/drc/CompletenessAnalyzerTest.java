package hdlopt.drc;

import static hdlopt.ir.Expression.lit;
import static hdlopt.ir.Expression.not;
import static hdlopt.ir.Expression.ref;
import static hdlopt.ir.Statement.arm;
import static hdlopt.ir.Statement.blocking;
import static hdlopt.ir.Statement.ifElse;
import static hdlopt.ir.Statement.ifThen;
import static hdlopt.ir.Statement.nonBlocking;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import hdlopt.TestDesigns;
import hdlopt.diag.Diagnostic;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.diag.DiagnosticCollector;
import hdlopt.diag.Severity;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Sensitivity;
import hdlopt.ir.Sensitivity.Edge;
import hdlopt.ir.Statement;
import hdlopt.ui.OptimizerConfig;

class CompletenessAnalyzerTest {
  OptimizerConfig cfg;

  @BeforeEach
  void setUp() {
    cfg = new OptimizerConfig();
  }

  private List<Diagnostic> analyze(HdlModule module) {
    DiagnosticCollector diagnostics = new DiagnosticCollector();
    new CompletenessAnalyzer(TestDesigns.single(module), cfg).analyze(module, diagnostics);
    return diagnostics.getDiagnostics();
  }

  private static HdlModule caseModule(boolean withDefault, String... patterns) {
    List<Statement.CaseArm> arms = new ArrayList<>();
    for (int i = 0; i < patterns.length; ++i)
      arms.add(arm(patterns[i], blocking("y", lit(2, i))));
    return HdlModule.builder("m")
        .input("s", 2)
        .outputReg("y", 2)
        .process("p", Sensitivity.star(),
                 new Statement.Case(ref("s"), arms, withDefault ? Optional.of(List.of(blocking("y", lit(2, 0)))) : Optional.empty()))
        .build();
  }

  @Test
  void testLatchOnMissingElse() {
    List<Diagnostic> diagnostics = analyze(TestDesigns.latch());
    Assertions.assertEquals(1, diagnostics.size());
    Diagnostic latch = diagnostics.get(0);
    Assertions.assertEquals(DiagnosticCategory.LatchInferred, latch.category());
    Assertions.assertEquals(Severity.warning, latch.severity());
    Assertions.assertEquals("y", latch.location());
    Assertions.assertEquals("y holds its previous value in process p when ¬i0", latch.detail());
  }

  @Test
  void testUnassignedPathPredicate() {
    HdlModule module = TestDesigns.latch();
    var paths = new CompletenessAnalyzer(TestDesigns.single(module), cfg).unassignedPaths(module, module.getProcesses().get(0), "y");
    Assertions.assertEquals("[¬i0]", paths.orElseThrow().toString());
  }

  @Test
  void testCompleteIfElse() {
    HdlModule module = HdlModule.builder("m")
                           .input("i0", 1)
                           .input("i1", 1)
                           .outputReg("y", 1)
                           .process("p", Sensitivity.star(), ifElse(ref("i0"), List.of(blocking("y", ref("i1"))), List.of(blocking("y", lit(1, 0)))))
                           .build();
    Assertions.assertTrue(analyze(module).isEmpty());
  }

  @Test
  void testContradictoryPathIsPruned() {
    // the else branch of the second test is the only way to reach it with y still unassigned
    HdlModule module = HdlModule.builder("m")
                           .input("i0", 1)
                           .outputReg("y", 1)
                           .process("p", Sensitivity.star(), ifThen(ref("i0"), blocking("y", lit(1, 1))),
                                    ifElse(ref("i0"), List.of(), List.of(blocking("y", lit(1, 0)))))
                           .build();
    Assertions.assertTrue(analyze(module).isEmpty());
  }

  @Test
  void testSequentialProcessHoldsWithoutLatch() {
    Assertions.assertTrue(analyze(TestDesigns.counter(true)).isEmpty());
  }

  @Test
  void testFullCaseWithoutDefault() {
    Assertions.assertTrue(analyze(caseModule(false, "00", "01", "10", "11")).isEmpty());
  }

  @Test
  void testIncompleteCase() {
    List<Diagnostic> diagnostics = analyze(caseModule(false, "00", "01", "10"));
    Assertions.assertEquals(1, diagnostics.size());
    Assertions.assertEquals("y holds its previous value in process p when ¬(s == 2'b00) ∧ ¬(s == 2'b01) ∧ ¬(s == 2'b10)",
                            diagnostics.get(0).detail());
  }

  @Test
  void testDefaultCompletesCase() {
    Assertions.assertTrue(analyze(caseModule(true, "00")).isEmpty());
  }

  @Test
  void testOverlapWarning() {
    List<Diagnostic> diagnostics = analyze(caseModule(true, "1?", "10"));
    Assertions.assertEquals(1, diagnostics.size());
    Assertions.assertEquals(DiagnosticCategory.AmbiguousCaseOverlap, diagnostics.get(0).category());
    Assertions.assertEquals(Severity.warning, diagnostics.get(0).severity());
    Assertions.assertEquals("p", diagnostics.get(0).location());
  }

  @Test
  void testOverlapStrict() {
    cfg.strict_case_overlap = true;
    List<Diagnostic> diagnostics = analyze(caseModule(true, "1?", "10"));
    Assertions.assertEquals(Severity.error, diagnostics.get(0).severity());
  }

  @Test
  void testMissingSensitivityEntry() {
    HdlModule module = HdlModule.builder("m")
                           .input("a", 1)
                           .input("b", 1)
                           .outputReg("y", 1)
                           .process("p", Sensitivity.of(Sensitivity.edge(Edge.level, "a")),
                                    ifElse(ref("a"), List.of(blocking("y", ref("b"))), List.of(blocking("y", lit(1, 0)))))
                           .build();
    List<Diagnostic> diagnostics = analyze(module);
    Assertions.assertEquals(1, diagnostics.size());
    Assertions.assertEquals(DiagnosticCategory.SensitivityMismatch, diagnostics.get(0).category());
    Assertions.assertTrue(diagnostics.get(0).detail().contains("reads b"), diagnostics.get(0).detail());
  }

  @Test
  void testAmbiguousClock() {
    HdlModule module = HdlModule.builder("m")
                           .input("clk", 1)
                           .input("clk2", 1)
                           .input("d", 1)
                           .outputReg("q", 1)
                           .process("p", Sensitivity.of(Sensitivity.edge(Edge.posedge, "clk"), Sensitivity.edge(Edge.posedge, "clk2")),
                                    nonBlocking("q", ref("d")))
                           .build();
    List<Diagnostic> diagnostics = analyze(module);
    Assertions.assertEquals(1, diagnostics.size());
    Assertions.assertTrue(diagnostics.get(0).detail().contains("ambiguous clock"), diagnostics.get(0).detail());
  }

  @Test
  void testAsyncResetIsAccepted() {
    HdlModule module = HdlModule.builder("m")
                           .input("clk", 1)
                           .input("rst_n", 1)
                           .input("d", 1)
                           .outputReg("q", 1)
                           .process("p", Sensitivity.of(Sensitivity.edge(Edge.posedge, "clk"), Sensitivity.edge(Edge.negedge, "rst_n")),
                                    ifElse(not(ref("rst_n")), List.of(nonBlocking("q", lit(1, 0))), List.of(nonBlocking("q", ref("d")))))
                           .build();
    Assertions.assertTrue(analyze(module).isEmpty());
  }

  @Test
  void testEdgeSignalReadAsData() {
    HdlModule module = HdlModule.builder("m")
                           .input("clk", 1)
                           .outputReg("q", 1)
                           .process("p", Sensitivity.posedge("clk"), nonBlocking("q", ref("clk")))
                           .build();
    List<Diagnostic> diagnostics = analyze(module);
    Assertions.assertEquals(1, diagnostics.size());
    Assertions.assertTrue(diagnostics.get(0).detail().contains("edge signal clk"), diagnostics.get(0).detail());
  }

  @Test
  void testPathLimit() {
    cfg.max_paths_per_signal = 2;
    HdlModule module = HdlModule.builder("m")
                           .input("a", 1)
                           .input("b", 1)
                           .outputReg("y", 1)
                           .variable("v", 1)
                           .process("p", Sensitivity.star(), blocking("v", ref("a")), ifThen(ref("a"), blocking("v", lit(1, 0))),
                                    ifThen(ref("b"), blocking("v", lit(1, 1))), ifThen(ref("a"), blocking("y", ref("v"))),
                                    ifThen(ref("b"), blocking("y", ref("v"))), blocking("y", ref("v")))
                           .build();
    var analyzer = new CompletenessAnalyzer(TestDesigns.single(module), cfg);
    Assertions.assertTrue(analyzer.unassignedPaths(module, module.getProcesses().get(0), "y").isEmpty());
    List<Diagnostic> diagnostics = analyze(module);
    Assertions.assertEquals(1, diagnostics.size());
    Assertions.assertEquals(DiagnosticCategory.AnalysisLimitExceeded, diagnostics.get(0).category());
    Assertions.assertEquals(Severity.warning, diagnostics.get(0).severity());
    Assertions.assertEquals("y", diagnostics.get(0).location());
  }
}
