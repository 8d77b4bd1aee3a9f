package hdlopt;

import java.util.List;
import java.util.Optional;
import hdlopt.diag.Diagnostic;
import hdlopt.diag.Severity;
import hdlopt.ir.Design;

/**
 * Outcome of one pipeline run.
 * The optimized design and its netlist are absent if a fatal diagnostic aborted the run.
 */
public record OptimizationResult(Optional<Design> design, Optional<String> netlist, List<Diagnostic> diagnostics) {
  public OptimizationResult { diagnostics = List.copyOf(diagnostics); }

  public boolean isAborted() { return design.isEmpty(); }

  /** True if any diagnostic has error severity, including promoted warnings. */
  public boolean hasErrors() { return diagnostics.stream().anyMatch(diagnostic -> diagnostic.severity() == Severity.error); }
}
