package hdlopt.diag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Accumulates diagnostics of one pipeline run (or of one module, when modules are optimized concurrently).
 * Each diagnostic is logged once when reported.
 */
public class DiagnosticCollector {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final boolean warningsAsErrors;

  public DiagnosticCollector() { this(false); }
  public DiagnosticCollector(boolean warningsAsErrors) { this.warningsAsErrors = warningsAsErrors; }

  public void report(Diagnostic diagnostic) {
    if (warningsAsErrors && diagnostic.severity() == Severity.warning)
      diagnostic = diagnostic.withSeverity(Severity.error);
    if (diagnostic.category().fatal)
      logger.fatal(diagnostic.toString());
    else if (diagnostic.severity() == Severity.error)
      logger.error(diagnostic.toString());
    else
      logger.warn(diagnostic.toString());
    diagnostics.add(diagnostic);
  }

  public void report(DiagnosticCategory category, Severity severity, String module, String location, String detail) {
    report(new Diagnostic(category, severity, module, location, detail));
  }

  public void warn(DiagnosticCategory category, String module, String location, String detail) {
    report(category, Severity.warning, module, location, detail);
  }

  /** Adds diagnostics reported elsewhere without logging them a second time. */
  public void addAll(List<Diagnostic> others) { diagnostics.addAll(others); }

  public List<Diagnostic> getDiagnostics() { return Collections.unmodifiableList(diagnostics); }

  public boolean hasErrors() { return diagnostics.stream().anyMatch(diagnostic -> diagnostic.severity() == Severity.error); }
}
