package hdlopt.diag;

/**
 * Thrown by a pass that detects a fatal condition. Carries the diagnostic describing it.
 */
public class OptimizerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Diagnostic diagnostic;

  public OptimizerException(Diagnostic diagnostic) {
    super(diagnostic.toString());
    this.diagnostic = diagnostic;
  }

  public OptimizerException(DiagnosticCategory category, String module, String location, String detail) {
    this(new Diagnostic(category, Severity.error, module, location, detail));
  }

  public Diagnostic getDiagnostic() { return diagnostic; }
}
