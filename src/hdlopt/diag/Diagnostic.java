package hdlopt.diag;

/**
 * One finding of a pass.
 * @param module the module the finding belongs to
 * @param location the signal, process or instance the finding refers to
 */
public record Diagnostic(DiagnosticCategory category, Severity severity, String module, String location, String detail) {

  public Diagnostic withSeverity(Severity newSeverity) { return new Diagnostic(category, newSeverity, module, location, detail); }

  @Override
  public String toString() {
    return String.format("%s %s [%s.%s]: %s", severity, category, module, location, detail);
  }
}
