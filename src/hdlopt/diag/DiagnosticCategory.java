package hdlopt.diag;

/**
 * Diagnostic taxonomy. Fatal categories abort the pipeline at the pass that detects them.
 */
public enum DiagnosticCategory {
  /** A cycle through continuous assignments or combinational processes without a sequential element. */
  CombinationalLoopError(true),
  /** A wire with more than one driver, or a variable with more than one writer per domain. */
  MultipleDriverConflict(true),
  /** The instance hierarchy is not a DAG. */
  HierarchyCycleError(true),
  /** A fixpoint pass exceeded its iteration cap. */
  NonConvergenceError(true),
  /** A name in the IR refers to no declared signal, port, instance or module. */
  UndeclaredReference(true),
  /** A combinational process leaves a signal unassigned on some path. */
  LatchInferred(false),
  /** Overlapping case patterns select different branches. */
  AmbiguousCaseOverlap(false),
  /** A process reads or lists signals inconsistently with its trigger list. */
  SensitivityMismatch(false),
  /** A blocking assignment reads a variable that a later blocking assignment writes. */
  OrderDependentAssignment(false),
  /** An analysis skipped part of the design because it exceeded a configured limit. */
  AnalysisLimitExceeded(false);

  public final boolean fatal;

  private DiagnosticCategory(boolean fatal) { this.fatal = fatal; }
}
