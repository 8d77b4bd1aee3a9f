package hdlopt.ir;

/** Unconditional driver of a wire. */
public record ContinuousAssignment(String target, Expression source, StableIndex index) {
  public ContinuousAssignment withSource(Expression newSource) { return new ContinuousAssignment(target, newSource, index); }
}
