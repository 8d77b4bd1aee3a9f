package hdlopt.ir;

/** Module port. Every port has a signal of the same name in its module. */
public record Port(String name, Direction direction, int width) {
  public enum Direction {
    in("input"),
    out("output"),
    inout("inout");

    /** Keyword used by the netlist emitter. */
    public final String keyword;
    private Direction(String keyword) { this.keyword = keyword; }
  }

  public Port {
    if (width < 1)
      throw new IllegalArgumentException("port " + name + " has non-positive width " + width);
  }

  /** True for ports whose value leaves the module. */
  public boolean isObservable() { return direction != Direction.in; }
}
