package hdlopt.ir;

/**
 * A net or variable owned by a module.
 * Wires are driven by at most one continuous assignment or instance output;
 * variables are written from process blocks.
 */
public record Signal(String name, int width, Kind kind, StableIndex index) {
  public enum Kind {
    wire("wire"),
    variable("reg");

    public final String keyword;
    private Kind(String keyword) { this.keyword = keyword; }
  }

  public Signal {
    if (width < 1)
      throw new IllegalArgumentException("signal " + name + " has non-positive width " + width);
  }

  public Signal withName(String newName) { return new Signal(newName, width, kind, index); }
  public Signal withIndex(StableIndex newIndex) { return new Signal(name, width, kind, newIndex); }
}
