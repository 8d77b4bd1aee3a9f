package hdlopt.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Sensitivity description of a process block: either level-sensitive to all reads ({@code @*}) or an explicit list.
 */
public record Sensitivity(boolean allReads, List<Entry> entries) {
  public enum Edge {
    posedge,
    negedge,
    /** Plain signal in the list, triggers on any change. */
    level
  }

  public record Entry(Edge edge, String signal) {
    @Override
    public String toString() {
      return edge == Edge.level ? signal : edge.name() + " " + signal;
    }
  }

  public Sensitivity {
    entries = List.copyOf(entries);
    if (allReads && !entries.isEmpty())
      throw new IllegalArgumentException("@* sensitivity cannot carry explicit entries");
    if (!allReads && entries.isEmpty())
      throw new IllegalArgumentException("explicit sensitivity list is empty");
  }

  public static Sensitivity star() { return new Sensitivity(true, List.of()); }
  public static Sensitivity of(Entry... entries) { return new Sensitivity(false, List.of(entries)); }
  public static Sensitivity posedge(String signal) { return of(new Entry(Edge.posedge, signal)); }
  public static Entry edge(Edge edge, String signal) { return new Entry(edge, signal); }

  /** True if some entry is edge-qualified, which makes the process sequential. */
  public boolean hasEdges() { return entries.stream().anyMatch(entry -> entry.edge() != Edge.level); }

  public ProcessBlock.Domain domain() { return hasEdges() ? ProcessBlock.Domain.sequential : ProcessBlock.Domain.combinational; }

  public List<String> signals() { return entries.stream().map(Entry::signal).collect(Collectors.toList()); }

  @Override
  public String toString() {
    if (allReads)
      return "*";
    return entries.stream().map(Entry::toString).collect(Collectors.joining(" or "));
  }
}
