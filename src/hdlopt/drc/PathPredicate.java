package hdlopt.drc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Conjunction of branch decisions along one control-flow path, e.g. {@code ¬i0 ∧ (sel == 2'b01)}.
 * An empty conjunction is the always-true path.
 */
public final class PathPredicate {
  /** One decision: a condition text taken positively or negatively. */
  public record Decision(String condition, boolean positive) {
    public Decision negate() { return new Decision(condition, !positive); }

    @Override
    public String toString() {
      String text = condition.contains(" ") ? "(" + condition + ")" : condition;
      return positive ? text : "¬" + text;
    }
  }

  public static final PathPredicate TRUE = new PathPredicate(List.of());

  private final List<Decision> decisions;

  private PathPredicate(List<Decision> decisions) { this.decisions = Collections.unmodifiableList(decisions); }

  public List<Decision> getDecisions() { return decisions; }

  /** The predicate extended by one more decision, or null if it contradicts an earlier decision. */
  public PathPredicate and(Decision decision) {
    if (decisions.contains(decision.negate()))
      return null;
    if (decisions.contains(decision))
      return this;
    List<Decision> extended = new ArrayList<>(decisions);
    extended.add(decision);
    return new PathPredicate(extended);
  }

  @Override
  public String toString() {
    if (decisions.isEmpty())
      return "true";
    return decisions.stream().map(Decision::toString).collect(Collectors.joining(" ∧ "));
  }

  @Override
  public int hashCode() {
    return decisions.hashCode();
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    return decisions.equals(((PathPredicate)obj).decisions);
  }

  /** Disjunction of path predicates, each conjunction parenthesized when it has more than one decision. */
  public static String disjunction(List<PathPredicate> paths) {
    if (paths.size() == 1)
      return paths.get(0).toString();
    return paths.stream()
        .map(path -> path.decisions.size() > 1 ? "(" + path + ")" : path.toString())
        .collect(Collectors.joining(" ∨ "));
  }
}
