package hdlopt.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordinal of an IR element in first-definition order.
 * Flattening extends the index of the instance with the index of the inlined element,
 *   so elements of a flattened instance sort where the instance used to be.
 * Comparison is lexicographic over the ordinal path.
 */
public final class StableIndex implements Comparable<StableIndex> {
  private final List<Integer> path;

  private StableIndex(List<Integer> path) { this.path = Collections.unmodifiableList(path); }

  public static StableIndex of(int ordinal) { return new StableIndex(List.of(ordinal)); }

  /** Index of an element nested under this one, e.g. a signal inside a flattened instance. */
  public StableIndex nested(StableIndex inner) {
    var newPath = new ArrayList<Integer>(path.size() + inner.path.size());
    newPath.addAll(path);
    newPath.addAll(inner.path);
    return new StableIndex(newPath);
  }

  public List<Integer> getPath() { return path; }

  @Override
  public int compareTo(StableIndex other) {
    int common = Math.min(path.size(), other.path.size());
    for (int i = 0; i < common; ++i) {
      int cmp = Integer.compare(path.get(i), other.path.get(i));
      if (cmp != 0)
        return cmp;
    }
    return Integer.compare(path.size(), other.path.size());
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    return path.equals(((StableIndex)obj).path);
  }
  @Override
  public String toString() {
    return path.stream().map(String::valueOf).collect(Collectors.joining("."));
  }
}
