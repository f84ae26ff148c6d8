package blockstore.index;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.Set;

import java.util.Objects;

public final class MarkMeasure {

  public static final MarkMeasure EMPTY = new MarkMeasure(new Set<>(), 0);

  public final ISet<String> names;
  // running absolute offset
  public final long length;

  public MarkMeasure(ISet<String> names, long length) {
    this.names = names;
    this.length = length;
  }

  public static MarkMeasure of(Mark mark) {
    return new MarkMeasure(new Set<String>().add(mark.name), mark.delta);
  }

  public MarkMeasure add(MarkMeasure other) {
    if (other.names.size() == 0) {
      return other.length == 0 ? this : new MarkMeasure(names, length + other.length);
    }
    if (names.size() == 0) {
      return length == 0 ? other : new MarkMeasure(other.names, length + other.length);
    }
    return new MarkMeasure(names.union(other.names), length + other.length);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    MarkMeasure measure = (MarkMeasure)o;
    return length == measure.length &&
           Objects.equals(names, measure.names);
  }

  @Override
  public int hashCode() {
    return Objects.hash(names, length);
  }

  @Override
  public String toString() {
    return "MarkMeasure{" +
           "names=" + names +
           ", length=" + length +
           '}';
  }
}
