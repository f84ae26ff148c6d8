package blockstore.index;

import java.util.Objects;

/**
 * Leaf of the {@link MarkIndex}. {@code delta} is the distance from the previous mark (or from the
 * document start for the first one), so moving every mark after a point only touches one leaf.
 */
public final class Mark {
  public final String name;
  public final long delta;

  public Mark(String name, long delta) {
    this.name = name;
    this.delta = delta;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Mark mark = (Mark)o;
    return delta == mark.delta &&
           Objects.equals(name, mark.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, delta);
  }

  @Override
  public String toString() {
    return "Mark{" + name + " +" + delta + '}';
  }
}
