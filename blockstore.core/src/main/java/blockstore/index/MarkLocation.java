package blockstore.index;

import java.util.Objects;

public final class MarkLocation {
  public final String name;
  public final long offset;

  public MarkLocation(String name, long offset) {
    this.name = name;
    this.offset = offset;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    MarkLocation location = (MarkLocation)o;
    return offset == location.offset &&
           Objects.equals(name, location.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, offset);
  }

  @Override
  public String toString() {
    return name + "@" + offset;
  }
}
