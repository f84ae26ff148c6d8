package blockstore.index;

import blockstore.Block;

import java.util.Objects;

/**
 * Leaf of the {@link BlockIndex}: a block id and the length of its text.
 */
public final class IndexEntry {
  public final String id;
  public final long length;

  public IndexEntry(String id, long length) {
    this.id = id;
    this.length = length;
  }

  public static IndexEntry of(Block block) {
    return new IndexEntry(block.id, block.length());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    IndexEntry entry = (IndexEntry)o;
    return length == entry.length &&
           Objects.equals(id, entry.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, length);
  }

  @Override
  public String toString() {
    return "[" + id + " " + length + "]";
  }
}
