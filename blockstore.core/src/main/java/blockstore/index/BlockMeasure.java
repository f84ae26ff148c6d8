package blockstore.index;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.Set;

import java.util.Objects;

/**
 * Summary of a run of blocks: the ids it contains and its total text length.
 */
public final class BlockMeasure {

  public static final BlockMeasure EMPTY = new BlockMeasure(new Set<>(), 0);

  public final ISet<String> ids;
  public final long length;

  public BlockMeasure(ISet<String> ids, long length) {
    this.ids = ids;
    this.length = length;
  }

  public static BlockMeasure of(IndexEntry entry) {
    return new BlockMeasure(new Set<String>().add(entry.id), entry.length);
  }

  public BlockMeasure add(BlockMeasure other) {
    if (other.ids.size() == 0) {
      return other.length == 0 ? this : new BlockMeasure(ids, length + other.length);
    }
    if (ids.size() == 0) {
      return length == 0 ? other : new BlockMeasure(other.ids, length + other.length);
    }
    return new BlockMeasure(ids.union(other.ids), length + other.length);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BlockMeasure measure = (BlockMeasure)o;
    return length == measure.length &&
           Objects.equals(ids, measure.ids);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ids, length);
  }

  @Override
  public String toString() {
    return "BlockMeasure{" +
           "ids=" + ids +
           ", length=" + length +
           '}';
  }
}
