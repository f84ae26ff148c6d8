package blockstore;

import java.util.Objects;

/**
 * A position expressed as a block id and an offset into that block's text.
 */
public final class BlockOffset {
  public final String block;
  public final long offset;

  public BlockOffset(String block, long offset) {
    this.block = block;
    this.offset = offset;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BlockOffset that = (BlockOffset)o;
    return offset == that.offset &&
           Objects.equals(block, that.block);
  }

  @Override
  public int hashCode() {
    return Objects.hash(block, offset);
  }

  @Override
  public String toString() {
    return "BlockOffset{" + block + ":" + offset + '}';
  }
}
