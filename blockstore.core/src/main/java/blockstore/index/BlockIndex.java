package blockstore.index;

import blockstore.Block;
import blockstore.BlockAccess;
import blockstore.BlockOffset;
import blockstore.fingertree.FingerTree;
import blockstore.fingertree.Measurer;
import blockstore.fingertree.Split;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Order-statistics index over the block list: one leaf per block, in list order, measured by id set and
 * text length. Values are immutable, every update returns a new index.
 */
public final class BlockIndex {

  private static final Logger LOG = LogManager.getLogger(BlockIndex.class);

  public static final Measurer<BlockMeasure, IndexEntry> MEASURER = new Measurer<BlockMeasure, IndexEntry>() {
    @Override
    public BlockMeasure identity() {
      return BlockMeasure.EMPTY;
    }

    @Override
    public BlockMeasure measure(IndexEntry entry) {
      return BlockMeasure.of(entry);
    }

    @Override
    public BlockMeasure sum(BlockMeasure m1, BlockMeasure m2) {
      return m1.add(m2);
    }
  };

  public static final BlockIndex EMPTY = new BlockIndex(FingerTree.empty(MEASURER));

  public final FingerTree<BlockMeasure, IndexEntry> tree;

  public BlockIndex(FingerTree<BlockMeasure, IndexEntry> tree) {
    this.tree = tree;
  }

  public static BlockIndex of(Iterable<Block> blocks) {
    ArrayList<IndexEntry> entries = new ArrayList<>();
    for (Block block : blocks) {
      entries.add(IndexEntry.of(block));
    }
    return new BlockIndex(FingerTree.fromList(entries, MEASURER));
  }

  public long length() {
    return tree.measure().length;
  }

  public long size() {
    return tree.measure().ids.size();
  }

  public boolean isEmpty() {
    return tree.isEmpty();
  }

  public boolean contains(@Nullable String id) {
    return id != null && tree.measure().ids.contains(id);
  }

  public List<IndexEntry> entries() {
    return tree.toList();
  }

  public Split<BlockMeasure, IndexEntry> splitOnId(String id) {
    return tree.split(m -> m.ids.contains(id));
  }

  public Split<BlockMeasure, IndexEntry> splitOnOffset(long offset) {
    return tree.split(m -> m.length > offset);
  }

  /**
   * @return document offset of the first character of the block, 0 for an unknown id
   */
  public long offsetForBlock(String id) {
    Split<BlockMeasure, IndexEntry> split = splitOnId(id);
    return split.isFound() ? split.left.measure().length : 0;
  }

  /**
   * @throws IllegalArgumentException for an offset outside {@code [0, length()]}
   */
  @Nullable
  public BlockOffset blockOffsetForDocOffset(long offset) {
    if (offset < 0 || offset > length()) {
      throw new IllegalArgumentException("Offset " + offset + " outside [0, " + length() + "]");
    }
    Split<BlockMeasure, IndexEntry> split = splitOnOffset(offset);
    if (split.isFound()) {
      return new BlockOffset(split.mid.id, offset - split.left.measure().length);
    }
    // at or past the end of the document
    IndexEntry last = split.left.peekLast();
    return last == null ? null : new BlockOffset(last.id, last.length);
  }

  @Nullable
  public String blockForOffset(long offset) {
    Split<BlockMeasure, IndexEntry> split = splitOnOffset(offset);
    if (split.isFound()) {
      return split.mid.id;
    }
    IndexEntry last = split.left.peekLast();
    return last == null ? null : last.id;
  }

  public BlockIndex unindexBlock(@Nullable String id) {
    if (!contains(id)) {
      return this;
    }
    Split<BlockMeasure, IndexEntry> split = splitOnId(id);
    return new BlockIndex(split.left.concat(split.right));
  }

  /**
   * Tells whether {@code a} is immediately followed by {@code b} in the index.
   * A null {@code a} stands for the document start, a null {@code b} for its end.
   */
  public boolean nodeOrder(@Nullable String a, @Nullable String b) {
    if (b == null) {
      IndexEntry last = tree.peekLast();
      return a == null ? last == null : last != null && last.id.equals(a);
    }
    if (!contains(b)) {
      return false;
    }
    IndexEntry before = splitOnId(b).left.peekLast();
    return a == null ? before == null : before != null && before.id.equals(a);
  }

  /**
   * Puts {@code block} into the index at the place its links say it belongs.
   * <p>
   * The fast path patches the block's own leaf when its index neighbours already agree with {@code prev}/{@code next}.
   * Next it tries to drop the block between its two neighbours when those are adjacent in the index, or right after
   * {@code prev} when {@code next} is not indexed yet.
   * Failing both the index has drifted from the list around the block and is repaired by walking the links.
   */
  public BlockIndex indexBlock(Block block, BlockAccess blocks) {
    IndexEntry entry = IndexEntry.of(block);
    Split<BlockMeasure, IndexEntry> split = splitOnId(block.id);
    if (split.isFound()) {
      IndexEntry next = split.right.peekFirst();
      IndexEntry prev = split.left.peekLast();
      if (Objects.equals(next == null ? null : next.id, block.next) &&
          Objects.equals(prev == null ? null : prev.id, block.prev)) {
        return new BlockIndex(split.left.addLast(entry).concat(split.right));
      }
    }
    BlockIndex index = split.isFound() ? new BlockIndex(split.left.concat(split.right)) : this;
    FingerTree<BlockMeasure, IndexEntry> between = index.insertBetween(block.prev, block.next, entry);
    if (between != null) {
      return new BlockIndex(between);
    }
    return index.insertAndRepair(block, blocks);
  }

  @Nullable
  private FingerTree<BlockMeasure, IndexEntry> insertBetween(@Nullable String prev, @Nullable String next, IndexEntry entry) {
    if (contains(next)) {
      Split<BlockMeasure, IndexEntry> split = splitOnId(next);
      IndexEntry before = split.left.peekLast();
      if (prev == null ? before != null : before == null || !before.id.equals(prev)) {
        return null;
      }
      return split.left.addLast(entry).concat(split.rest());
    }
    // next is absent or not indexed yet
    if (prev == null) {
      return next != null || tree.isEmpty() ? tree.addFirst(entry) : null;
    }
    if (!contains(prev)) {
      return null;
    }
    Split<BlockMeasure, IndexEntry> split = splitOnId(prev);
    if (next == null && !split.right.isEmpty()) {
      return null;
    }
    return split.left.addLast(split.mid).addLast(entry).concat(split.right);
  }

  /*
   * inserts the block next to whichever neighbour is indexed,
   * then walks the list forwards and backwards moving neighbours until the index agrees with the links
   */
  private BlockIndex insertAndRepair(Block block, BlockAccess blocks) {
    LOG.warn("Block index out of sync around {}, repairing", block.id);
    IndexEntry entry = IndexEntry.of(block);
    FingerTree<BlockMeasure, IndexEntry> t;
    if (contains(block.next)) {
      Split<BlockMeasure, IndexEntry> split = splitOnId(block.next);
      t = split.left.addLast(entry).concat(split.rest());
    }
    else if (contains(block.prev)) {
      Split<BlockMeasure, IndexEntry> split = splitOnId(block.prev);
      t = split.left.addLast(split.mid).addLast(entry).concat(split.right);
    }
    else if (block.prev == null && block.next == null) {
      t = FingerTree.single(MEASURER, entry);
    }
    else if (block.prev == null) {
      t = tree.addFirst(entry);
    }
    else {
      t = tree.addLast(entry);
    }
    BlockIndex index = new BlockIndex(t);
    HashSet<String> seen = new HashSet<>();
    seen.add(block.id);
    int moved = 0;

    Block mark = block;
    Block cur = blocks.getBlock(block.next);
    while (cur != null && seen.add(cur.id) && !index.nodeOrder(mark.id, cur.id)) {
      index = index.unindexBlock(cur.id);
      Split<BlockMeasure, IndexEntry> split = index.splitOnId(mark.id);
      index = new BlockIndex(split.left.addLast(split.mid).addLast(IndexEntry.of(cur)).concat(split.right));
      moved++;
      mark = cur;
      cur = blocks.getBlock(cur.next);
    }

    mark = block;
    cur = blocks.getBlock(block.prev);
    while (cur != null && seen.add(cur.id) && !index.nodeOrder(cur.id, mark.id)) {
      index = index.unindexBlock(cur.id);
      Split<BlockMeasure, IndexEntry> split = index.splitOnId(mark.id);
      index = new BlockIndex(split.left.addLast(IndexEntry.of(cur)).concat(split.rest()));
      moved++;
      mark = cur;
      cur = blocks.getBlock(cur.prev);
    }
    LOG.debug("Repaired block index around {}, moved {} neighbours", block.id, moved);
    return index;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BlockIndex index = (BlockIndex)o;
    return entries().equals(index.entries());
  }

  @Override
  public int hashCode() {
    return entries().hashCode();
  }

  @Override
  public String toString() {
    return "BlockIndex" + entries();
  }
}
