package blockstore.index;

import blockstore.fingertree.FingerTree;
import blockstore.fingertree.Measurer;
import blockstore.fingertree.Split;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Named positions in the document. Each leaf stores its distance to the previous mark, so shifting
 * every mark after an edit is a matter of rewriting the first leaf past the edit.
 */
public final class MarkIndex {

  public static final Measurer<MarkMeasure, Mark> MEASURER = new Measurer<MarkMeasure, Mark>() {
    @Override
    public MarkMeasure identity() {
      return MarkMeasure.EMPTY;
    }

    @Override
    public MarkMeasure measure(Mark mark) {
      return MarkMeasure.of(mark);
    }

    @Override
    public MarkMeasure sum(MarkMeasure m1, MarkMeasure m2) {
      return m1.add(m2);
    }
  };

  public static final MarkIndex EMPTY = new MarkIndex(FingerTree.empty(MEASURER));

  public final FingerTree<MarkMeasure, Mark> tree;

  public MarkIndex(FingerTree<MarkMeasure, Mark> tree) {
    this.tree = tree;
  }

  public boolean contains(String name) {
    return tree.measure().names.contains(name);
  }

  public long size() {
    return tree.measure().names.size();
  }

  public boolean isEmpty() {
    return tree.isEmpty();
  }

  private Split<MarkMeasure, Mark> splitOnName(String name) {
    return tree.split(m -> m.names.contains(name));
  }

  /**
   * Adds a mark, replacing any mark with the same name. The new mark goes before marks already at {@code offset}.
   */
  public MarkIndex addMark(String name, long offset) {
    if (offset < 0) {
      throw new IllegalArgumentException("negative mark offset " + offset + " for " + name);
    }
    FingerTree<MarkMeasure, Mark> marks = contains(name) ? removeMark(name).tree : tree;
    Split<MarkMeasure, Mark> split = marks.split(m -> m.length >= offset);
    long l = split.left.measure().length;
    FingerTree<MarkMeasure, Mark> rest = split.right;
    if (split.isFound()) {
      rest = rest.addFirst(new Mark(split.mid.name, l + split.mid.delta - offset));
    }
    return new MarkIndex(split.left.concat(rest.addFirst(new Mark(name, offset - l))));
  }

  public MarkIndex removeMark(String name) {
    if (!contains(name)) {
      return this;
    }
    Split<MarkMeasure, Mark> split = splitOnName(name);
    Mark removed = split.mid;
    FingerTree<MarkMeasure, Mark> rest = split.right;
    Mark next = rest.peekFirst();
    if (next != null) {
      rest = rest.removeFirst().addFirst(new Mark(next.name, removed.delta + next.delta));
    }
    return new MarkIndex(split.left.concat(rest));
  }

  @Nullable
  public Long getMarkLocation(String name) {
    if (!contains(name)) {
      return null;
    }
    Split<MarkMeasure, Mark> split = splitOnName(name);
    return split.left.measure().length + split.mid.delta;
  }

  /**
   * @return every mark with its absolute offset, in document order
   */
  public List<MarkLocation> listMarks() {
    ArrayList<MarkLocation> result = new ArrayList<>();
    long offset = 0;
    for (Mark mark : tree) {
      offset += mark.delta;
      result.add(new MarkLocation(mark.name, offset));
    }
    return result;
  }

  /**
   * Moves marks after the text in {@code [start, end)} was replaced by {@code newLength} characters.
   * Marks at or before {@code start} stay, marks at or after {@code end} shift by the length difference,
   * marks inside the replaced range shift too but never past {@code start}.
   */
  public MarkIndex floatMarks(long start, long end, long newLength) {
    long delta = newLength - (end - start);
    if (delta == 0) {
      return this;
    }
    Split<MarkMeasure, Mark> after = tree.split(m -> m.length > start);
    if (!after.isFound()) {
      return this;
    }
    MarkMeasure leftMeasure = after.left.measure();
    Split<MarkMeasure, Mark> tail = after.rest().split(m -> m.length >= end, leftMeasure);

    FingerTree<MarkMeasure, Mark> result = after.left;
    long oldOffset = leftMeasure.length;
    long newOffset = leftMeasure.length;
    for (Mark mark : tail.left) {
      oldOffset += mark.delta;
      long moved = Math.max(start, oldOffset + delta);
      result = result.addLast(new Mark(mark.name, moved - newOffset));
      newOffset = moved;
    }
    if (tail.isFound()) {
      oldOffset += tail.mid.delta;
      result = result.addLast(new Mark(tail.mid.name, oldOffset + delta - newOffset)).concat(tail.right);
    }
    return new MarkIndex(result);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return listMarks().equals(((MarkIndex)o).listMarks());
  }

  @Override
  public int hashCode() {
    return listMarks().hashCode();
  }

  @Override
  public String toString() {
    return "MarkIndex" + listMarks();
  }
}
