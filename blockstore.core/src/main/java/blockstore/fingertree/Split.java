package blockstore.fingertree;

import org.jetbrains.annotations.Nullable;

/**
 * Result of {@link FingerTree#split}: everything before the element where the predicate flips,
 * that element, and everything after it.
 * {@code mid} is null when the predicate never became true, {@code left} then holds the whole tree.
 */
public final class Split<M, T> {
  public final FingerTree<M, T> left;
  @Nullable
  public final T mid;
  public final FingerTree<M, T> right;

  Split(FingerTree<M, T> left, @Nullable T mid, FingerTree<M, T> right) {
    this.left = left;
    this.mid = mid;
    this.right = right;
  }

  public boolean isFound() {
    return mid != null;
  }

  /**
   * {@code mid} followed by {@code right}
   */
  public FingerTree<M, T> rest() {
    return mid == null ? right : right.addFirst(mid);
  }

  @Override
  public String toString() {
    return "Split{" +
           "left=" + left +
           ", mid=" + mid +
           ", right=" + right +
           '}';
  }
}
