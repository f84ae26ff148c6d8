package blockstore.fingertree;

/**
 * Monoid used to annotate a {@link FingerTree}.
 * {@code sum} must be associative and {@code identity()} must be its left and right unit.
 */
public interface Measurer<M, T> {

  M identity();

  M measure(T value);

  M sum(M m1, M m2);

  default M sum(Iterable<? extends T> values) {
    M r = identity();
    for (T value : values) {
      r = sum(r, measure(value));
    }
    return r;
  }
}
