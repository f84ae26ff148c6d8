package blockstore.fingertree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Persistent 2-3 finger tree annotated with a monoid {@link Measurer}.
 * <p>
 * Every operation returns a new tree and leaves the receiver untouched. Once safely published a tree may be
 * read from several threads at once: a delayed middle spine is forced under a lock, and a deep tree's memoized
 * measure may be computed twice under a race, which is harmless as long as the {@link Measurer} returns
 * immutable values with final fields.
 * The tree is one of {@code Empty}, {@code Single}, {@code Deep} or a {@code Delayed} cell wrapping
 * a middle spine that has not been computed yet. Null elements are not supported.
 */
@SuppressWarnings({"WeakerAccess", "unchecked"})
public abstract class FingerTree<M, T> implements Iterable<T> {

  final Measurer<M, T> measurer;

  private FingerTree(Measurer<M, T> measurer) {
    this.measurer = measurer;
  }

  public static <M, T> FingerTree<M, T> empty(Measurer<M, T> measurer) {
    return new Empty<>(measurer);
  }

  public static <M, T> FingerTree<M, T> single(Measurer<M, T> measurer, T value) {
    return new Single<>(measurer, value);
  }

  public static <M, T> FingerTree<M, T> fromList(List<? extends T> items, Measurer<M, T> measurer) {
    FingerTree<M, T> tree = empty(measurer);
    for (int i = items.size() - 1; i >= 0; i--) {
      tree = tree.addFirst(items.get(i));
    }
    return tree;
  }

  public Measurer<M, T> measurer() {
    return measurer;
  }

  public abstract M measure();

  public abstract boolean isEmpty();

  public abstract FingerTree<M, T> addFirst(T value);

  public abstract FingerTree<M, T> addLast(T value);

  /**
   * @return the tree without its first element, an empty tree stays empty
   */
  public abstract FingerTree<M, T> removeFirst();

  public abstract FingerTree<M, T> removeLast();

  @Nullable
  public abstract T peekFirst();

  @Nullable
  public abstract T peekLast();

  public abstract FingerTree<M, T> concat(FingerTree<M, T> other);

  /*
   * precondition: the tree is not empty and predicate holds for sum(initial, measure())
   */
  abstract Split<M, T> splitTree(Predicate<? super M> predicate, M initial);

  FingerTree<M, T> force() {
    return this;
  }

  public Split<M, T> split(Predicate<? super M> predicate) {
    return split(predicate, measurer.identity());
  }

  /**
   * Splits at the first element whose running measure (starting from {@code initial}) satisfies the predicate.
   * The predicate has to be monotonic over the running measure: false for a prefix of the tree, true afterwards.
   * For a predicate that is not, the split point is unspecified.
   */
  public Split<M, T> split(Predicate<? super M> predicate, M initial) {
    FingerTree<M, T> tree = force();
    if (tree.isEmpty() || !predicate.test(measurer.sum(initial, tree.measure()))) {
      return new Split<>(tree, null, empty(measurer));
    }
    return tree.splitTree(predicate, initial);
  }

  public FingerTree<M, T> takeUntil(Predicate<? super M> predicate) {
    return split(predicate).left;
  }

  public FingerTree<M, T> dropUntil(Predicate<? super M> predicate) {
    return split(predicate).rest();
  }

  public void each(Consumer<? super T> consumer) {
    FingerTree<M, T> t = this;
    while (!t.isEmpty()) {
      consumer.accept(t.peekFirst());
      t = t.removeFirst();
    }
  }

  public void eachReverse(Consumer<? super T> consumer) {
    FingerTree<M, T> t = this;
    while (!t.isEmpty()) {
      consumer.accept(t.peekLast());
      t = t.removeLast();
    }
  }

  public List<T> toList() {
    ArrayList<T> list = new ArrayList<>();
    each(list::add);
    return list;
  }

  @NotNull
  @Override
  public Iterator<T> iterator() {
    return new Iterator<T>() {
      FingerTree<M, T> rest = FingerTree.this;

      @Override
      public boolean hasNext() {
        return !rest.isEmpty();
      }

      @Override
      public T next() {
        if (rest.isEmpty()) {
          throw new NoSuchElementException();
        }
        T value = rest.peekFirst();
        rest = rest.removeFirst();
        return value;
      }
    };
  }

  @Override
  public String toString() {
    return "FingerTree" + toList();
  }

  private static final class Empty<M, T> extends FingerTree<M, T> {

    Empty(Measurer<M, T> measurer) {
      super(measurer);
    }

    @Override
    public M measure() {
      return measurer.identity();
    }

    @Override
    public boolean isEmpty() {
      return true;
    }

    @Override
    public FingerTree<M, T> addFirst(T value) {
      return new Single<>(measurer, value);
    }

    @Override
    public FingerTree<M, T> addLast(T value) {
      return new Single<>(measurer, value);
    }

    @Override
    public FingerTree<M, T> removeFirst() {
      return this;
    }

    @Override
    public FingerTree<M, T> removeLast() {
      return this;
    }

    @Override
    public T peekFirst() {
      return null;
    }

    @Override
    public T peekLast() {
      return null;
    }

    @Override
    public FingerTree<M, T> concat(FingerTree<M, T> other) {
      return other;
    }

    @Override
    Split<M, T> splitTree(Predicate<? super M> predicate, M initial) {
      return new Split<>(this, null, this);
    }
  }

  private static final class Single<M, T> extends FingerTree<M, T> {
    final T value;
    final M measure;

    Single(Measurer<M, T> measurer, T value) {
      super(measurer);
      this.value = value;
      this.measure = measurer.measure(value);
    }

    @Override
    public M measure() {
      return measure;
    }

    @Override
    public boolean isEmpty() {
      return false;
    }

    @Override
    public FingerTree<M, T> addFirst(T v) {
      return new Deep<>(measurer,
                        new Digit<>(measurer, v),
                        new Empty<>(nodeMeasurer(measurer)),
                        new Digit<>(measurer, value));
    }

    @Override
    public FingerTree<M, T> addLast(T v) {
      return new Deep<>(measurer,
                        new Digit<>(measurer, value),
                        new Empty<>(nodeMeasurer(measurer)),
                        new Digit<>(measurer, v));
    }

    @Override
    public FingerTree<M, T> removeFirst() {
      return new Empty<>(measurer);
    }

    @Override
    public FingerTree<M, T> removeLast() {
      return new Empty<>(measurer);
    }

    @Override
    public T peekFirst() {
      return value;
    }

    @Override
    public T peekLast() {
      return value;
    }

    @Override
    public FingerTree<M, T> concat(FingerTree<M, T> other) {
      return other.addFirst(value);
    }

    @Override
    Split<M, T> splitTree(Predicate<? super M> predicate, M initial) {
      return new Split<>(new Empty<>(measurer), value, new Empty<>(measurer));
    }
  }

  private static final class Deep<M, T> extends FingerTree<M, T> {
    final Digit<M, T> left;
    final FingerTree<M, Node<M, T>> mid;
    final Digit<M, T> right;
    // computed on demand, forcing the middle spine; racy but idempotent
    private M measure;

    Deep(Measurer<M, T> measurer, Digit<M, T> left, FingerTree<M, Node<M, T>> mid, Digit<M, T> right) {
      super(measurer);
      this.left = left;
      this.mid = mid;
      this.right = right;
    }

    @Override
    public M measure() {
      M m = measure;
      if (m == null) {
        m = measurer.sum(measurer.sum(left.measure, mid.measure()), right.measure);
        measure = m;
      }
      return m;
    }

    @Override
    public boolean isEmpty() {
      return false;
    }

    @Override
    public FingerTree<M, T> addFirst(T v) {
      Object[] items = left.items;
      if (items.length == 4) {
        return new Deep<>(measurer,
                          new Digit<>(measurer, v, items[0]),
                          mid.addFirst(new Node<>(measurer, items[1], items[2], items[3])),
                          right);
      }
      return new Deep<>(measurer, left.prepend(v), mid, right);
    }

    @Override
    public FingerTree<M, T> addLast(T v) {
      Object[] items = right.items;
      if (items.length == 4) {
        return new Deep<>(measurer,
                          left,
                          mid.addLast(new Node<>(measurer, items[0], items[1], items[2])),
                          new Digit<>(measurer, items[3], v));
      }
      return new Deep<>(measurer, left, mid, right.append(v));
    }

    @Override
    public FingerTree<M, T> removeFirst() {
      if (left.size() > 1) {
        return new Deep<>(measurer, left.slice(1, left.size()), mid, right);
      }
      if (!mid.isEmpty()) {
        FingerTree<M, Node<M, T>> m = mid;
        return new Deep<>(measurer, m.peekFirst().toDigit(), new Delayed<>(m.measurer, m::removeFirst), right);
      }
      if (right.size() == 1) {
        return new Single<>(measurer, right.get(0));
      }
      return new Deep<>(measurer, right.slice(0, 1), mid, right.slice(1, right.size()));
    }

    @Override
    public FingerTree<M, T> removeLast() {
      if (right.size() > 1) {
        return new Deep<>(measurer, left, mid, right.slice(0, right.size() - 1));
      }
      if (!mid.isEmpty()) {
        FingerTree<M, Node<M, T>> m = mid;
        return new Deep<>(measurer, left, new Delayed<>(m.measurer, m::removeLast), m.peekLast().toDigit());
      }
      if (left.size() == 1) {
        return new Single<>(measurer, left.get(0));
      }
      return new Deep<>(measurer, left.slice(0, left.size() - 1), mid, left.slice(left.size() - 1, left.size()));
    }

    @Override
    public T peekFirst() {
      return left.get(0);
    }

    @Override
    public T peekLast() {
      return right.get(right.size() - 1);
    }

    @Override
    public FingerTree<M, T> concat(FingerTree<M, T> other) {
      FingerTree<M, T> o = other.force();
      if (o instanceof Empty) {
        return this;
      }
      if (o instanceof Single) {
        return addLast(((Single<M, T>)o).value);
      }
      return app3(this, new Object[0], o);
    }

    @Override
    Split<M, T> splitTree(Predicate<? super M> predicate, M initial) {
      M leftMeasure = measurer.sum(initial, left.measure);
      if (predicate.test(leftMeasure)) {
        DigitSplit<T> split = left.split(predicate, initial);
        return new Split<>(fromArray(measurer, split.left),
                           split.mid,
                           deepLeft(measurer, split.right, mid, right));
      }
      M midMeasure = measurer.sum(leftMeasure, mid.measure());
      if (predicate.test(midMeasure)) {
        Split<M, Node<M, T>> midSplit = mid.force().splitTree(predicate, leftMeasure);
        Node<M, T> node = midSplit.mid;
        DigitSplit<T> split = node.toDigit().split(predicate, measurer.sum(leftMeasure, midSplit.left.measure()));
        return new Split<>(deepRight(measurer, left, midSplit.left, split.left),
                           split.mid,
                           deepLeft(measurer, split.right, midSplit.right, right));
      }
      DigitSplit<T> split = right.split(predicate, midMeasure);
      return new Split<>(deepRight(measurer, left, mid, split.left),
                         split.mid,
                         fromArray(measurer, split.right));
    }
  }

  /**
   * Memoized suspension of a tree. The supplier runs at most once, on the first access, even when
   * several threads force the cell together.
   */
  private static final class Delayed<M, T> extends FingerTree<M, T> {
    // guarded by this
    private Supplier<FingerTree<M, T>> thunk;
    private volatile FingerTree<M, T> tree;

    Delayed(Measurer<M, T> measurer, Supplier<FingerTree<M, T>> thunk) {
      super(measurer);
      this.thunk = thunk;
    }

    @Override
    FingerTree<M, T> force() {
      FingerTree<M, T> t = tree;
      if (t == null) {
        synchronized (this) {
          t = tree;
          if (t == null) {
            t = thunk.get().force();
            tree = t;
            thunk = null;
          }
        }
      }
      return t;
    }

    @Override
    public M measure() {
      return force().measure();
    }

    @Override
    public boolean isEmpty() {
      return force().isEmpty();
    }

    @Override
    public FingerTree<M, T> addFirst(T value) {
      return force().addFirst(value);
    }

    @Override
    public FingerTree<M, T> addLast(T value) {
      return force().addLast(value);
    }

    @Override
    public FingerTree<M, T> removeFirst() {
      return force().removeFirst();
    }

    @Override
    public FingerTree<M, T> removeLast() {
      return force().removeLast();
    }

    @Override
    public T peekFirst() {
      return force().peekFirst();
    }

    @Override
    public T peekLast() {
      return force().peekLast();
    }

    @Override
    public FingerTree<M, T> concat(FingerTree<M, T> other) {
      return force().concat(other);
    }

    @Override
    Split<M, T> splitTree(Predicate<? super M> predicate, M initial) {
      return force().splitTree(predicate, initial);
    }
  }

  static final class Digit<M, T> {
    final Measurer<M, T> measurer;
    final Object[] items;
    final M measure;

    Digit(Measurer<M, T> measurer, Object... items) {
      assert 1 <= items.length && items.length <= 4 : "digit of " + items.length;
      this.measurer = measurer;
      this.items = items;
      M m = measurer.identity();
      for (Object item : items) {
        m = measurer.sum(m, measurer.measure((T)item));
      }
      this.measure = m;
    }

    int size() {
      return items.length;
    }

    T get(int i) {
      return (T)items[i];
    }

    Digit<M, T> prepend(T value) {
      Object[] r = new Object[items.length + 1];
      r[0] = value;
      System.arraycopy(items, 0, r, 1, items.length);
      return new Digit<>(measurer, r);
    }

    Digit<M, T> append(T value) {
      Object[] r = Arrays.copyOf(items, items.length + 1);
      r[items.length] = value;
      return new Digit<>(measurer, r);
    }

    Digit<M, T> slice(int from, int to) {
      return new Digit<>(measurer, Arrays.copyOfRange(items, from, to));
    }

    /*
     * precondition: predicate holds for sum(initial, measure)
     */
    DigitSplit<T> split(Predicate<? super M> predicate, M initial) {
      int i = 0;
      M m = initial;
      for (; i < items.length - 1; i++) {
        m = measurer.sum(m, measurer.measure((T)items[i]));
        if (predicate.test(m)) {
          break;
        }
      }
      return new DigitSplit<>(Arrays.copyOfRange(items, 0, i),
                              (T)items[i],
                              Arrays.copyOfRange(items, i + 1, items.length));
    }
  }

  static final class DigitSplit<T> {
    final Object[] left;
    final T mid;
    final Object[] right;

    DigitSplit(Object[] left, T mid, Object[] right) {
      this.left = left;
      this.mid = mid;
      this.right = right;
    }
  }

  static final class Node<M, T> {
    final Measurer<M, T> measurer;
    final Object[] items;
    final M measure;

    Node(Measurer<M, T> measurer, Object... items) {
      assert items.length == 2 || items.length == 3 : "node of " + items.length;
      this.measurer = measurer;
      this.items = items;
      M m = measurer.identity();
      for (Object item : items) {
        m = measurer.sum(m, measurer.measure((T)item));
      }
      this.measure = m;
    }

    Digit<M, T> toDigit() {
      return new Digit<>(measurer, items);
    }
  }

  private static final class NodeMeasurer<M, T> implements Measurer<M, Node<M, T>> {
    final Measurer<M, T> measurer;

    NodeMeasurer(Measurer<M, T> measurer) {
      this.measurer = measurer;
    }

    @Override
    public M identity() {
      return measurer.identity();
    }

    @Override
    public M measure(Node<M, T> node) {
      return node.measure;
    }

    @Override
    public M sum(M m1, M m2) {
      return measurer.sum(m1, m2);
    }
  }

  static <M, T> Measurer<M, Node<M, T>> nodeMeasurer(Measurer<M, T> measurer) {
    return new NodeMeasurer<>(measurer);
  }

  static <M, T> FingerTree<M, T> fromArray(Measurer<M, T> measurer, Object[] items) {
    FingerTree<M, T> tree = new Empty<>(measurer);
    for (int i = items.length - 1; i >= 0; i--) {
      tree = tree.addFirst((T)items[i]);
    }
    return tree;
  }

  static <M, T> FingerTree<M, T> deepLeft(Measurer<M, T> measurer, Object[] left, FingerTree<M, Node<M, T>> mid, Digit<M, T> right) {
    if (left.length == 0) {
      if (mid.isEmpty()) {
        return fromArray(measurer, right.items);
      }
      return new Delayed<>(measurer, () -> new Deep<>(measurer, mid.peekFirst().toDigit(), mid.removeFirst(), right));
    }
    return new Deep<>(measurer, new Digit<>(measurer, left), mid, right);
  }

  static <M, T> FingerTree<M, T> deepRight(Measurer<M, T> measurer, Digit<M, T> left, FingerTree<M, Node<M, T>> mid, Object[] right) {
    if (right.length == 0) {
      if (mid.isEmpty()) {
        return fromArray(measurer, left.items);
      }
      return new Delayed<>(measurer, () -> new Deep<>(measurer, left, mid.removeLast(), mid.peekLast().toDigit()));
    }
    return new Deep<>(measurer, left, mid, new Digit<>(measurer, right));
  }

  static <M, T> FingerTree<M, T> app3(FingerTree<M, T> tree1, Object[] ts, FingerTree<M, T> tree2) {
    FingerTree<M, T> t1 = tree1.force();
    FingerTree<M, T> t2 = tree2.force();
    if (t1 instanceof Empty) {
      return prepend(t2, ts);
    }
    if (t2 instanceof Empty) {
      return append(t1, ts);
    }
    if (t1 instanceof Single) {
      return prepend(t2, ts).addFirst(((Single<M, T>)t1).value);
    }
    if (t2 instanceof Single) {
      return append(t1, ts).addLast(((Single<M, T>)t2).value);
    }
    Deep<M, T> d1 = (Deep<M, T>)t1;
    Deep<M, T> d2 = (Deep<M, T>)t2;
    return new Deep<>(d1.measurer,
                      d1.left,
                      new Delayed<>(d1.mid.measurer,
                                    () -> app3(d1.mid, nodes(d1.measurer, join(d1.right.items, ts, d2.left.items)), d2.mid)),
                      d2.right);
  }

  private static Object[] join(Object[] a, Object[] b, Object[] c) {
    Object[] r = new Object[a.length + b.length + c.length];
    System.arraycopy(a, 0, r, 0, a.length);
    System.arraycopy(b, 0, r, a.length, b.length);
    System.arraycopy(c, 0, r, a.length + b.length, c.length);
    return r;
  }

  /*
   * regroups 2..12 items into nodes of 2 or 3
   */
  static <M, T> Object[] nodes(Measurer<M, T> measurer, Object[] xs) {
    ArrayList<Object> res = new ArrayList<>(xs.length / 2);
    int i = 0;
    while (xs.length - i > 4) {
      res.add(new Node<>(measurer, xs[i], xs[i + 1], xs[i + 2]));
      i += 3;
    }
    switch (xs.length - i) {
      case 2:
        res.add(new Node<>(measurer, xs[i], xs[i + 1]));
        break;
      case 3:
        res.add(new Node<>(measurer, xs[i], xs[i + 1], xs[i + 2]));
        break;
      case 4:
        res.add(new Node<>(measurer, xs[i], xs[i + 1]));
        res.add(new Node<>(measurer, xs[i + 2], xs[i + 3]));
        break;
      default:
        throw new AssertionError("can't make nodes out of " + xs.length + " items");
    }
    return res.toArray();
  }

  private static <M, T> FingerTree<M, T> prepend(FingerTree<M, T> tree, Object[] xs) {
    for (int i = xs.length - 1; i >= 0; i--) {
      tree = tree.addFirst((T)xs[i]);
    }
    return tree;
  }

  private static <M, T> FingerTree<M, T> append(FingerTree<M, T> tree, Object[] xs) {
    for (Object x : xs) {
      tree = tree.addLast((T)x);
    }
    return tree;
  }
}
