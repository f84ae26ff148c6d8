package blockstore;

import io.lacuna.bifurcan.IMap;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Payload of a committed {@link Transaction}, handed to {@link StoreListener#changed}.
 * All maps are keyed by block id.
 */
public final class Change {
  public final IMap<String, Block> adds;
  public final IMap<String, Block> updates;
  // removed block ids to the block as it was
  public final IMap<String, Block> removes;
  // previous version of every updated or removed block
  public final IMap<String, Block> old;
  public final IMap<String, Block> sets;
  @Nullable
  public final String oldFirst;
  @Nullable
  public final String first;
  public final List<Block> oldBlocks;
  public final List<Block> newBlocks;

  public Change(IMap<String, Block> adds,
                IMap<String, Block> updates,
                IMap<String, Block> removes,
                IMap<String, Block> old,
                IMap<String, Block> sets,
                @Nullable String oldFirst,
                @Nullable String first,
                List<Block> oldBlocks,
                List<Block> newBlocks) {
    this.adds = adds;
    this.updates = updates;
    this.removes = removes;
    this.old = old;
    this.sets = sets;
    this.oldFirst = oldFirst;
    this.first = first;
    this.oldBlocks = oldBlocks;
    this.newBlocks = newBlocks;
  }

  public boolean isEmpty() {
    return adds.size() == 0 && updates.size() == 0 && removes.size() == 0;
  }

  @Override
  public String toString() {
    return "Change{" +
           "adds=" + adds.keys() +
           ", updates=" + updates.keys() +
           ", removes=" + removes.keys() +
           ", oldFirst=" + oldFirst +
           ", first=" + first +
           '}';
  }
}
