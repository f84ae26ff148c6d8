package blockstore;

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Pending change to the store: blocks to write (new, updated, or relinked neighbours) and blocks to drop.
 * Built by {@link BlockStore#changesFor} and applied once by {@link BlockStore#change}.
 */
public final class Transaction {
  @Nullable
  public final String first;
  public final LinkedHashMap<String, Block> sets;
  public final LinkedHashMap<String, Block> removes;
  public final List<Block> oldBlocks;
  public final List<Block> newBlocks;

  public Transaction(@Nullable String first,
                     LinkedHashMap<String, Block> sets,
                     LinkedHashMap<String, Block> removes,
                     List<Block> oldBlocks,
                     List<Block> newBlocks) {
    this.first = first;
    this.sets = sets;
    this.removes = removes;
    this.oldBlocks = oldBlocks;
    this.newBlocks = newBlocks;
  }

  public boolean isEmpty() {
    return sets.isEmpty() && removes.isEmpty();
  }

  @Override
  public String toString() {
    return "Transaction{" +
           "first=" + first +
           ", sets=" + sets.keySet() +
           ", removes=" + removes.keySet() +
           '}';
  }
}
