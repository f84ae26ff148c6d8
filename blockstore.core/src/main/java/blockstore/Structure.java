package blockstore;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * The part of the block list an edit really changes: the old blocks to drop and the freshly parsed blocks
 * replacing them, with identical leading and trailing blocks already trimmed away.
 */
public final class Structure {

  private static final Logger LOG = LogManager.getLogger(Structure.class);

  public final List<Block> oldBlocks;
  public final List<Block> newBlocks;
  // characters of re-parsed context left in front of the changed region
  public final long offset;
  // block preceding the changed region, null at the document start
  @Nullable
  public final String prev;

  public Structure(List<Block> oldBlocks, List<Block> newBlocks, long offset, @Nullable String prev) {
    this.oldBlocks = oldBlocks;
    this.newBlocks = newBlocks;
    this.offset = offset;
    this.prev = prev;
  }

  public boolean isEmpty() {
    return oldBlocks.isEmpty() && newBlocks.isEmpty();
  }

  /**
   * Re-parses {@code newText}, the replacement for the text of {@code oldBlocks}, growing the window by one
   * neighbour on each side until the parse leaves both outer neighbours as they were.
   */
  public static Structure compute(BlockAccess access, BlockParser parser, List<Block> oldBlocks, String newText) {
    ArrayList<Block> old = new ArrayList<>(oldBlocks);
    String text = newText;
    String oldText = null;
    long offset = 0;
    List<Block> parsed = null;
    int widenings = 0;

    if (!old.isEmpty()) {
      while (!text.equals(oldText) && (first(old).prev != null || last(old).next != null)) {
        Block prevBlock = access.getBlock(first(old).prev);
        oldText = text;
        if (prevBlock != null) {
          old.add(0, prevBlock);
          text = prevBlock.text + text;
          offset += prevBlock.text.length();
        }
        Block nextBlock = access.getBlock(last(old).next);
        if (nextBlock != null) {
          old.add(nextBlock);
          text = text + nextBlock.text;
        }
        widenings++;
        parsed = parser.parseBlocks(text);
        if ((prevBlock == null || !parsed.isEmpty() && prevBlock.text.equals(first(parsed).text)) &&
            (nextBlock == null || !parsed.isEmpty() && nextBlock.text.equals(last(parsed).text))) {
          break;
        }
      }
    }
    if (parsed == null) {
      parsed = parser.parseBlocks(text);
    }
    LOG.debug("Re-parsed {} blocks after {} widenings", old.size(), widenings);

    String prev = old.isEmpty() ? null : first(old).prev;
    int head = 0;
    while (head < old.size() && head < parsed.size() && old.get(head).text.equals(parsed.get(head).text)) {
      offset -= old.get(head).text.length();
      prev = old.get(head).id;
      head++;
    }
    int oldTail = old.size();
    int newTail = parsed.size();
    while (oldTail > head && newTail > head && old.get(oldTail - 1).text.equals(parsed.get(newTail - 1).text)) {
      oldTail--;
      newTail--;
    }
    return new Structure(new ArrayList<>(old.subList(head, oldTail)),
                         new ArrayList<>(parsed.subList(head, newTail)),
                         offset,
                         prev);
  }

  static <T> T first(List<T> list) {
    return list.get(0);
  }

  static <T> T last(List<T> list) {
    return list.get(list.size() - 1);
  }

  @Override
  public String toString() {
    return "Structure{" +
           "oldBlocks=" + oldBlocks +
           ", newBlocks=" + newBlocks +
           ", offset=" + offset +
           ", prev=" + prev +
           '}';
  }
}
