package blockstore;

import blockstore.index.BlockIndex;
import blockstore.index.IndexEntry;
import blockstore.index.MarkIndex;
import blockstore.index.MarkLocation;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Block storage of a document.
 * <p>
 * Holds the block table, the first block id, a {@link BlockIndex} for offset lookups and a {@link MarkIndex}
 * of named positions. The only way to edit the text is {@link #replaceText}, which re-parses as few blocks as
 * it can, diffs them against the old ones and commits the difference as one transaction.
 * <p>
 * Listeners get {@code loaded} after {@link #load} and {@code changed} after every committed change,
 * once the outermost {@link #makeChanges} scope has finished.
 * <p>
 * Not thread safe: a store has a single writer.
 */
public class BlockStore implements BlockAccess {

  private static final Logger LOG = LogManager.getLogger(BlockStore.class);

  protected final BlockParser parser;
  protected final StoreOptions options;

  private final ArrayList<StoreListener> listeners = new ArrayList<>();
  private final ArrayList<Consumer<StoreListener>> pending = new ArrayList<>();
  private boolean suppressingTriggers = false;

  private HashMap<String, Block> blocks = new HashMap<>();
  private BlockIndex blockIndex = BlockIndex.EMPTY;
  private MarkIndex marks = MarkIndex.EMPTY;
  @Nullable
  private String first;
  @Nullable
  private String name;
  private int changeCount = 0;
  private long idCounter = 0;

  public BlockStore(BlockParser parser) {
    this(parser, StoreOptions.load());
  }

  public BlockStore(BlockParser parser, StoreOptions options) {
    this.parser = parser;
    this.options = options;
  }

  public BlockParser getParser() {
    return parser;
  }

  public StoreOptions getOptions() {
    return options;
  }

  // listeners

  public BlockStore on(StoreListener listener) {
    listeners.add(listener);
    return this;
  }

  public BlockStore off(StoreListener listener) {
    listeners.remove(listener);
    return this;
  }

  /**
   * Runs {@code func} without notifying listeners of anything it triggers.
   */
  public <R> R suppressTriggers(Supplier<R> func) {
    boolean oldSuppress = suppressingTriggers;
    suppressingTriggers = true;
    try {
      return func.get();
    }
    finally {
      suppressingTriggers = oldSuppress;
    }
  }

  protected void trigger(Consumer<StoreListener> event) {
    if (suppressingTriggers) {
      return;
    }
    if (changeCount > 0) {
      pending.add(event);
    }
    else {
      fire(event);
    }
  }

  private void fire(Consumer<StoreListener> event) {
    for (StoreListener listener : new ArrayList<>(listeners)) {
      event.accept(listener);
    }
  }

  // transactions

  /**
   * Runs {@code func} as part of a change. Scopes nest, events triggered inside are delivered when
   * the outermost scope completes normally and dropped when it fails.
   */
  public <R> R makeChanges(Supplier<R> func) {
    changeCount++;
    boolean completed = false;
    try {
      R result = func.get();
      completed = true;
      return result;
    }
    finally {
      changeCount--;
      if (changeCount == 0) {
        ArrayList<Consumer<StoreListener>> events = new ArrayList<>(pending);
        pending.clear();
        if (completed) {
          events.forEach(this::fire);
        }
      }
    }
  }

  public boolean isChanging() {
    return changeCount > 0;
  }

  protected void checkChanges() {
    if (changeCount == 0) {
      throw new TransactionException("Attempt to make a change outside of makeChanges");
    }
  }

  // loading

  /**
   * Replaces the whole document with the blocks parsed from {@code text}. Marks are cleared.
   */
  public void load(String name, String text) {
    List<Block> parsed = parser.parseBlocks(text);
    ArrayList<Block> linked = new ArrayList<>(parsed.size());
    for (Block block : parsed) {
      linked.add(block.withId(newId()));
    }
    for (int i = 0; i < linked.size(); i++) {
      linked.set(i, linked.get(i).withLinks(i > 0 ? linked.get(i - 1).id : null,
                                            i + 1 < linked.size() ? linked.get(i + 1).id : null));
    }
    loadBlocks(name, linked.isEmpty() ? null : linked.get(0).id, linked);
  }

  /**
   * Replaces the whole document with blocks that already carry ids and links. Marks are cleared.
   *
   * @throws InvariantViolationException when the links don't form a chain starting at {@code first}
   */
  public void loadBlocks(String name, @Nullable String first, Collection<Block> blocks) {
    makeChanges(() -> {
      HashMap<String, Block> table = new HashMap<>();
      for (Block block : blocks) {
        table.put(block.id, block);
      }
      this.name = name;
      setFirst(first);
      setBlocks(table);
      marks = MarkIndex.EMPTY;
      indexBlocks();
      linkAllSiblings(null);
      verify();
      trigger(l -> l.loaded(this));
      return null;
    });
    LOG.debug("Loaded {}: {} blocks, {} characters", name, blocks.size(), getLength());
  }

  public String newId() {
    return options.idPrefix + idCounter++;
  }

  @Nullable
  public String getName() {
    return name;
  }

  // block table

  @Nullable
  public String getFirst() {
    return first;
  }

  public void setFirst(@Nullable String first) {
    checkChanges();
    this.first = first;
  }

  @Nullable
  @Override
  public Block getBlock(@Nullable String id) {
    return id == null ? null : blocks.get(id);
  }

  public void setBlock(String id, Block block) {
    checkChanges();
    if (!id.equals(block.id)) {
      throw new IllegalArgumentException("Block " + block.id + " stored under " + id);
    }
    blocks.put(id, block);
    indexBlock(block);
  }

  public void deleteBlock(String id) {
    checkChanges();
    blocks.remove(id);
    unindexBlock(id);
  }

  protected void setBlocks(HashMap<String, Block> table) {
    checkChanges();
    this.blocks = table;
  }

  public int blockCount() {
    return blocks.size();
  }

  /**
   * Visits blocks in document order until {@code func} returns false.
   */
  public void eachBlock(Predicate<? super Block> func) {
    Block block = getBlock(getFirst());
    // at most one visit per stored block, even on a cyclic chain
    int remaining = blocks.size();
    while (block != null && remaining-- > 0 && func.test(block)) {
      block = getBlock(block.next);
    }
  }

  public List<Block> blockList() {
    ArrayList<Block> result = new ArrayList<>();
    eachBlock(result::add);
    return result;
  }

  // index

  public BlockIndex getIndex() {
    return blockIndex;
  }

  public void setIndex(BlockIndex index) {
    checkChanges();
    this.blockIndex = index;
  }

  /**
   * Rebuilds the index from scratch.
   */
  public void indexBlocks() {
    checkChanges();
    setIndex(BlockIndex.of(blockList()));
  }

  public void indexBlock(@Nullable Block block) {
    if (block != null) {
      checkChanges();
      setIndex(blockIndex.indexBlock(block, this));
    }
  }

  public void unindexBlock(@Nullable String id) {
    checkChanges();
    setIndex(blockIndex.unindexBlock(id));
  }

  public List<IndexEntry> indexArray() {
    return blockIndex.entries();
  }

  public long getLength() {
    return blockIndex.length();
  }

  public long getDocLength() {
    return getLength();
  }

  public long offsetForBlock(String id) {
    return getBlock(id) == null ? 0 : blockIndex.offsetForBlock(id);
  }

  @Nullable
  public String blockForOffset(long offset) {
    return blockIndex.blockForOffset(offset);
  }

  public long docOffsetForBlockOffset(BlockOffset blockOffset) {
    return docOffsetForBlockOffset(blockOffset.block, blockOffset.offset);
  }

  public long docOffsetForBlockOffset(String block, long offset) {
    return offsetForBlock(block) + offset;
  }

  /**
   * @return the block containing {@code offset}, the end of the last block for the document end,
   * null for an empty document
   */
  @Nullable
  public BlockOffset blockOffsetForDocOffset(long offset) {
    return blockIndex.blockOffsetForDocOffset(offset);
  }

  /**
   * @throws IllegalArgumentException unless {@code 0 <= start <= end <= getLength()}
   */
  protected void checkRange(long start, long end) {
    long length = getLength();
    if (start < 0 || end < start || end > length) {
      throw new IllegalArgumentException("Bad range [" + start + ", " + end + ") in a document of length " + length);
    }
  }

  public String getText() {
    StringBuilder sb = new StringBuilder();
    eachBlock(block -> {
      sb.append(block.text);
      return true;
    });
    return sb.toString();
  }

  public String getDocSubstring(long start, long end) {
    checkRange(start, end);
    BlockOffset startOffset = blockOffsetForDocOffset(start);
    BlockOffset endOffset = blockOffsetForDocOffset(end);
    if (startOffset == null || endOffset == null || start >= end) {
      return "";
    }
    Block block = getBlock(startOffset.block);
    if (startOffset.block.equals(endOffset.block)) {
      return block.text.substring((int)startOffset.offset, (int)endOffset.offset);
    }
    StringBuilder sb = new StringBuilder(block.text.substring((int)startOffset.offset));
    block = getBlock(block.next);
    while (block != null && !block.id.equals(endOffset.block)) {
      sb.append(block.text);
      block = getBlock(block.next);
    }
    if (block != null) {
      sb.append(block.text, 0, (int)endOffset.offset);
    }
    return sb.toString();
  }

  // marks

  public MarkIndex getMarks() {
    return marks;
  }

  public void clearMarks() {
    marks = MarkIndex.EMPTY;
  }

  public void addMark(String name, long offset) {
    checkRange(offset, offset);
    marks = marks.addMark(name, offset);
  }

  public void removeMark(String name) {
    marks = marks.removeMark(name);
  }

  @Nullable
  public Long getMarkLocation(String name) {
    return marks.getMarkLocation(name);
  }

  public List<MarkLocation> listMarks() {
    return marks.listMarks();
  }

  @Nullable
  public BlockOffset blockOffsetForMark(String name) {
    Long offset = getMarkLocation(name);
    return offset == null ? null : blockOffsetForDocOffset(offset);
  }

  public void floatMarks(long start, long end, long newLength) {
    marks = marks.floatMarks(start, end, newLength);
  }

  // editing

  /**
   * Replaces the text in {@code [start, end)} with {@code text}.
   *
   * @return the committed change, or null when the edit leaves every block as it was (no event is sent then)
   */
  @Nullable
  public Change replaceText(long start, long end, String text) {
    checkRange(start, end);
    Structure structure = changesForReplacement(start, end, text);
    if (structure == null) {
      LOG.debug("Replacing [{}, {}) changes no blocks", start, end);
      return null;
    }
    Transaction transaction = changesFor(structure.prev, structure.oldBlocks, structure.newBlocks);
    if (transaction.isEmpty()) {
      return null;
    }
    LOG.debug("Replacing [{}, {}) with {} characters: {}", start, end, text.length(), transaction);
    return makeChanges(() -> {
      Change change = change(transaction);
      floatMarks(start, end, text.length());
      return change;
    });
  }

  /**
   * @return the re-parsed region for the replacement, null when nothing changes
   */
  @Nullable
  public Structure changesForReplacement(long start, long end, String text) {
    Overlap overlap = blockOverlapsForReplacement(start, end, text);
    Structure structure = computeNewStructure(overlap.blocks, overlap.newText);
    return structure.isEmpty() ? null : structure;
  }

  public Structure computeNewStructure(List<Block> oldBlocks, String newText) {
    return Structure.compute(this, parser, oldBlocks, newText);
  }

  public Overlap blockOverlapsForReplacement(long start, long end, String text) {
    Block startBlock = getBlock(blockForOffset(start));
    if (startBlock == null) {
      return new Overlap(new ArrayList<>(), "", text);
    }
    Block endBlock = getBlock(blockForOffset(end));
    ArrayList<Block> run = new ArrayList<>();
    run.add(startBlock);
    Block cur = startBlock;
    while (endBlock != null && !cur.id.equals(endBlock.id) && cur.next != null) {
      cur = getBlock(cur.next);
      if (cur == null) {
        throw new InvariantViolationException("Next of " + run.get(run.size() - 1).id + " doesn't exist");
      }
      run.add(cur);
    }
    StringBuilder sb = new StringBuilder();
    for (Block block : run) {
      sb.append(block.text);
    }
    String fullText = sb.toString();
    long offset = offsetForBlock(startBlock.id);
    String newText = fullText.substring(0, (int)(start - offset)) + text + fullText.substring((int)(end - offset));
    return new Overlap(run, fullText, newText);
  }

  /**
   * Assigns ids and links to {@code newBlocks}, which replace {@code oldBlocks} in the list.
   * Old ids are handed to new blocks position by position, surplus old blocks are removed and surplus
   * new blocks get fresh ids. The neighbours around the run are relinked when needed.
   *
   * @param prev block in front of the run, only consulted when {@code oldBlocks} is empty
   */
  public Transaction changesFor(@Nullable String prev, List<Block> oldBlocks, List<Block> newBlocks) {
    LinkedHashMap<String, Block> sets = new LinkedHashMap<>();
    LinkedHashMap<String, Block> removes = new LinkedHashMap<>();
    String before = oldBlocks.isEmpty() ? prev : oldBlocks.get(0).prev;
    String after;
    if (!oldBlocks.isEmpty()) {
      after = oldBlocks.get(oldBlocks.size() - 1).next;
    }
    else if (before != null) {
      Block b = getBlock(before);
      after = b == null ? null : b.next;
    }
    else {
      after = getFirst();
    }

    for (int i = newBlocks.size(); i < oldBlocks.size(); i++) {
      Block old = oldBlocks.get(i);
      removes.put(old.id, old);
    }
    ArrayList<Block> linked = new ArrayList<>(newBlocks.size());
    for (int i = 0; i < newBlocks.size(); i++) {
      linked.add(newBlocks.get(i).withId(i < oldBlocks.size() ? oldBlocks.get(i).id : newId()));
    }
    String p = before;
    for (int i = 0; i < linked.size(); i++) {
      String n = i + 1 < linked.size() ? linked.get(i + 1).id : after;
      Block block = linked.get(i).withLinks(p, n);
      linked.set(i, block);
      sets.put(block.id, block);
      p = block.id;
    }

    String runFirst = linked.isEmpty() ? after : linked.get(0).id;
    String runLast = linked.isEmpty() ? before : linked.get(linked.size() - 1).id;
    Block beforeBlock = getBlock(before);
    if (beforeBlock != null && !Objects.equals(beforeBlock.next, runFirst)) {
      sets.put(beforeBlock.id, beforeBlock.withNext(runFirst));
    }
    Block afterBlock = getBlock(after);
    if (afterBlock != null && !Objects.equals(afterBlock.prev, runLast)) {
      sets.put(afterBlock.id, afterBlock.withPrev(runLast));
    }
    String newFirst = before == null ? runFirst : getFirst();
    removeDuplicateChanges(sets);
    return new Transaction(newFirst, sets, removes, oldBlocks, linked);
  }

  private void removeDuplicateChanges(LinkedHashMap<String, Block> sets) {
    sets.entrySet().removeIf(e -> {
      Block old = getBlock(e.getKey());
      return old != null && old.sameContent(e.getValue());
    });
  }

  /**
   * Commits the transaction and notifies listeners.
   */
  public Change change(Transaction transaction) {
    Change change = makeChange(transaction);
    trigger(l -> l.changed(change));
    return change;
  }

  public Change makeChange(Transaction transaction) {
    return makeChanges(() -> {
      String oldFirst = getFirst();
      IMap<String, Block> adds = new Map<>();
      IMap<String, Block> updates = new Map<>();
      IMap<String, Block> removes = new Map<>();
      IMap<String, Block> old = new Map<>();
      IMap<String, Block> sets = new Map<>();

      setFirst(transaction.first);
      for (String id : transaction.removes.keySet()) {
        Block block = getBlock(id);
        if (block != null) {
          old = old.put(id, block);
          removes = removes.put(id, block);
          deleteBlock(id);
        }
      }
      for (Block block : transaction.sets.values()) {
        Block current = getBlock(block.id);
        if (current != null) {
          old = old.put(block.id, current);
          updates = updates.put(block.id, block);
        }
        else {
          adds = adds.put(block.id, block);
        }
        sets = sets.put(block.id, block);
        setBlock(block.id, block);
      }
      Change change = new Change(adds, updates, removes, old, sets, oldFirst, transaction.first,
                                 List.copyOf(transaction.oldBlocks), List.copyOf(transaction.newBlocks));
      linkAllSiblings(change);
      verify();
      return change;
    });
  }

  /**
   * Hook for grammars with sibling or parent structure, called inside the transaction after the block table
   * was updated. {@code change} is null after a load.
   */
  protected void linkAllSiblings(@Nullable Change change) {
  }

  // verification

  private void verify() {
    if (options.verifyChanges) {
      check();
    }
    if (options.verifyIndex) {
      BlockErrors errors = verifyIndex();
      if (!errors.isEmpty()) {
        throw new InvariantViolationException("Block index out of sync: " + errors);
      }
    }
  }

  /**
   * Checks that next and prev links form one acyclic chain through every stored block and that the index
   * covers the document length.
   *
   * @throws InvariantViolationException when they don't
   */
  public void check() {
    HashSet<String> seen = new HashSet<>();
    String next = getFirst();
    String last = null;
    long length = 0;
    while (next != null) {
      if (!seen.add(next)) {
        throw new InvariantViolationException("cycle in next links at " + next);
      }
      Block block = getBlock(next);
      if (block == null) {
        throw new InvariantViolationException(last == null
                                              ? "First block " + next + " doesn't exist"
                                              : "Next of " + last + " doesn't exist");
      }
      length += block.length();
      last = next;
      next = block.next;
    }
    if (seen.size() != blocks.size()) {
      for (String id : blocks.keySet()) {
        if (!seen.contains(id)) {
          throw new InvariantViolationException(id + " not in next chain");
        }
      }
    }
    seen.clear();
    String prev = last;
    String later = null;
    while (prev != null) {
      if (!seen.add(prev)) {
        throw new InvariantViolationException("cycle in prev links at " + prev);
      }
      Block block = getBlock(prev);
      if (block == null) {
        throw new InvariantViolationException("Prev of " + later + " doesn't exist");
      }
      later = prev;
      prev = block.prev;
    }
    if (seen.size() != blocks.size()) {
      for (String id : blocks.keySet()) {
        if (!seen.contains(id)) {
          throw new InvariantViolationException(id + " not in prev chain");
        }
      }
    }
    if (length != getLength()) {
      throw new InvariantViolationException("Blocks hold " + length + " characters but the index has " + getLength());
    }
  }

  /**
   * Compares the index with the block list, reporting instead of throwing.
   */
  public BlockErrors verifyIndex() {
    BlockErrors errors = new BlockErrors();
    List<IndexEntry> entries = indexArray();
    List<Block> list = blockList();
    for (int i = 0; i < Math.max(entries.size(), list.size()); i++) {
      String indexed = i < entries.size() ? entries.get(i).id : null;
      String listed = i < list.size() ? list.get(i).id : null;
      if (!Objects.equals(indexed, listed)) {
        errors.badId(listed != null ? listed : indexed, "index has " + indexed + " at position " + i);
        break;
      }
    }
    for (IndexEntry entry : entries) {
      Block block = getBlock(entry.id);
      if (block == null || block.length() != entry.length) {
        errors.badId(entry.id, "bad index length");
      }
    }
    long offset = 0;
    for (Block block : list) {
      if (!blockIndex.nodeOrder(block.prev, block.id)) {
        errors.badId(block.id, "bad order");
      }
      if (offset != offsetForBlock(block.id)) {
        errors.badId(block.id, "offset");
      }
      if (block.length() > 0) {
        Block prev = getBlock(block.prev);
        if (prev != null && prev.length() > 0 && !prev.id.equals(blockForOffset(offset - 1))) {
          errors.badId(block.id, "prev");
        }
        Block next = getBlock(block.next);
        if (next != null && next.length() > 0 && !next.id.equals(blockForOffset(offset + block.length()))) {
          errors.badId(block.id, "next");
        }
      }
      offset += block.length();
    }
    return errors;
  }

  /**
   * Sends the result of {@link #verifyIndex()} to listeners.
   */
  public BlockErrors diag() {
    BlockErrors errors = verifyIndex();
    trigger(l -> l.diagnosed(errors));
    return errors;
  }

  /**
   * Blocks touched by a replacement, their text, and that text with the replacement applied.
   */
  public static final class Overlap {
    public final List<Block> blocks;
    public final String blockText;
    public final String newText;

    public Overlap(List<Block> blocks, String blockText, String newText) {
      this.blocks = blocks;
      this.blockText = blockText;
      this.newText = newText;
    }
  }
}
