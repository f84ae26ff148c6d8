package blockstore.outline;

import blockstore.Block;
import blockstore.BlockStore;
import blockstore.Change;
import blockstore.StoreOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Block store for outlines. Keeps parent and sibling links of headlines and chunks in step with the
 * block list, recomputing them whenever the store loads or commits a change.
 */
public class OutlineStore extends BlockStore {

  private static final Logger LOG = LogManager.getLogger(OutlineStore.class);

  private Links links = Links.EMPTY;

  public OutlineStore() {
    this(StoreOptions.load());
  }

  public OutlineStore(StoreOptions options) {
    super(OutlineParser.INSTANCE, options);
  }

  @Override
  protected void linkAllSiblings(@Nullable Change change) {
    checkChanges();
    links = Links.compute(blockList());
    LOG.trace("Relinked {} outline blocks", links.size());
  }

  public Links getLinks() {
    return links;
  }

  @Nullable
  private Block follow(@Nullable Block block, Function<Links.Link, String> step) {
    Links.Link link = block == null ? null : links.get(block.id);
    return link == null ? null : getBlock(step.apply(link));
  }

  @Nullable
  public Block parent(@Nullable Block block) {
    return follow(block, l -> l.parent);
  }

  @Nullable
  public Block firstChild(@Nullable Block block) {
    return follow(block, l -> l.firstChild);
  }

  @Nullable
  public Block lastChild(@Nullable Block block) {
    return follow(block, l -> l.lastChild);
  }

  @Nullable
  public Block nextSibling(@Nullable Block block) {
    return follow(block, l -> l.nextSibling);
  }

  @Nullable
  public Block previousSibling(@Nullable Block block) {
    return follow(block, l -> l.previousSibling);
  }

  /**
   * @param block the parent, null for the top level blocks
   */
  public List<Block> children(@Nullable Block block) {
    ArrayList<Block> result = new ArrayList<>();
    Block child = block == null ? getBlock(links.firstTopLevel) : firstChild(block);
    while (child != null) {
      result.add(child);
      child = nextSibling(child);
    }
    return result;
  }
}
