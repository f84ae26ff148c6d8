package blockstore.outline;

import blockstore.Block;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.Map;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;

/**
 * Tree structure of an outline, derived from block order and headline levels.
 * <p>
 * A headline is a child of the closest preceding headline with a smaller level. A chunk is a child of the
 * closest preceding headline. Blocks without such a headline are top level, they have a null parent.
 */
public final class Links {

  public static final Links EMPTY = new Links(new Map<>(), null, null);

  private final IMap<String, Link> links;
  @Nullable
  public final String firstTopLevel;
  @Nullable
  public final String lastTopLevel;

  private Links(IMap<String, Link> links, @Nullable String firstTopLevel, @Nullable String lastTopLevel) {
    this.links = links;
    this.firstTopLevel = firstTopLevel;
    this.lastTopLevel = lastTopLevel;
  }

  public static final class Link {
    @Nullable
    public final String parent;
    @Nullable
    public final String firstChild;
    @Nullable
    public final String lastChild;
    @Nullable
    public final String previousSibling;
    @Nullable
    public final String nextSibling;

    public Link(@Nullable String parent,
                @Nullable String firstChild,
                @Nullable String lastChild,
                @Nullable String previousSibling,
                @Nullable String nextSibling) {
      this.parent = parent;
      this.firstChild = firstChild;
      this.lastChild = lastChild;
      this.previousSibling = previousSibling;
      this.nextSibling = nextSibling;
    }

    @Override
    public String toString() {
      return "Link{" +
             "parent=" + parent +
             ", firstChild=" + firstChild +
             ", lastChild=" + lastChild +
             ", previousSibling=" + previousSibling +
             ", nextSibling=" + nextSibling +
             '}';
    }
  }

  private static final class Builder {
    final String parent;
    String firstChild;
    String lastChild;
    String previousSibling;
    String nextSibling;

    Builder(String parent) {
      this.parent = parent;
    }
  }

  /**
   * @param blocks the whole document in order
   */
  public static Links compute(List<Block> blocks) {
    HashMap<String, Builder> builders = new HashMap<>();
    ArrayDeque<Block> open = new ArrayDeque<>();
    String firstTopLevel = null;
    String lastTopLevel = null;
    for (Block block : blocks) {
      int level = OutlineParser.level(block);
      if (level > 0) {
        while (!open.isEmpty() && OutlineParser.level(open.peek()) >= level) {
          open.pop();
        }
      }
      String parent = open.isEmpty() ? null : open.peek().id;
      Builder b = new Builder(parent);
      builders.put(block.id, b);

      String previous;
      if (parent == null) {
        previous = lastTopLevel;
        if (firstTopLevel == null) {
          firstTopLevel = block.id;
        }
        lastTopLevel = block.id;
      }
      else {
        Builder p = builders.get(parent);
        previous = p.lastChild;
        if (p.firstChild == null) {
          p.firstChild = block.id;
        }
        p.lastChild = block.id;
      }
      if (previous != null) {
        b.previousSibling = previous;
        builders.get(previous).nextSibling = block.id;
      }
      if (level > 0) {
        open.push(block);
      }
    }
    IMap<String, Link> links = new Map<String, Link>().linear();
    for (java.util.Map.Entry<String, Builder> e : builders.entrySet()) {
      Builder b = e.getValue();
      links.put(e.getKey(), new Link(b.parent, b.firstChild, b.lastChild, b.previousSibling, b.nextSibling));
    }
    return new Links(links.forked(), firstTopLevel, lastTopLevel);
  }

  @Nullable
  public Link get(@Nullable String id) {
    return id == null ? null : links.get(id, null);
  }

  public long size() {
    return links.size();
  }

  @Override
  public String toString() {
    return "Links" + links;
  }
}
