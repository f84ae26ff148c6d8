package blockstore;

import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A unit of document text linked to its neighbours.
 * <p>
 * Blocks are immutable: the store changes a block by replacing it with a copy carrying the same id.
 * Parsers create blocks without id and links, the store assigns those.
 * Grammar specific data goes into {@link #properties}.
 */
public final class Block {
  public final String id;
  @NotNull
  public final String text;
  @Nullable
  public final String prev;
  @Nullable
  public final String next;
  @NotNull
  public final IMap<String, Object> properties;

  public Block(String id, @NotNull String text, @Nullable String prev, @Nullable String next, @NotNull IMap<String, Object> properties) {
    this.id = id;
    this.text = text;
    this.prev = prev;
    this.next = next;
    this.properties = properties;
  }

  public static Block of(String text) {
    return new Block(null, text, null, null, new Map<>());
  }

  public static Block of(String text, IMap<String, Object> properties) {
    return new Block(null, text, null, null, properties);
  }

  public long length() {
    return text.length();
  }

  @Nullable
  public Object get(String property) {
    return properties.get(property, null);
  }

  public Block with(String property, Object value) {
    return new Block(id, text, prev, next, properties.put(property, value));
  }

  public Block withId(String id) {
    return new Block(id, text, prev, next, properties);
  }

  public Block withText(String text) {
    return new Block(id, text, prev, next, properties);
  }

  public Block withPrev(@Nullable String prev) {
    return new Block(id, text, prev, next, properties);
  }

  public Block withNext(@Nullable String next) {
    return new Block(id, text, prev, next, properties);
  }

  public Block withLinks(@Nullable String prev, @Nullable String next) {
    return new Block(id, text, prev, next, properties);
  }

  /**
   * same text and same links, properties aside
   */
  public boolean sameContent(Block other) {
    return text.equals(other.text) &&
           Objects.equals(prev, other.prev) &&
           Objects.equals(next, other.next);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Block block = (Block)o;
    return Objects.equals(id, block.id) &&
           text.equals(block.text) &&
           Objects.equals(prev, block.prev) &&
           Objects.equals(next, block.next) &&
           properties.equals(block.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, text, prev, next);
  }

  @Override
  public String toString() {
    return "Block{" +
           "id=" + id +
           ", text=\"" + text + '"' +
           ", prev=" + prev +
           ", next=" + next +
           (properties.size() == 0 ? "" : ", properties=" + properties) +
           '}';
  }
}
