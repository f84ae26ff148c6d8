package blockstore;

import org.jetbrains.annotations.Nullable;

public interface BlockAccess {

  /**
   * @return the current block for the id, null for a null or unknown id
   */
  @Nullable
  Block getBlock(@Nullable String id);
}
