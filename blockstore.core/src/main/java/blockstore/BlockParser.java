package blockstore;

import java.util.List;

/**
 * The document grammar. Implementations must be deterministic and must leave id, prev and next unset,
 * the store owns those.
 */
@FunctionalInterface
public interface BlockParser {

  List<Block> parseBlocks(String text);
}
