package blockstore.outline;

import blockstore.Block;
import blockstore.BlockParser;
import io.lacuna.bifurcan.Map;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Outline grammar: a line starting with one or more {@code *} and a space is a headline block,
 * every run of other lines between headlines is a single chunk block. Newlines stay with their lines.
 */
public class OutlineParser implements BlockParser {

  public static final OutlineParser INSTANCE = new OutlineParser();

  public static final String TYPE = "type";
  public static final String LEVEL = "level";
  public static final String HEADLINE = "headline";
  public static final String CHUNK = "chunk";

  @Override
  public List<Block> parseBlocks(String text) {
    ArrayList<Block> blocks = new ArrayList<>();
    int chunkStart = -1;
    int start = 0;
    while (start < text.length()) {
      int nl = text.indexOf('\n', start);
      int end = nl == -1 ? text.length() : nl + 1;
      int level = headlineLevel(text, start, end);
      if (level > 0) {
        if (chunkStart >= 0) {
          blocks.add(chunk(text.substring(chunkStart, start)));
          chunkStart = -1;
        }
        blocks.add(Block.of(text.substring(start, end), new Map<String, Object>()
          .put(TYPE, HEADLINE)
          .put(LEVEL, level)));
      }
      else if (chunkStart < 0) {
        chunkStart = start;
      }
      start = end;
    }
    if (chunkStart >= 0) {
      blocks.add(chunk(text.substring(chunkStart)));
    }
    return blocks;
  }

  private static Block chunk(String text) {
    return Block.of(text, new Map<String, Object>().put(TYPE, CHUNK));
  }

  private static int headlineLevel(String text, int start, int end) {
    int i = start;
    while (i < end && text.charAt(i) == '*') {
      i++;
    }
    return i > start && i < end && text.charAt(i) == ' ' ? i - start : 0;
  }

  public static boolean isHeadline(@Nullable Block block) {
    return block != null && HEADLINE.equals(block.get(TYPE));
  }

  /**
   * @return the number of stars of a headline, 0 for anything else
   */
  public static int level(@Nullable Block block) {
    return isHeadline(block) ? (Integer)block.get(LEVEL) : 0;
  }
}
