package blockstore;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain text grammar: one block per line, the newline stays with its line.
 */
public class LineParser implements BlockParser {

  public static final LineParser INSTANCE = new LineParser();

  @Override
  public List<Block> parseBlocks(String text) {
    ArrayList<Block> blocks = new ArrayList<>();
    int start = 0;
    while (start < text.length()) {
      int nl = text.indexOf('\n', start);
      int end = nl == -1 ? text.length() : nl + 1;
      blocks.add(Block.of(text.substring(start, end)));
      start = end;
    }
    return blocks;
  }
}
