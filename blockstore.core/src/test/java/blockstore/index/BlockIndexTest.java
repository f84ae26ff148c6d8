package blockstore.index;

import blockstore.Block;
import blockstore.BlockOffset;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockIndexTest {

  static List<Block> chain(String... texts) {
    ArrayList<Block> blocks = new ArrayList<>();
    for (int i = 0; i < texts.length; i++) {
      blocks.add(Block.of(texts[i]).withId("b" + i));
    }
    for (int i = 0; i < blocks.size(); i++) {
      blocks.set(i, blocks.get(i).withLinks(i > 0 ? "b" + (i - 1) : null, i + 1 < blocks.size() ? "b" + (i + 1) : null));
    }
    return blocks;
  }

  static List<String> ids(BlockIndex index) {
    ArrayList<String> ids = new ArrayList<>();
    for (IndexEntry entry : index.entries()) {
      ids.add(entry.id);
    }
    return ids;
  }

  @Test
  void offsetsOfBlocks() {
    BlockIndex index = BlockIndex.of(chain("abc\n", "de\n", "", "fghi"));
    assertEquals(11, index.length());
    assertEquals(4, index.size());
    assertEquals(0, index.offsetForBlock("b0"));
    assertEquals(4, index.offsetForBlock("b1"));
    assertEquals(7, index.offsetForBlock("b2"));
    assertEquals(7, index.offsetForBlock("b3"));
    assertEquals(0, index.offsetForBlock("missing"));
  }

  @Test
  void blockForOffsetSkipsEmptyBlocks() {
    BlockIndex index = BlockIndex.of(chain("abc\n", "de\n", "", "fghi"));
    assertEquals("b0", index.blockForOffset(0));
    assertEquals("b0", index.blockForOffset(3));
    assertEquals("b1", index.blockForOffset(4));
    assertEquals("b3", index.blockForOffset(7));
    assertEquals(new BlockOffset("b3", 2), index.blockOffsetForDocOffset(9));
  }

  @Test
  void documentEndMapsToEndOfLastBlock() {
    BlockIndex index = BlockIndex.of(chain("abc\n", "de"));
    assertEquals(new BlockOffset("b1", 2), index.blockOffsetForDocOffset(6));
    assertEquals("b1", index.blockForOffset(6));
    assertNull(BlockIndex.EMPTY.blockOffsetForDocOffset(0));
    assertNull(BlockIndex.EMPTY.blockForOffset(0));
  }

  @Test
  void offsetsOutsideDocumentAreRejected() {
    BlockIndex index = BlockIndex.of(chain("abc\n", "de"));
    assertThrows(IllegalArgumentException.class, () -> index.blockOffsetForDocOffset(-3));
    assertThrows(IllegalArgumentException.class, () -> index.blockOffsetForDocOffset(7));
    assertThrows(IllegalArgumentException.class, () -> BlockIndex.EMPTY.blockOffsetForDocOffset(1));
  }

  @Test
  void unindexUnknownIdIsNoOp() {
    BlockIndex index = BlockIndex.of(chain("a", "b"));
    assertSame(index, index.unindexBlock("nope"));
    assertSame(index, index.unindexBlock(null));
    assertEquals(List.of("b1"), ids(index.unindexBlock("b0")));
  }

  @Test
  void nodeOrder() {
    BlockIndex index = BlockIndex.of(chain("a", "b", "c"));
    assertTrue(index.nodeOrder(null, "b0"));
    assertTrue(index.nodeOrder("b0", "b1"));
    assertTrue(index.nodeOrder("b2", null));
    assertFalse(index.nodeOrder("b0", "b2"));
    assertFalse(index.nodeOrder(null, "b1"));
    assertFalse(index.nodeOrder("b1", null));
    assertTrue(BlockIndex.EMPTY.nodeOrder(null, null));
  }

  @Test
  void reindexingAChangedBlockKeepsItsPlace() {
    List<Block> blocks = chain("a\n", "b\n", "c\n");
    HashMap<String, Block> table = new HashMap<>();
    blocks.forEach(b -> table.put(b.id, b));
    BlockIndex index = BlockIndex.of(blocks);

    Block longer = blocks.get(1).withText("bbbb\n");
    table.put(longer.id, longer);
    index = index.indexBlock(longer, table::get);
    assertEquals(List.of("b0", "b1", "b2"), ids(index));
    assertEquals(9, index.length());
    assertEquals(7, index.offsetForBlock("b2"));
  }

  @Test
  void insertsNewBlocksBetweenNeighbours() {
    List<Block> blocks = chain("a\n", "c\n");
    HashMap<String, Block> table = new HashMap<>();
    blocks.forEach(b -> table.put(b.id, b));
    BlockIndex index = BlockIndex.of(blocks);

    Block inserted = Block.of("b\n").withId("x").withLinks("b0", "b1");
    table.put("x", inserted);
    index = index.indexBlock(inserted, table::get);
    assertEquals(List.of("b0", "x", "b1"), ids(index));

    Block tail = Block.of("d\n").withId("y").withLinks("b1", null);
    table.put("y", tail);
    index = index.indexBlock(tail, table::get);
    assertEquals(List.of("b0", "x", "b1", "y"), ids(index));

    Block head = Block.of("0\n").withId("z").withLinks(null, "b0");
    index = index.indexBlock(head, table::get);
    assertEquals(List.of("z", "b0", "x", "b1", "y"), ids(index));

    Block only = Block.of("only").withId("o");
    assertEquals(List.of("o"), ids(BlockIndex.EMPTY.indexBlock(only, id -> null)));
  }

  @Test
  void repairsIndexThatDriftedFromTheList() {
    List<Block> blocks = chain("a", "b", "c", "d");
    BlockIndex index = BlockIndex.of(blocks);
    // list order is now b0 b3 b2 b1, the index still says b0 b1 b2 b3
    HashMap<String, Block> table = new HashMap<>();
    table.put("b0", blocks.get(0).withLinks(null, "b3"));
    table.put("b3", blocks.get(3).withLinks("b0", "b2"));
    table.put("b2", blocks.get(2).withLinks("b3", "b1"));
    table.put("b1", blocks.get(1).withLinks("b2", null));

    index = index.indexBlock(table.get("b2"), table::get);
    assertEquals(List.of("b0", "b3", "b2", "b1"), ids(index));
    assertEquals(4, index.length());
  }
}
