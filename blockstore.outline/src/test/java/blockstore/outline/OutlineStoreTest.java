package blockstore.outline;

import blockstore.Block;
import blockstore.Change;
import blockstore.StoreOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutlineStoreTest {

  OutlineStore store;

  @BeforeEach
  void setUp() {
    store = new OutlineStore(new StoreOptions("block", true, true));
  }

  static List<String> texts(List<Block> blocks) {
    ArrayList<String> texts = new ArrayList<>();
    for (Block block : blocks) {
      texts.add(block.text);
    }
    return texts;
  }

  @Test
  void linksFollowHeadlineLevels() {
    store.load("outline", "* A\nintro\n** B\nbody\n* C\n*** D\n");
    Block a = store.getBlock("block0");
    Block intro = store.getBlock("block1");
    Block b = store.getBlock("block2");
    Block body = store.getBlock("block3");
    Block c = store.getBlock("block4");
    Block d = store.getBlock("block5");

    assertEquals(List.of(a, c), store.children(null));
    assertEquals(List.of(intro, b), store.children(a));
    assertEquals(List.of(body), store.children(b));
    assertNull(store.parent(a));
    assertEquals(a, store.parent(b));
    assertEquals(b, store.parent(body));
    assertEquals(c, store.parent(d));
    assertEquals(c, store.nextSibling(a));
    assertEquals(a, store.previousSibling(c));
    assertEquals(intro, store.firstChild(a));
    assertEquals(b, store.lastChild(a));
    assertNull(store.firstChild(body));
    assertNull(store.nextSibling(c));
  }

  @Test
  void newHeadlineRelinksChildren() {
    store.load("outline", "* A\none\ntwo\n* B\n");
    Change change = store.replaceText(8, 8, "** ");
    assertNotNull(change);
    assertEquals(List.of("* A\n", "one\n", "** two\n", "* B\n"), texts(store.blockList()));
    assertEquals(1, change.adds.size());

    Block a = store.getBlock("block0");
    List<Block> children = store.children(a);
    assertEquals(List.of("one\n", "** two\n"), texts(children));
    assertEquals(2, OutlineParser.level(children.get(1)));
  }

  @Test
  void deletingHeadlineMergesChunks() {
    store.load("outline", "* A\nx\n* B\ny\n");
    Change change = store.replaceText(6, 10, "");
    assertEquals(List.of("* A\n", "x\ny\n"), texts(store.blockList()));
    assertEquals(2, change.removes.size());
    Block chunk = store.getBlock("block1");
    assertEquals("x\ny\n", chunk.text);
    assertEquals(store.getBlock("block0"), store.parent(chunk));
    store.check();
  }

  @Test
  void promotingHeadlineMovesItToTopLevel() {
    store.load("outline", "* A\n** B\ntext\n");
    store.replaceText(4, 5, "");
    assertEquals(List.of("* A\n", "* B\n", "text\n"), texts(store.blockList()));
    Block b = store.getBlock("block1");
    assertNull(store.parent(b));
    assertEquals(2, store.children(null).size());
    assertEquals(List.of("text\n"), texts(store.children(b)));
  }

  @Test
  void linksAreEmptyForEmptyOutline() {
    store.load("empty", "");
    assertTrue(store.children(null).isEmpty());
    assertEquals(0, store.getLinks().size());
  }
}
