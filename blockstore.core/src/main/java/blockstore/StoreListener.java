package blockstore;

public interface StoreListener {

  default void loaded(BlockStore store) {
  }

  default void changed(Change change) {
  }

  default void diagnosed(BlockErrors errors) {
  }
}
