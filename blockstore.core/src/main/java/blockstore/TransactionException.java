package blockstore;

/**
 * Thrown when the store is mutated outside of {@link BlockStore#makeChanges}.
 */
public class TransactionException extends IllegalStateException {

  public TransactionException(String message) {
    super(message);
  }
}
