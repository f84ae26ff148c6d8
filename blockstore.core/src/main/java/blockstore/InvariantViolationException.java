package blockstore;

/**
 * The block list or its index is corrupt. Always a bug in the code that changed the store.
 */
public class InvariantViolationException extends IllegalStateException {

  public InvariantViolationException(String message) {
    super(message);
  }
}
