package mattrack.tracker.store;

/**
 * Unchecked wrapper for failures talking to the calculation store.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
