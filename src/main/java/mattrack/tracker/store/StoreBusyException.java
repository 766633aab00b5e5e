package mattrack.tracker.store;

/**
 * The store stayed locked by another caller through every retry.
 * Infrastructure condition: never recorded against a calculation.
 */
public class StoreBusyException extends StoreException {

    private final int attempts;

    public StoreBusyException(String operation, int attempts, Throwable cause) {
        super("Store busy: " + operation + " gave up after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
