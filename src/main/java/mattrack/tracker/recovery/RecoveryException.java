package mattrack.tracker.recovery;

/**
 * A recovery strategy could not transform the calculation's artifacts.
 */
public class RecoveryException extends Exception {

    public RecoveryException(String message) {
        super(message);
    }

    public RecoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
