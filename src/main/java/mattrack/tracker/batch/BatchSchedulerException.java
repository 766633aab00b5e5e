package mattrack.tracker.batch;

/**
 * The batch scheduler rejected a request or could not be reached.
 */
public class BatchSchedulerException extends Exception {

    public BatchSchedulerException(String message) {
        super(message);
    }

    public BatchSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
