package mattrack.tracker.workflow;

/**
 * The input for a downstream calculation could not be produced.
 */
public class InputGenerationException extends Exception {

    public InputGenerationException(String message) {
        super(message);
    }

    public InputGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
