package mattrack.tracker.recovery;

import mattrack.tracker.model.Calculation;

/**
 * Transient I/O failures: resubmit unchanged, a limited number of times.
 */
public final class ResubmitStrategy implements RecoveryStrategy {

    public static final String KIND = "io_error";

    private final int maxRetries;

    public ResubmitStrategy(RecoveryConfig config) {
        this.maxRetries = (int) config.param(KIND, "maxRetries", 1);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public int maxAttempts() {
        return maxRetries;
    }

    @Override
    public RecoveryAction apply(Calculation calculation, int attempt) {
        return new RecoveryAction(ResourceScaling.currentSettings(calculation), "resubmit unchanged");
    }
}
