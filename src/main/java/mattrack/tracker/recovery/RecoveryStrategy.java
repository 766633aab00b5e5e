package mattrack.tracker.recovery;

import mattrack.tracker.model.Calculation;

/**
 * Kind-specific, in-place fix for a failed calculation.
 */
public interface RecoveryStrategy {

    /** Failure kind this strategy handles. */
    String kind();

    /**
     * Mutate the calculation's input or job script in its existing working directory.
     *
     * @param calculation the failed calculation
     * @param attempt     1-based number of the attempt being prepared
     * @return settings to resubmit with
     * @throws RecoveryException when the artifacts cannot be transformed
     */
    RecoveryAction apply(Calculation calculation, int attempt) throws RecoveryException;

    /** Attempts allowed for this kind; the engine also applies its global ceiling. */
    default int maxAttempts() {
        return Integer.MAX_VALUE;
    }
}
