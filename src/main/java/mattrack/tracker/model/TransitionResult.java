package mattrack.tracker.model;

/**
 * Result of a status update.
 */
public enum TransitionResult {
    /** Status changed by this call */
    APPLIED,

    /** Calculation already had the requested status - idempotent success, nothing written */
    UNCHANGED,

    /**
     * Calculation was not in the expected status; another caller moved it first
     */
    STALE,

    /** Recovery attempt refused: the attempt counter already reached the ceiling */
    CEILING_REACHED,

    /** Calculation not found */
    NOT_FOUND
}
