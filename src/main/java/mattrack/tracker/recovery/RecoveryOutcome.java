package mattrack.tracker.recovery;

import mattrack.tracker.model.CalculationSettings;

/**
 * What {@link RecoveryEngine} decided for one failed calculation.
 */
public record RecoveryOutcome(Decision decision, String detail, CalculationSettings settings) {

    public enum Decision {
        /** Artifacts transformed and the calculation moved to RESUBMITTED */
        RESUBMIT,
        /** Failure kind is not in the recoverable set */
        NOT_RECOVERABLE,
        /** Attempt ceiling already reached */
        CEILING_REACHED,
        /** Recoverable kind without a registered strategy */
        NO_STRATEGY,
        /** The strategy could not rewrite the artifacts */
        TRANSFORM_FAILED,
        /** Another actor moved the calculation out of FAILED first */
        STALE
    }

    static RecoveryOutcome of(Decision decision, String detail) {
        return new RecoveryOutcome(decision, detail, null);
    }

    public boolean resubmit() {
        return decision == Decision.RESUBMIT;
    }
}
