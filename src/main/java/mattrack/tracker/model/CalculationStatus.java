package mattrack.tracker.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Calculation lifecycle status together with the table of allowed transitions.
 *
 * <pre>
 * PENDING -> SUBMITTED -> RUNNING -> COMPLETED | FAILED | CANCELLED
 * FAILED -> RESUBMITTED -> SUBMITTED   (recovery under the same id)
 * </pre>
 */
public enum CalculationStatus {
    /** Created, waiting for submission (prerequisite may still be running) */
    PENDING,
    /** Accepted by the external scheduler, queued */
    SUBMITTED,
    /** Executing on the cluster */
    RUNNING,
    /** Finished successfully */
    COMPLETED,
    /** Finished with an error (may still be recovered) */
    FAILED,
    /** Cancelled by a user or by early-failure detection */
    CANCELLED,
    /** Input mutated by recovery, waiting to be resubmitted under the same id */
    RESUBMITTED;

    private static final Map<CalculationStatus, Set<CalculationStatus>> ALLOWED = new EnumMap<>(CalculationStatus.class);

    static {
        ALLOWED.put(PENDING, EnumSet.of(SUBMITTED, FAILED, CANCELLED));
        ALLOWED.put(SUBMITTED, EnumSet.of(RUNNING, COMPLETED, FAILED, CANCELLED));
        ALLOWED.put(RUNNING, EnumSet.of(COMPLETED, FAILED, CANCELLED));
        ALLOWED.put(FAILED, EnumSet.of(RESUBMITTED));
        ALLOWED.put(RESUBMITTED, EnumSet.of(SUBMITTED, FAILED, CANCELLED));
        ALLOWED.put(COMPLETED, EnumSet.noneOf(CalculationStatus.class));
        ALLOWED.put(CANCELLED, EnumSet.noneOf(CalculationStatus.class));
    }

    /** Statuses this one may move to. */
    public Set<CalculationStatus> allowedNext() {
        return Collections.unmodifiableSet(ALLOWED.get(this));
    }

    public boolean canTransitionTo(CalculationStatus next) {
        return ALLOWED.get(this).contains(next);
    }

    /** Calculation is known to the external scheduler and may show up in a poll. */
    public boolean isActive() {
        return this == SUBMITTED || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public String dbValue() {
        return name().toLowerCase();
    }

    public static CalculationStatus fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
