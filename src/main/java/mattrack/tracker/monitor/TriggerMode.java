package mattrack.tracker.monitor;

import java.util.Locale;

/**
 * What a monitor cycle does.
 */
public enum TriggerMode {
    /** A job finished: reconcile statuses, then submit pending work */
    COMPLETION(true, false, true),
    /** Only look for jobs that are failing early */
    EARLY_FAILURE(false, true, false),
    /** Only reconcile statuses against the scheduler */
    STATUS_CHECK(true, false, false),
    /** Only submit pending work */
    SUBMIT_PENDING(false, false, true),
    /** Everything */
    FULL_CHECK(true, true, true);

    private final boolean statusCheck;
    private final boolean earlyFailure;
    private final boolean submitPending;

    TriggerMode(boolean statusCheck, boolean earlyFailure, boolean submitPending) {
        this.statusCheck = statusCheck;
        this.earlyFailure = earlyFailure;
        this.submitPending = submitPending;
    }

    public boolean checksStatus() {
        return statusCheck;
    }

    public boolean checksEarlyFailure() {
        return earlyFailure;
    }

    public boolean submitsPending() {
        return submitPending;
    }

    /**
     * Parse a mode from its name ("completion", "full_check", "full-check"...).
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static TriggerMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("mode is required");
        }
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
