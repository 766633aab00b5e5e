package mattrack.tracker.batch;

import java.util.Locale;

/**
 * Scheduler job state, normalized across the states the batch system reports.
 */
public enum ExternalJobState {
    /** Waiting for resources */
    QUEUED,
    /** Executing */
    RUNNING,
    /** Exited successfully */
    COMPLETED,
    /** Exited with an error or lost its node */
    FAILED,
    /** Cancelled by a user or administrator */
    CANCELLED,
    /** Killed at its time limit */
    TIMEOUT,
    /** Anything else; ignored by the monitor */
    UNKNOWN;

    /**
     * Map a SLURM state string ({@code squeue %T}) to a normalized state.
     * Suffixes such as {@code "CANCELLED by 1234"} are tolerated.
     */
    public static ExternalJobState fromSlurm(String state) {
        if (state == null || state.isBlank()) {
            return UNKNOWN;
        }
        String head = state.trim().split("\\s+")[0].toUpperCase(Locale.ROOT);
        return switch (head) {
            case "PENDING", "CONFIGURING", "REQUEUED" -> QUEUED;
            case "RUNNING", "COMPLETING" -> RUNNING;
            case "COMPLETED" -> COMPLETED;
            case "FAILED", "NODE_FAIL", "OUT_OF_MEMORY", "BOOT_FAIL" -> FAILED;
            case "CANCELLED" -> CANCELLED;
            case "TIMEOUT", "DEADLINE" -> TIMEOUT;
            default -> UNKNOWN;
        };
    }

    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }

    public boolean isFailure() {
        return this == FAILED || this == TIMEOUT;
    }
}
