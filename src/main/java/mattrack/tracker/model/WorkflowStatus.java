package mattrack.tracker.model;

/**
 * Workflow instance status.
 */
public enum WorkflowStatus {
    /** Steps still being generated or executed */
    ACTIVE,
    /** Last step finished, nothing downstream */
    COMPLETED,
    /** A required step failed terminally */
    FAILED,
    /** Progression suspended by a user */
    PAUSED;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static WorkflowStatus fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
