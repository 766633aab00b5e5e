package mattrack.tracker.model;

/**
 * Material lifecycle status.
 */
public enum MaterialStatus {
    /** Material is tracked and may receive new calculations */
    ACTIVE,
    /** Material retired from tracking; kept for history, never deleted */
    ARCHIVED,
    /** Material could not be processed (bad structure, unusable source) */
    ERROR;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static MaterialStatus fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
