package mattrack.tracker.model;

/**
 * Category of a file attached to a calculation.
 */
public enum FileType {
    INPUT,
    OUTPUT,
    LOG,
    PROPERTY,
    WAVEFUNCTION,
    PLOT,
    SCRIPT;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static FileType fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
