package mattrack.tracker.classify;

/**
 * How serious a classified failure is.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    /** Error line found but no rule matched */
    UNKNOWN
}
