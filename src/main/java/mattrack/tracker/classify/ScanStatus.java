package mattrack.tracker.classify;

/**
 * Verdict of scanning an output file.
 */
public enum ScanStatus {
    /** A completion sentinel was found and no error */
    COMPLETED,
    /** A failure sentinel (or generic error line) was found */
    ERROR,
    /** Header shows the engine started, no end marker yet */
    ONGOING,
    /** Output exists but shows neither completion nor a start header */
    INCOMPLETE,
    /** Output missing or unreadable; check again later */
    UNKNOWN
}
