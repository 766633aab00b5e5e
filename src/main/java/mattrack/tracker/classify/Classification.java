package mattrack.tracker.classify;

import java.util.List;

/**
 * Result of classifying engine output.
 *
 * @param kind           failure kind ("memory_error", ...), {@code unknown} or {@code none}
 * @param matchedPattern sentinel that decided the kind, null when nothing matched
 * @param matchedLine    trimmed output line that contained it
 */
public record Classification(
        String kind,
        Severity severity,
        boolean recoverable,
        String description,
        List<String> hints,
        String matchedPattern,
        String matchedLine) {

    public static final String NONE = "none";
    public static final String UNKNOWN = "unknown";

    public Classification {
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public static Classification none() {
        return new Classification(NONE, Severity.LOW, false, "No error detected", List.of(), null, null);
    }

    public static Classification unknown(String line) {
        return new Classification(UNKNOWN, Severity.UNKNOWN, false, "Unclassified error message", List.of(),
                "generic_error", line);
    }

    static Classification of(FailureRule rule, SentinelMatcher matcher, String line) {
        return new Classification(rule.kind(), rule.severity(), rule.recoverable(), rule.description(),
                rule.hints(), matcher.pattern(), line);
    }

    public boolean isError() {
        return !NONE.equals(kind);
    }

    /** Short text for the calculation's error_message column. */
    public String summary() {
        if (!isError()) {
            return description;
        }
        return matchedLine != null ? description + ": " + matchedLine : description;
    }
}
