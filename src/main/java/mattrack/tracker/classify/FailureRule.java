package mattrack.tracker.classify;

import java.util.List;
import java.util.Optional;

/**
 * One row of the failure table: a kind and the sentinels that identify it.
 */
public record FailureRule(
        String kind,
        Severity severity,
        boolean recoverable,
        String description,
        List<SentinelMatcher> matchers,
        List<String> hints) {

    public FailureRule {
        matchers = List.copyOf(matchers);
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    /** First matcher (in table order) that hits the line. */
    public Optional<SentinelMatcher> match(String line) {
        for (SentinelMatcher m : matchers) {
            if (m.matches(line)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
