package mattrack.tracker.classify;

import java.util.List;

/**
 * Sentinels the engine prints when a run of a given kind finished normally.
 */
public record CompletionRule(String name, String kindCode, List<SentinelMatcher> matchers) {

    public CompletionRule {
        matchers = List.copyOf(matchers);
    }

    public boolean matches(String line) {
        for (SentinelMatcher m : matchers) {
            if (m.matches(line)) {
                return true;
            }
        }
        return false;
    }
}
