package mattrack.tracker.classify;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Buckets engine output into a failure kind using an ordered {@link PatternTable}.
 * Stateless and thread-safe; identical input always yields the identical result.
 */
public class ErrorClassifier {

    private final PatternTable table;

    public ErrorClassifier(PatternTable table) {
        this.table = table;
    }

    public PatternTable table() {
        return table;
    }

    /**
     * Classify a whole output text.
     */
    public Classification classify(String outputText) {
        if (outputText == null || outputText.isEmpty()) {
            return Classification.none();
        }
        return classify(outputText.lines().toList());
    }

    /**
     * Lines are scanned in order and every rule is tried against each line, so the earliest
     * offending line decides; within a line the first rule in table order wins.
     */
    public Classification classify(List<String> lines) {
        for (String line : lines) {
            for (FailureRule rule : table.failureRules()) {
                Optional<SentinelMatcher> hit = rule.match(line);
                if (hit.isPresent()) {
                    return Classification.of(rule, hit.get(), line.strip());
                }
            }
        }

        for (String line : lines) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.contains("error") && table.genericErrorExclusions().stream().noneMatch(lower::contains)) {
                return Classification.unknown(line.strip());
            }
        }

        return Classification.none();
    }

    /**
     * Completion rule whose sentinel appears in the output, in table order.
     */
    public Optional<CompletionRule> findCompletion(List<String> lines) {
        for (CompletionRule rule : table.completionRules()) {
            for (String line : lines) {
                if (rule.matches(line)) {
                    return Optional.of(rule);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * First early-failure sentinel found in the output, if any.
     */
    public Optional<String> findEarlyFailure(List<String> lines) {
        for (String line : lines) {
            for (SentinelMatcher m : table.earlyFailure()) {
                if (m.matches(line)) {
                    return Optional.of(line.strip());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Classification for a failure the scheduler reported without evidence in the output,
     * such as a job killed at its time limit. Falls back to {@code unknown} if the table has no such kind.
     */
    public Classification forSchedulerState(String kind, String state) {
        return table.failureRules().stream()
                .filter(r -> r.kind().equals(kind))
                .findFirst()
                .map(r -> new Classification(r.kind(), r.severity(), r.recoverable(), r.description(), r.hints(),
                        "scheduler:" + state, null))
                .orElseGet(() -> Classification.unknown(null));
    }
}
