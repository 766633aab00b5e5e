package mattrack.tracker.classify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ordered failure and completion sentinels, compiled from JSON.
 * Row order is significant: the first matching failure rule wins.
 */
public final class PatternTable {

    private static final Logger log = LoggerFactory.getLogger(PatternTable.class);
    private static final String DEFAULT_RESOURCE = "/mattrack/failure-patterns.json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<FailureRule> failureRules;
    private final List<CompletionRule> completionRules;
    private final List<SentinelMatcher> earlyFailure;
    private final List<String> genericErrorExclusions;

    public PatternTable(List<FailureRule> failureRules, List<CompletionRule> completionRules,
            List<SentinelMatcher> earlyFailure, List<String> genericErrorExclusions) {
        this.failureRules = List.copyOf(failureRules);
        this.completionRules = List.copyOf(completionRules);
        this.earlyFailure = List.copyOf(earlyFailure);
        this.genericErrorExclusions = genericErrorExclusions.stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * Load the table bundled with the application.
     */
    public static PatternTable loadDefault() {
        try (InputStream in = PatternTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return compile(MAPPER.readValue(in, TableSpec.class), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Load a table from a file, or the bundled one when {@code path} is null.
     */
    public static PatternTable load(Path path) {
        if (path == null) {
            return loadDefault();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return compile(MAPPER.readValue(in, TableSpec.class), path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read failure patterns from " + path, e);
        }
    }

    private static PatternTable compile(TableSpec spec, String source) {
        List<FailureRule> rules = new ArrayList<>();
        for (RuleSpec r : nullToEmpty(spec.rules())) {
            if (r.kind() == null || r.kind().isBlank()) {
                throw new IllegalArgumentException("Failure rule without kind in " + source);
            }
            List<SentinelMatcher> matchers = new ArrayList<>();
            nullToEmpty(r.literals()).forEach(l -> matchers.add(SentinelMatcher.literal(l, false)));
            nullToEmpty(r.regex()).forEach(x -> matchers.add(SentinelMatcher.regex(x)));
            if (matchers.isEmpty()) {
                throw new IllegalArgumentException("Failure rule '" + r.kind() + "' has no patterns in " + source);
            }
            Severity severity = r.severity() != null ? Severity.valueOf(r.severity().toUpperCase(Locale.ROOT))
                    : Severity.MEDIUM;
            rules.add(new FailureRule(r.kind(), severity, r.recoverable(), r.description(), matchers, r.hints()));
        }

        List<CompletionRule> completion = new ArrayList<>();
        for (CompletionSpec c : nullToEmpty(spec.completion())) {
            List<SentinelMatcher> matchers = nullToEmpty(c.literals()).stream()
                    .map(l -> SentinelMatcher.literal(l, true))
                    .toList();
            completion.add(new CompletionRule(c.name(), c.kind(), matchers));
        }

        List<SentinelMatcher> early = nullToEmpty(spec.earlyFailure()).stream()
                .map(l -> SentinelMatcher.literal(l, false))
                .toList();

        log.info("Loaded {} failure rules and {} completion rules from {}", rules.size(), completion.size(), source);
        return new PatternTable(rules, completion, early, nullToEmpty(spec.genericErrorExclusions()));
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    public List<FailureRule> failureRules() {
        return failureRules;
    }

    public List<CompletionRule> completionRules() {
        return completionRules;
    }

    public List<SentinelMatcher> earlyFailure() {
        return earlyFailure;
    }

    public List<String> genericErrorExclusions() {
        return genericErrorExclusions;
    }

    // JSON layout of the table file

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TableSpec(
            @JsonProperty("rules") List<RuleSpec> rules,
            @JsonProperty("completion") List<CompletionSpec> completion,
            @JsonProperty("earlyFailure") List<String> earlyFailure,
            @JsonProperty("genericErrorExclusions") List<String> genericErrorExclusions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleSpec(
            @JsonProperty("kind") String kind,
            @JsonProperty("severity") String severity,
            @JsonProperty("recoverable") boolean recoverable,
            @JsonProperty("description") String description,
            @JsonProperty("literals") List<String> literals,
            @JsonProperty("regex") List<String> regex,
            @JsonProperty("hints") List<String> hints) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompletionSpec(
            @JsonProperty("name") String name,
            @JsonProperty("kind") String kind,
            @JsonProperty("literals") List<String> literals) {
    }
}
