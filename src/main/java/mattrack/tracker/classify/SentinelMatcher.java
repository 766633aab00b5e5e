package mattrack.tracker.classify;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Matches one line of engine output.
 */
public interface SentinelMatcher {

    boolean matches(String line);

    /** The pattern as written in the table, for reporting. */
    String pattern();

    static SentinelMatcher literal(String text, boolean caseSensitive) {
        return new Literal(text, caseSensitive);
    }

    static SentinelMatcher regex(String expression) {
        return new Regex(Pattern.compile(expression, Pattern.CASE_INSENSITIVE));
    }

    /**
     * Substring match.
     */
    record Literal(String text, boolean caseSensitive) implements SentinelMatcher {

        public Literal {
            if (text == null || text.isEmpty()) {
                throw new IllegalArgumentException("literal sentinel must not be empty");
            }
        }

        @Override
        public boolean matches(String line) {
            if (caseSensitive) {
                return line.contains(text);
            }
            return line.toLowerCase(Locale.ROOT).contains(text.toLowerCase(Locale.ROOT));
        }

        @Override
        public String pattern() {
            return text;
        }
    }

    /**
     * Regular expression found anywhere in the line.
     */
    record Regex(Pattern compiled) implements SentinelMatcher {

        @Override
        public boolean matches(String line) {
            return compiled.matcher(line).find();
        }

        @Override
        public String pattern() {
            return compiled.pattern();
        }
    }
}
