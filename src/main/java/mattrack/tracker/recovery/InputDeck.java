package mattrack.tracker.recovery;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Line-oriented view of an engine input file: a keyword on its own line, its values on the next.
 * Only keyword/value pairs are touched; everything else is preserved verbatim.
 */
final class InputDeck {

    private final Path path;
    private final List<String> lines;

    private InputDeck(Path path, List<String> lines) {
        this.path = path;
        this.lines = new ArrayList<>(lines);
    }

    static InputDeck read(Path path) throws RecoveryException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new RecoveryException("input file not found: " + path);
        }
        try {
            return new InputDeck(path, Files.readAllLines(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RecoveryException("cannot read input file " + path, e);
        }
    }

    OptionalInt indexOf(String keyword) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).trim().toUpperCase(Locale.ROOT).equals(keyword)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /** Values line following {@code keyword}, or null when the keyword is absent. */
    String valueOf(String keyword) {
        OptionalInt idx = indexOf(keyword);
        if (idx.isEmpty() || idx.getAsInt() + 1 >= lines.size()) {
            return null;
        }
        return lines.get(idx.getAsInt() + 1).trim();
    }

    void setValue(String keyword, String value) {
        int idx = indexOf(keyword).orElseThrow();
        lines.set(idx + 1, value);
    }

    /**
     * Insert {@code keyword} and its value right after the line equal to {@code anchor},
     * or before the last END line when {@code anchor} is null.
     *
     * @return false if no insertion point exists
     */
    boolean insert(String keyword, String value, String anchor) {
        int at;
        if (anchor != null) {
            OptionalInt idx = indexOf(anchor);
            if (idx.isEmpty()) {
                return false;
            }
            at = idx.getAsInt() + 1;
        } else {
            at = lastIndexOf("END");
            if (at < 0) {
                return false;
            }
        }
        lines.add(at, value);
        lines.add(at, keyword);
        return true;
    }

    private int lastIndexOf(String keyword) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).trim().toUpperCase(Locale.ROOT).equals(keyword)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Keep a copy of the pre-recovery input next to it, then replace the file.
     */
    void write(int attempt) throws RecoveryException {
        try {
            Path backup = path.resolveSibling(path.getFileName() + ".attempt" + attempt + ".bak");
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.write(tmp, lines, StandardCharsets.UTF_8);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RecoveryException("cannot rewrite input file " + path, e);
        }
    }

    static int parseInt(String value, String keyword) throws RecoveryException {
        try {
            return Integer.parseInt(value.trim().split("\\s+")[0]);
        } catch (RuntimeException e) {
            throw new RecoveryException("unexpected " + keyword + " value: " + value, e);
        }
    }

    static double parseDouble(String value, String keyword) throws RecoveryException {
        try {
            return Double.parseDouble(value.trim().split("\\s+")[0]);
        } catch (RuntimeException e) {
            throw new RecoveryException("unexpected " + keyword + " value: " + value, e);
        }
    }
}
