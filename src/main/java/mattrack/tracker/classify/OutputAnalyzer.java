package mattrack.tracker.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads an output file and combines classification, completion detection and diagnostics.
 * Errors are checked first; completion only counts when no error matched.
 */
public class OutputAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(OutputAnalyzer.class);
    private static final int HEADER_LINES = 20;

    private final ErrorClassifier classifier;

    public OutputAnalyzer(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    public ErrorClassifier classifier() {
        return classifier;
    }

    public OutputScan analyze(Path outputFile) {
        if (outputFile == null) {
            return OutputScan.unknown("no output file recorded");
        }
        if (!Files.isRegularFile(outputFile)) {
            return OutputScan.unknown("output file not found: " + outputFile);
        }

        List<String> lines;
        long size;
        try {
            size = Files.size(outputFile);
            lines = readLines(outputFile);
        } catch (IOException e) {
            log.warn("Could not read output {}: {}", outputFile, e.getMessage());
            return OutputScan.unknown("output file unreadable: " + e.getMessage());
        }
        return analyze(lines, size);
    }

    /**
     * Analyze output already in memory.
     */
    public OutputScan analyze(List<String> lines, long size) {
        RuntimeDiagnostics diagnostics = RuntimeDiagnostics.extract(lines);

        Classification classification = classifier.classify(lines);
        if (classification.isError()) {
            return new OutputScan(ScanStatus.ERROR, classification, null, diagnostics, size, null);
        }

        Optional<CompletionRule> completion = classifier.findCompletion(lines);
        if (completion.isPresent()) {
            return new OutputScan(ScanStatus.COMPLETED, classification, completion.get().name(), diagnostics, size,
                    null);
        }

        boolean started = lines.stream()
                .limit(HEADER_LINES)
                .anyMatch(l -> l.contains("CRYSTAL") && l.contains("CALCULATION"));
        return new OutputScan(started ? ScanStatus.ONGOING : ScanStatus.INCOMPLETE, classification, null,
                diagnostics, size, null);
    }

    /**
     * Early-failure sentinel in the output, if any. Missing files yield empty.
     */
    public Optional<String> earlyFailure(Path outputFile) {
        if (outputFile == null || !Files.isRegularFile(outputFile)) {
            return Optional.empty();
        }
        try {
            return classifier.findEarlyFailure(readLines(outputFile));
        } catch (IOException e) {
            log.warn("Could not read output {} for early-failure check: {}", outputFile, e.getMessage());
            return Optional.empty();
        }
    }

    // Engine output occasionally carries stray bytes; decode leniently instead of failing.
    private static List<String> readLines(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString()
                    .lines()
                    .toList();
        } catch (CharacterCodingException e) {
            throw new IOException("Cannot decode " + file, e);
        }
    }
}
