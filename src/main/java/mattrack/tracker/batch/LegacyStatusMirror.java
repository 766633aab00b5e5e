package mattrack.tracker.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import mattrack.tracker.model.Calculation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Best-effort JSON mirror of submitted jobs for older tooling that reads {@code crystal_job_status.json}.
 * The store is authoritative; a failed write is logged and otherwise ignored.
 */
public class LegacyStatusMirror {

    private static final Logger log = LoggerFactory.getLogger(LegacyStatusMirror.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;
    private final Map<String, Map<String, String>> submitted = new LinkedHashMap<>();

    public LegacyStatusMirror(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    /**
     * Replace the mirror with the given active calculations.
     */
    public synchronized void rebuildFrom(Collection<Calculation> active) {
        submitted.clear();
        for (Calculation calc : active) {
            if (calc.externalJobId() != null) {
                submitted.put(calc.externalJobId(), entry(calc));
            }
        }
        save();
    }

    public synchronized void recordSubmission(Calculation calc) {
        if (calc.externalJobId() == null) {
            return;
        }
        submitted.put(calc.externalJobId(), entry(calc));
        save();
    }

    public synchronized void remove(String externalJobId) {
        if (externalJobId != null && submitted.remove(externalJobId) != null) {
            save();
        }
    }

    public synchronized Map<String, Map<String, String>> snapshot() {
        return Map.copyOf(submitted);
    }

    private static Map<String, String> entry(Calculation calc) {
        Map<String, String> entry = new LinkedHashMap<>();
        entry.put("file", calc.inputFile());
        entry.put("calc_id", calc.calcId());
        entry.put("material_id", calc.materialId());
        entry.put("calc_type", calc.kind().code());
        Instant submittedAt = calc.submittedAt() != null ? calc.submittedAt() : Instant.now();
        entry.put("submitted_time", LocalDateTime.ofInstant(submittedAt, ZoneId.systemDefault()).toString());
        return entry;
    }

    private void save() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("submitted", submitted);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            MAPPER.writeValue(tmp.toFile(), doc);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Could not write legacy status {}: {}", file, e.getMessage());
        }
    }
}
