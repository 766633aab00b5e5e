package mattrack.tracker.service;

import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.FileRecord;
import mattrack.tracker.model.FileType;
import mattrack.tracker.repository.FileRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Records the files a finished calculation left in its working directory.
 */
public class FileRecordService {

    private static final Logger log = LoggerFactory.getLogger(FileRecordService.class);

    private static final Map<FileType, List<String>> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(FileType.INPUT, List.of("*.d12", "*.d3"));
        PATTERNS.put(FileType.OUTPUT, List.of("*.out"));
        PATTERNS.put(FileType.LOG, List.of("*.log", "*.err"));
        PATTERNS.put(FileType.PROPERTY, List.of("*.dat", "*.DAT", "*.csv"));
        PATTERNS.put(FileType.WAVEFUNCTION, List.of("*.f9", "fort.9"));
        PATTERNS.put(FileType.PLOT, List.of("*.png", "*.pdf"));
        PATTERNS.put(FileType.SCRIPT, List.of("*.sh"));
    }

    private final FileRecordRepository files;

    public FileRecordService(FileRecordRepository files) {
        this.files = files;
    }

    /**
     * Scan the calculation's working directory and save a record for every matching file
     * not recorded yet.
     *
     * @return the records written by this call
     */
    public List<FileRecord> recordOutputs(Calculation calc) {
        if (calc.workDir() == null) {
            return List.of();
        }
        Path dir = Path.of(calc.workDir());
        if (!Files.isDirectory(dir)) {
            log.debug("Working directory {} of {} does not exist", dir, calc.calcId());
            return List.of();
        }

        Set<String> known = files.findByCalculation(calc.calcId()).stream()
                .map(FileRecord::filePath)
                .collect(Collectors.toSet());
        List<FileRecord> written = new ArrayList<>();
        for (Map.Entry<FileType, List<String>> entry : PATTERNS.entrySet()) {
            for (String pattern : entry.getValue()) {
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, pattern)) {
                    for (Path file : stream) {
                        String path = file.toString();
                        if (!Files.isRegularFile(file) || !known.add(path)) {
                            continue;
                        }
                        FileRecord record = new FileRecord(null, calc.calcId(), entry.getKey(),
                                file.getFileName().toString(), path, Files.size(file), sha256(file), Instant.now());
                        long id = files.save(record);
                        written.add(new FileRecord(id, record.calcId(), record.fileType(), record.fileName(),
                                record.filePath(), record.fileSize(), record.checksum(), record.createdAt()));
                    }
                } catch (IOException e) {
                    log.warn("Could not scan {} for {}: {}", dir, pattern, e.getMessage());
                }
            }
        }
        if (!written.isEmpty()) {
            log.info("Recorded {} file(s) for {}", written.size(), calc.calcId());
        }
        return written;
    }

    public List<FileRecord> filesOf(String calcId) {
        return files.findByCalculation(calcId);
    }

    static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) > 0) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
