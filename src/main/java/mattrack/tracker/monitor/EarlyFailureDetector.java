package mattrack.tracker.monitor;

import mattrack.tracker.batch.BatchScheduler;
import mattrack.tracker.batch.LegacyStatusMirror;
import mattrack.tracker.classify.OutputAnalyzer;
import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.StatusUpdate;
import mattrack.tracker.model.TransitionResult;
import mattrack.tracker.repository.CalculationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cancels RUNNING jobs whose output already shows they will not finish.
 *
 * A job is only inspected once it has run longer than the configured floor. It is cancelled when
 * its output contains an early-failure sentinel, or when a relaxation has produced almost no output.
 */
public class EarlyFailureDetector {

    private static final Logger log = LoggerFactory.getLogger(EarlyFailureDetector.class);

    public static final String EARLY_FAILURE = "early_failure";

    private final CalculationRepository calculations;
    private final BatchScheduler scheduler;
    private final OutputAnalyzer analyzer;
    private final LegacyStatusMirror mirror;
    private final Duration floor;
    private final long minimalOutputBytes;

    public EarlyFailureDetector(CalculationRepository calculations, BatchScheduler scheduler, OutputAnalyzer analyzer,
            LegacyStatusMirror mirror, TrackerConfig config) {
        this.calculations = calculations;
        this.scheduler = scheduler;
        this.analyzer = analyzer;
        this.mirror = mirror;
        this.floor = config.earlyFailureFloor();
        this.minimalOutputBytes = config.minimalOutputBytes();
    }

    /**
     * @return number of jobs cancelled
     */
    public int cancelEarlyFailures() {
        Instant cutoff = Instant.now().minus(floor);
        List<Calculation> running = calculations.findByStatus(CalculationStatus.RUNNING);

        int cancelled = 0;
        for (Calculation calc : running) {
            if (calc.startedAt() == null || calc.startedAt().isAfter(cutoff)) {
                continue;
            }
            try {
                Optional<String> reason = failingEarly(calc);
                if (reason.isPresent() && cancel(calc, reason.get())) {
                    cancelled++;
                }
            } catch (Exception e) {
                log.error("Failed to check {} for early failure", calc.calcId(), e);
            }
        }
        if (cancelled > 0) {
            log.info("Early-failure check: {} job(s) cancelled of {} running", cancelled, running.size());
        }
        return cancelled;
    }

    Optional<String> failingEarly(Calculation calc) throws IOException {
        Path output = OutputFiles.resolve(calc);
        if (output == null || !Files.isRegularFile(output)) {
            return Optional.empty();
        }
        Optional<String> sentinel = analyzer.earlyFailure(output);
        if (sentinel.isPresent()) {
            return Optional.of("early failure sentinel: " + sentinel.get());
        }
        long size = Files.size(output);
        if (calc.kind() == CalculationKind.RELAXATION && size < minimalOutputBytes) {
            return Optional.of("only " + size + " bytes of output after " + floor.toSeconds() + "s");
        }
        return Optional.empty();
    }

    private boolean cancel(Calculation calc, String reason) {
        log.warn("Calculation {} is failing early ({}), cancelling job {}", calc.calcId(), reason,
                calc.externalJobId());
        if (calc.externalJobId() != null && !scheduler.cancel(calc.externalJobId())) {
            log.warn("Scheduler did not accept cancel of job {}, marking cancelled anyway", calc.externalJobId());
        }
        TransitionResult result = calculations.updateStatus(StatusUpdate.to(calc.calcId(), CalculationStatus.CANCELLED)
                .expecting(CalculationStatus.RUNNING)
                .error(EARLY_FAILURE, "Job cancelled due to early failure detection: " + reason)
                .build());
        if (result == TransitionResult.APPLIED) {
            mirror.remove(calc.externalJobId());
            return true;
        }
        return false;
    }
}
