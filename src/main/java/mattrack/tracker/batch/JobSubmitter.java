package mattrack.tracker.batch;

import mattrack.tracker.config.KindDefaults;
import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationSettings;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.PrerequisiteNotMetException;
import mattrack.tracker.model.StatusUpdate;
import mattrack.tracker.model.TransitionResult;
import mattrack.tracker.repository.CalculationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Hands PENDING and RESUBMITTED calculations to the batch scheduler.
 *
 * <p>The scheduler call happens outside any store transaction; the SUBMITTED transition is a
 * compare-and-set against the status the calculation had when it was picked up.
 */
public class JobSubmitter {

    private static final Logger log = LoggerFactory.getLogger(JobSubmitter.class);

    public static final String SUBMISSION_ERROR = "submission_error";

    private final CalculationRepository calculations;
    private final BatchScheduler scheduler;
    private final LegacyStatusMirror mirror;
    private final Path baseWorkDir;
    private final Path scriptsDir;

    public JobSubmitter(CalculationRepository calculations, BatchScheduler scheduler, LegacyStatusMirror mirror,
            TrackerConfig config) {
        this.calculations = calculations;
        this.scheduler = scheduler;
        this.mirror = mirror;
        this.baseWorkDir = config.baseWorkDir();
        this.scriptsDir = config.scriptsDir();
    }

    /**
     * Whether the calculation's prerequisite (if any) has completed.
     */
    public boolean prerequisiteMet(Calculation calc) {
        if (!calc.hasPrerequisite()) {
            return true;
        }
        return calculations.findById(calc.prerequisiteCalcId())
                .map(prereq -> prereq.status() == CalculationStatus.COMPLETED)
                .orElse(false);
    }

    /**
     * Submit one calculation.
     *
     * @return the scheduler job id when the calculation is now SUBMITTED
     */
    public Optional<String> submit(Calculation calc) {
        CalculationStatus from = calc.status();
        if (from != CalculationStatus.PENDING && from != CalculationStatus.RESUBMITTED) {
            log.debug("Calculation {} is {}, not submittable", calc.calcId(), from);
            return Optional.empty();
        }
        if (!prerequisiteMet(calc)) {
            log.debug("Calculation {} waiting for {}", calc.calcId(), calc.prerequisiteCalcId());
            return Optional.empty();
        }
        if (calc.inputFile() == null) {
            markFailed(calc, "no input file recorded");
            return Optional.empty();
        }

        CalculationSettings settings = KindDefaults.resolve(calc.kind(), calc.settings());
        Path workDir;
        Path input;
        Path script;
        try {
            workDir = prepareWorkDir(calc);
            input = stageInput(Path.of(calc.inputFile()), workDir);
            script = stageScript(calc, settings, workDir, stem(input));
        } catch (IOException e) {
            markFailed(calc, "cannot prepare working directory: " + e.getMessage());
            return Optional.empty();
        }
        Path output = workDir.resolve(stem(input) + ".out");
        calculations.updateArtifacts(calc.calcId(), workDir.toString(), input.toString(), output.toString(),
                script.toString());

        String jobId;
        try {
            jobId = scheduler.submit(new SubmitRequest(calc.calcId(), workDir, input, script, settings));
        } catch (BatchSchedulerException e) {
            markFailed(calc, e.getMessage());
            return Optional.empty();
        }

        TransitionResult result;
        try {
            result = calculations.updateStatus(StatusUpdate.to(calc.calcId(), CalculationStatus.SUBMITTED)
                    .expecting(from)
                    .externalJobId(jobId)
                    .externalState("PENDING")
                    .settings(settings)
                    .build());
        } catch (PrerequisiteNotMetException e) {
            log.warn("Prerequisite of {} changed during submission, cancelling job {}", calc.calcId(), jobId);
            scheduler.cancel(jobId);
            return Optional.empty();
        }

        if (result != TransitionResult.APPLIED) {
            log.warn("Calculation {} changed while submitting ({}), cancelling job {}", calc.calcId(), result, jobId);
            scheduler.cancel(jobId);
            return Optional.empty();
        }
        calculations.findById(calc.calcId()).ifPresent(mirror::recordSubmission);
        return Optional.of(jobId);
    }

    /**
     * Working directory: the recorded one for resubmissions, else {@code <base>/<KIND>/<materialId>}.
     */
    Path prepareWorkDir(Calculation calc) throws IOException {
        Path dir = calc.workDir() != null
                ? Path.of(calc.workDir())
                : workDirFor(baseWorkDir, calc.kind(), calc.materialId());
        Files.createDirectories(dir);
        return dir;
    }

    public static Path workDirFor(Path baseWorkDir, CalculationKind kind, String materialId) {
        return baseWorkDir.resolve(kind.code()).resolve(materialId);
    }

    private static Path stageInput(Path input, Path workDir) throws IOException {
        if (!Files.isRegularFile(input)) {
            throw new IOException("input file not found: " + input);
        }
        Path absDir = workDir.toAbsolutePath().normalize();
        if (absDir.equals(input.toAbsolutePath().normalize().getParent())) {
            return input;
        }
        Path target = workDir.resolve(input.getFileName());
        Files.copy(input, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    /**
     * The job script recorded by an earlier submission is reused as is, so directives rewritten
     * by recovery carry over. Otherwise the kind's template is staged as {@code <stem>.sh}.
     */
    private Path stageScript(Calculation calc, CalculationSettings settings, Path workDir, String stem)
            throws IOException {
        if (calc.jobScript() != null && Files.isRegularFile(Path.of(calc.jobScript()))) {
            return Path.of(calc.jobScript());
        }
        return JobScripts.stage(scriptsDir.resolve(settings.submitScript()), workDir.resolve(stem + ".sh"),
                calc.calcId(), settings);
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private void markFailed(Calculation calc, String message) {
        log.error("Submission of {} failed: {}", calc.calcId(), message);
        calculations.updateStatus(StatusUpdate.to(calc.calcId(), CalculationStatus.FAILED)
                .expecting(calc.status())
                .error(SUBMISSION_ERROR, message)
                .build());
    }
}
