package mattrack.tracker.batch;

import mattrack.tracker.model.CalculationSettings;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One job handed to the batch scheduler.
 *
 * @param jobName   name shown in the queue, normally the calculation id
 * @param workDir   directory the job runs in
 * @param inputFile engine input, already inside {@code workDir}
 * @param jobScript staged submit script, inside {@code workDir}
 * @param settings  resource request
 */
public record SubmitRequest(String jobName, Path workDir, Path inputFile, Path jobScript,
        CalculationSettings settings) {

    public SubmitRequest {
        Objects.requireNonNull(jobName, "jobName is required");
        Objects.requireNonNull(workDir, "workDir is required");
        Objects.requireNonNull(inputFile, "inputFile is required");
        Objects.requireNonNull(jobScript, "jobScript is required");
        Objects.requireNonNull(settings, "settings are required");
    }
}
