package mattrack.tracker.batch;

import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.model.CalculationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link BatchScheduler} for SLURM: {@code sbatch}, {@code squeue} and {@code scancel}.
 */
public class SlurmBatchScheduler implements BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(SlurmBatchScheduler.class);

    static final String SUBMITTED_PREFIX = "Submitted batch job ";

    private final CommandRunner runner;
    private final String sbatch;
    private final String squeue;
    private final String scancel;
    private final String user;

    public SlurmBatchScheduler(TrackerConfig config, CommandRunner runner) {
        this.runner = runner;
        this.sbatch = config.sbatchCommand();
        this.squeue = config.squeueCommand();
        this.scancel = config.scancelCommand();
        this.user = config.schedulerUser();
    }

    @Override
    public String submit(SubmitRequest request) throws BatchSchedulerException {
        List<String> command = submitCommand(request);
        CommandResult result;
        try {
            result = runner.run(command, request.workDir());
        } catch (IOException e) {
            throw new BatchSchedulerException("sbatch failed for " + request.jobName() + ": " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new BatchSchedulerException("sbatch exited with " + result.exitCode() + " for "
                    + request.jobName() + ": " + result.output().trim());
        }
        String jobId = parseJobId(result.output());
        if (jobId == null) {
            throw new BatchSchedulerException("Could not read job id from sbatch output: " + result.output().trim());
        }
        log.info("Submitted {} as job {}", request.jobName(), jobId);
        return jobId;
    }

    List<String> submitCommand(SubmitRequest request) {
        CalculationSettings settings = request.settings();
        List<String> command = new ArrayList<>();
        command.add(sbatch);
        command.add("--job-name=" + request.jobName());
        command.add("--chdir=" + request.workDir().toAbsolutePath());
        if (settings.memoryGb() > 0) {
            command.add("--mem=" + settings.memoryGb() + "G");
        }
        if (settings.walltimeHours() > 0) {
            command.add("--time=" + settings.slurmWalltime());
        }
        if (settings.cores() > 0) {
            command.add("--ntasks=" + settings.cores());
        }
        command.add(request.jobScript().toAbsolutePath().toString());
        command.add(request.inputFile().getFileName().toString());
        return command;
    }

    static String parseJobId(String output) {
        for (String line : output.split("\\R")) {
            int idx = line.indexOf(SUBMITTED_PREFIX);
            if (idx >= 0) {
                String rest = line.substring(idx + SUBMITTED_PREFIX.length()).trim();
                String id = rest.split("\\s+")[0];
                if (!id.isEmpty()) {
                    return id;
                }
            }
        }
        return null;
    }

    @Override
    public Map<String, ExternalJobState> poll() throws BatchSchedulerException {
        CommandResult result;
        try {
            result = runner.run(List.of(squeue, "-u", user, "-h", "-o", "%i,%T"), null);
        } catch (IOException e) {
            throw new BatchSchedulerException("squeue failed: " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new BatchSchedulerException("squeue exited with " + result.exitCode() + ": " + result.output().trim());
        }
        return parseQueue(result.output());
    }

    static Map<String, ExternalJobState> parseQueue(String output) {
        Map<String, ExternalJobState> jobs = new LinkedHashMap<>();
        for (String line : output.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split(",", 2);
            if (parts.length < 2) {
                log.debug("Ignoring squeue line: {}", trimmed);
                continue;
            }
            jobs.put(parts[0].trim(), ExternalJobState.fromSlurm(parts[1]));
        }
        return jobs;
    }

    @Override
    public boolean cancel(String jobId) {
        try {
            CommandResult result = runner.run(List.of(scancel, jobId), null);
            if (!result.isSuccess()) {
                log.warn("scancel {} exited with {}: {}", jobId, result.exitCode(), result.output().trim());
                return false;
            }
            log.info("Cancelled job {}", jobId);
            return true;
        } catch (IOException e) {
            log.warn("scancel {} failed: {}", jobId, e.getMessage());
            return false;
        }
    }
}
