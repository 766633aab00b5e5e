package mattrack.tracker.monitor;

import mattrack.tracker.batch.BatchScheduler;
import mattrack.tracker.batch.BatchSchedulerException;
import mattrack.tracker.batch.ExternalJobState;
import mattrack.tracker.batch.JobSubmitter;
import mattrack.tracker.batch.LegacyStatusMirror;
import mattrack.tracker.classify.Classification;
import mattrack.tracker.classify.OutputAnalyzer;
import mattrack.tracker.classify.OutputScan;
import mattrack.tracker.classify.ScanStatus;
import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.StatusUpdate;
import mattrack.tracker.model.TransitionResult;
import mattrack.tracker.recovery.RecoveryEngine;
import mattrack.tracker.recovery.RecoveryOutcome;
import mattrack.tracker.repository.CalculationRepository;
import mattrack.tracker.service.FileRecordService;
import mattrack.tracker.service.MaterialService;
import mattrack.tracker.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * One pass of reconciliation between the store and the batch scheduler.
 *
 * <p>Cycles are serialized. Every follow-up action (file records, workflow progression,
 * recovery) runs only for the caller whose status transition was applied, so two overlapping
 * triggers never act on the same completion twice.
 */
public class MonitorLoop {

    private static final Logger log = LoggerFactory.getLogger(MonitorLoop.class);

    static final String INCOMPLETE_OUTPUT = "incomplete_output";

    private final CalculationRepository calculations;
    private final BatchScheduler scheduler;
    private final JobSubmitter submitter;
    private final OutputAnalyzer analyzer;
    private final RecoveryEngine recovery;
    private final WorkflowEngine workflow;
    private final FileRecordService fileRecords;
    private final MaterialService materials;
    private final EarlyFailureDetector earlyFailures;
    private final LegacyStatusMirror mirror;
    private final int maxSubmitPerCycle;
    private final int queueCapacity;

    public MonitorLoop(CalculationRepository calculations, BatchScheduler scheduler, JobSubmitter submitter,
            OutputAnalyzer analyzer, RecoveryEngine recovery, WorkflowEngine workflow,
            FileRecordService fileRecords, MaterialService materials, EarlyFailureDetector earlyFailures,
            LegacyStatusMirror mirror, TrackerConfig config) {
        this.calculations = calculations;
        this.scheduler = scheduler;
        this.submitter = submitter;
        this.analyzer = analyzer;
        this.recovery = recovery;
        this.workflow = workflow;
        this.fileRecords = fileRecords;
        this.materials = materials;
        this.earlyFailures = earlyFailures;
        this.mirror = mirror;
        this.maxSubmitPerCycle = config.maxSubmitPerCycle();
        this.queueCapacity = config.queueCapacity();
    }

    public synchronized CycleReport runCycle(TriggerMode mode) {
        CycleReport.Tally tally = new CycleReport.Tally();
        log.debug("Monitor cycle {} starting", mode);

        if (mode.checksStatus()) {
            checkStatus(tally);
        }
        if (mode.checksEarlyFailure()) {
            tally.earlyFailures += earlyFailures.cancelEarlyFailures();
        }
        if (mode.submitsPending()) {
            submitPending(tally);
        }

        CycleReport report = tally.toReport(mode);
        if (report.changedAnything() || report.errors() > 0) {
            log.info("Monitor cycle {}: {}", mode, report);
        }
        return report;
    }

    private void checkStatus(CycleReport.Tally tally) {
        Map<String, ExternalJobState> queue;
        try {
            queue = scheduler.poll();
        } catch (BatchSchedulerException e) {
            log.warn("Could not poll scheduler, skipping status check: {}", e.getMessage());
            tally.errors++;
            return;
        }
        tally.polled = queue.size();

        List<Calculation> active = new ArrayList<>(calculations.findByStatus(CalculationStatus.SUBMITTED));
        active.addAll(calculations.findByStatus(CalculationStatus.RUNNING));
        for (Calculation calc : active) {
            try {
                reconcile(calc, queue, tally);
            } catch (Exception e) {
                log.error("Failed to reconcile {}", calc.calcId(), e);
                tally.errors++;
            }
        }
    }

    void reconcile(Calculation calc, Map<String, ExternalJobState> queue, CycleReport.Tally tally) {
        String jobId = calc.externalJobId();
        if (jobId == null) {
            log.debug("Calculation {} is {} without a job id", calc.calcId(), calc.status());
            return;
        }
        ExternalJobState state = queue.get(jobId);
        if (state == null) {
            reconcileAbsent(calc, tally);
            return;
        }
        switch (state) {
            case QUEUED -> {
                // Still waiting; nothing to record.
            }
            case RUNNING -> {
                if (calc.status() == CalculationStatus.SUBMITTED) {
                    TransitionResult result = calculations.updateStatus(
                            StatusUpdate.to(calc.calcId(), CalculationStatus.RUNNING)
                                    .expecting(CalculationStatus.SUBMITTED)
                                    .externalState(state.name())
                                    .build());
                    if (result == TransitionResult.APPLIED) {
                        tally.started++;
                    }
                }
            }
            case COMPLETED -> {
                OutputScan scan = analyzer.analyze(OutputFiles.resolve(calc));
                if (scan.isError()) {
                    fail(calc, scan.classification(), state, tally);
                } else {
                    complete(calc, scan, state, tally);
                }
            }
            case FAILED, TIMEOUT -> {
                OutputScan scan = analyzer.analyze(OutputFiles.resolve(calc));
                if (scan.isCompleted()) {
                    complete(calc, scan, state, tally);
                } else {
                    fail(calc, failureFor(scan, state), state, tally);
                }
            }
            case CANCELLED -> {
                TransitionResult result = calculations.updateStatus(
                        StatusUpdate.to(calc.calcId(), CalculationStatus.CANCELLED)
                                .expecting(calc.status())
                                .externalState(state.name())
                                .error("cancelled", "Job cancelled outside the tracker")
                                .build());
                if (result == TransitionResult.APPLIED) {
                    tally.cancelled++;
                    mirror.remove(jobId);
                    calculations.findById(calc.calcId()).ifPresent(fileRecords::recordOutputs);
                }
            }
            default -> log.debug("Job {} of {} in unrecognised state, ignoring", jobId, calc.calcId());
        }
    }

    /**
     * The job left the queue without a final state: decide from the output file.
     */
    private void reconcileAbsent(Calculation calc, CycleReport.Tally tally) {
        Path output = OutputFiles.resolve(calc);
        OutputScan scan = analyzer.analyze(output);
        if (scan.status() == ScanStatus.UNKNOWN) {
            log.debug("Job {} of {} gone, output not readable yet ({}); rechecking later",
                    calc.externalJobId(), calc.calcId(), scan.reason());
            return;
        }
        if (scan.isCompleted()) {
            complete(calc, scan, null, tally);
        } else if (scan.isError()) {
            fail(calc, scan.classification(), null, tally);
        } else {
            Classification incomplete = new Classification(INCOMPLETE_OUTPUT, scan.classification().severity(),
                    false, "Job left the queue before its output completed", List.of(), null, null);
            fail(calc, incomplete, null, tally);
        }
    }

    private Classification failureFor(OutputScan scan, ExternalJobState state) {
        if (scan.isError()) {
            return scan.classification();
        }
        if (state == ExternalJobState.TIMEOUT) {
            return analyzer.classifier().forSchedulerState("time_limit", state.name());
        }
        return Classification.unknown(null);
    }

    private void complete(Calculation calc, OutputScan scan, ExternalJobState state, CycleReport.Tally tally) {
        Path output = OutputFiles.resolve(calc);
        TransitionResult result = calculations.updateStatus(
                StatusUpdate.to(calc.calcId(), CalculationStatus.COMPLETED)
                        .expecting(calc.status())
                        .externalState(state != null ? state.name() : null)
                        .outputFile(output != null ? output.toString() : null)
                        .completionType(scan.completionType())
                        .build());
        if (result != TransitionResult.APPLIED) {
            log.debug("Completion of {} not applied ({})", calc.calcId(), result);
            return;
        }
        tally.completed++;
        mirror.remove(calc.externalJobId());

        Calculation done = calculations.findById(calc.calcId()).orElse(calc);
        fileRecords.recordOutputs(done);
        materials.recordDiagnostics(done, scan.diagnostics());
        List<String> created = workflow.executeWorkflowStep(done.materialId(), done.calcId());
        tally.created += created.size();
    }

    private void fail(Calculation calc, Classification classification, ExternalJobState state,
            CycleReport.Tally tally) {
        String message = classification.isError() ? classification.summary()
                : "Job ended " + (state != null ? state.name() : "unexpectedly") + " without a recognised error";
        TransitionResult result = calculations.updateStatus(
                StatusUpdate.to(calc.calcId(), CalculationStatus.FAILED)
                        .expecting(calc.status())
                        .externalState(state != null ? state.name() : null)
                        .error(classification.kind(), message)
                        .build());
        if (result != TransitionResult.APPLIED) {
            log.debug("Failure of {} not applied ({})", calc.calcId(), result);
            return;
        }
        tally.failed++;
        mirror.remove(calc.externalJobId());
        log.warn("Calculation {} failed: {}", calc.calcId(), message);

        Calculation failed = calculations.findById(calc.calcId()).orElse(calc);
        RecoveryOutcome outcome = recovery.attemptRecovery(failed, classification);
        if (!outcome.resubmit()) {
            fileRecords.recordOutputs(failed);
            workflow.onTerminalFailure(failed);
            return;
        }
        tally.recovered++;
        calculations.findById(calc.calcId())
                .flatMap(submitter::submit)
                .ifPresent(jobId -> tally.submitted++);
    }

    private void submitPending(CycleReport.Tally tally) {
        int active = calculations.countByStatus(CalculationStatus.SUBMITTED)
                + calculations.countByStatus(CalculationStatus.RUNNING);
        int budget = Math.min(maxSubmitPerCycle, queueCapacity - active);
        if (budget <= 0) {
            log.debug("No submission capacity ({} active, capacity {})", active, queueCapacity);
            return;
        }

        List<Calculation> candidates = new ArrayList<>(calculations.findByStatus(CalculationStatus.RESUBMITTED));
        candidates.addAll(calculations.findByStatus(CalculationStatus.PENDING));
        candidates.sort(Comparator.comparingInt(Calculation::priority).reversed()
                .thenComparing(Calculation::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));

        int submitted = 0;
        for (Calculation calc : candidates) {
            if (submitted >= budget) {
                break;
            }
            if (!submitter.prerequisiteMet(calc)) {
                continue;
            }
            try {
                if (submitter.submit(calc).isPresent()) {
                    submitted++;
                }
            } catch (Exception e) {
                log.error("Failed to submit {}", calc.calcId(), e);
                tally.errors++;
            }
        }
        tally.submitted += submitted;
    }
}
