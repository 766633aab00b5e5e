package mattrack.tracker.workflow;

import mattrack.tracker.batch.JobSubmitter;
import mattrack.tracker.config.KindDefaults;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationSettings;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.WorkflowInstance;
import mattrack.tracker.model.WorkflowStatus;
import mattrack.tracker.model.WorkflowStep;
import mattrack.tracker.model.WorkflowTemplate;
import mattrack.tracker.repository.CalculationRepository;
import mattrack.tracker.repository.MaterialRepository;
import mattrack.tracker.repository.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Advances a material through its workflow template when a calculation completes.
 *
 * <p>Progression is idempotent: a downstream kind is only generated when the material has no
 * live or completed calculation of that kind yet.
 */
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final CalculationRepository calculations;
    private final MaterialRepository materials;
    private final WorkflowRepository workflows;
    private final InputGenerator inputGenerator;
    private final Path baseWorkDir;
    private final String defaultTemplateId;

    public WorkflowEngine(CalculationRepository calculations, MaterialRepository materials,
            WorkflowRepository workflows, InputGenerator inputGenerator, Path baseWorkDir, String defaultTemplateId) {
        this.calculations = calculations;
        this.materials = materials;
        this.workflows = workflows;
        this.inputGenerator = inputGenerator;
        this.baseWorkDir = baseWorkDir;
        this.defaultTemplateId = defaultTemplateId;
    }

    /**
     * Bind a template to a material and create its first calculation.
     *
     * @param inputFile engine input for the first step
     * @return id of the first calculation
     * @throws IllegalArgumentException if the material or template does not exist, or the template is empty
     * @throws IllegalStateException    if the material already has an open workflow
     */
    public synchronized String startWorkflow(String materialId, String templateId, Path inputFile) {
        if (materials.findById(materialId).isEmpty()) {
            throw new IllegalArgumentException("Material not found: " + materialId);
        }
        String id = templateId != null ? templateId : defaultTemplateId;
        WorkflowTemplate template = workflows.findTemplate(id)
                .orElseThrow(() -> new IllegalArgumentException("Workflow template not found: " + id));
        WorkflowStep first = template.firstStep()
                .orElseThrow(() -> new IllegalArgumentException("Workflow template has no steps: " + id));
        if (workflows.findOpenInstance(materialId).isPresent()) {
            throw new IllegalStateException("Material " + materialId + " already has an open workflow");
        }

        workflows.createInstance(WorkflowInstance.start(materialId, id, first.name()));
        Calculation calc = newCalculation(materialId, first, inputFile, null);
        calculations.save(calc);
        log.info("Started workflow {} for {} with {}", id, materialId, calc.calcId());
        return calc.calcId();
    }

    /**
     * Generate the calculations that follow a completed one.
     *
     * @param materialId      material the calculation belongs to
     * @param completedCalcId the calculation that just completed
     * @return ids of newly created PENDING calculations; empty when nothing follows or all exist
     */
    public synchronized List<String> executeWorkflowStep(String materialId, String completedCalcId) {
        Optional<Calculation> found = calculations.findById(completedCalcId);
        if (found.isEmpty() || found.get().status() != CalculationStatus.COMPLETED) {
            log.debug("Calculation {} is not completed, no workflow step", completedCalcId);
            return List.of();
        }
        Calculation completed = found.get();

        WorkflowInstance instance = openOrDefaultInstance(materialId, completed.kind());
        if (instance == null) {
            return List.of();
        }
        if (instance.status() == WorkflowStatus.PAUSED) {
            log.info("Workflow {} for {} is paused, not advancing past {}",
                    instance.instanceId(), materialId, completed.kind().code());
            return List.of();
        }
        Optional<WorkflowTemplate> template = workflows.findTemplate(instance.templateId());
        if (template.isEmpty()) {
            log.warn("Workflow {} refers to missing template {}", instance.instanceId(), instance.templateId());
            return List.of();
        }
        Optional<WorkflowStep> step = template.get().stepFor(completed.kind());
        if (step.isEmpty()) {
            log.debug("Template {} has no step for {}", instance.templateId(), completed.kind().code());
            return List.of();
        }

        List<CalculationKind> next = step.get().nextKinds();
        if (next.isEmpty()) {
            completeIfSettled(instance, step.get());
            return List.of();
        }

        List<String> created = new ArrayList<>();
        String cursor = null;
        for (CalculationKind kind : next) {
            if (hasLiveOrCompleted(materialId, kind)) {
                log.debug("{} already has a {} calculation, skipping", materialId, kind.code());
                continue;
            }
            WorkflowStep target = template.get().stepFor(kind)
                    .orElse(new WorkflowStep(kind.name().toLowerCase(), kind.code(), null, null, null));
            Path dir = JobSubmitter.workDirFor(baseWorkDir, kind, materialId);
            Path input;
            try {
                Files.createDirectories(dir);
                input = inputGenerator.generate(completed, kind, dir);
            } catch (InputGenerationException | IOException e) {
                log.warn("Skipping {} for {}: {}", kind.code(), materialId, e.getMessage());
                continue;
            }
            Calculation calc = newCalculation(materialId, target, input, completedCalcId);
            calculations.save(calc);
            created.add(calc.calcId());
            if (cursor == null) {
                cursor = target.name();
            }
            log.info("Workflow {} created {} ({} after {})", instance.instanceId(), calc.calcId(), kind.code(),
                    completed.kind().code());
        }
        if (cursor != null) {
            workflows.updateInstance(instance.instanceId(), WorkflowStatus.ACTIVE, cursor);
        }
        return created;
    }

    /**
     * Mark the material's workflow FAILED when a calculation of one of its steps failed for good.
     *
     * @return true if an instance was failed
     */
    public synchronized boolean onTerminalFailure(Calculation failed) {
        Optional<WorkflowInstance> instance = workflows.findOpenInstance(failed.materialId());
        if (instance.isEmpty()) {
            return false;
        }
        boolean required = workflows.findTemplate(instance.get().templateId())
                .flatMap(t -> t.stepFor(failed.kind()))
                .isPresent();
        if (!required) {
            return false;
        }
        log.warn("Workflow {} for {} failed at {} ({})", instance.get().instanceId(), failed.materialId(),
                failed.kind().code(), failed.calcId());
        return workflows.updateInstance(instance.get().instanceId(), WorkflowStatus.FAILED,
                instance.get().currentStep());
    }

    public synchronized boolean pause(String materialId) {
        return workflows.findOpenInstance(materialId)
                .filter(i -> i.status() == WorkflowStatus.ACTIVE)
                .map(i -> workflows.updateInstance(i.instanceId(), WorkflowStatus.PAUSED, i.currentStep()))
                .orElse(false);
    }

    public synchronized boolean resume(String materialId) {
        return workflows.findOpenInstance(materialId)
                .filter(i -> i.status() == WorkflowStatus.PAUSED)
                .map(i -> workflows.updateInstance(i.instanceId(), WorkflowStatus.ACTIVE, i.currentStep()))
                .orElse(false);
    }

    /**
     * Summary of a material's progress. Works without a workflow instance, in which case
     * pending kinds are taken from the default template.
     */
    public WorkflowProgress workflowStatus(String materialId) {
        List<Calculation> calcs = calculations.findByMaterial(materialId);
        List<WorkflowInstance> instances = workflows.findInstances(materialId);
        WorkflowInstance instance = instances.isEmpty() ? null : instances.get(0);
        String templateId = instance != null ? instance.templateId() : defaultTemplateId;

        Map<String, Integer> counts = new LinkedHashMap<>();
        Set<String> completedKinds = new LinkedHashSet<>();
        List<String> failed = new ArrayList<>();
        for (Calculation calc : calcs) {
            counts.merge(calc.kind().code(), 1, Integer::sum);
            if (calc.status() == CalculationStatus.COMPLETED) {
                completedKinds.add(calc.kind().code());
            } else if (calc.status() == CalculationStatus.FAILED) {
                failed.add(calc.calcId());
            }
        }

        List<String> pendingKinds = new ArrayList<>();
        workflows.findTemplate(templateId).ifPresent(t -> t.steps().stream()
                .map(WorkflowStep::kind)
                .filter(code -> !completedKinds.contains(code))
                .forEach(pendingKinds::add));

        return new WorkflowProgress(materialId,
                instance != null ? instance.instanceId() : null,
                templateId,
                instance != null ? instance.status().dbValue() : null,
                counts,
                List.copyOf(completedKinds),
                pendingKinds,
                failed);
    }

    private WorkflowInstance openOrDefaultInstance(String materialId, CalculationKind completedKind) {
        Optional<WorkflowInstance> open = workflows.findOpenInstance(materialId);
        if (open.isPresent()) {
            return open.get();
        }
        if (!workflows.findInstances(materialId).isEmpty()) {
            // Finished or failed workflows are not restarted by late completions.
            log.debug("No open workflow for {}", materialId);
            return null;
        }
        Optional<WorkflowTemplate> template = workflows.findTemplate(defaultTemplateId);
        if (template.isEmpty()) {
            log.warn("Default workflow template {} not found", defaultTemplateId);
            return null;
        }
        String stepName = template.get().stepFor(completedKind).map(WorkflowStep::name).orElse(null);
        WorkflowInstance instance = WorkflowInstance.start(materialId, defaultTemplateId, stepName);
        workflows.createInstance(instance);
        log.info("Bound {} to default workflow {}", materialId, defaultTemplateId);
        return instance;
    }

    private boolean hasLiveOrCompleted(String materialId, CalculationKind kind) {
        return calculations.findByMaterialAndKind(materialId, kind).stream()
                .anyMatch(c -> c.status() != CalculationStatus.FAILED && c.status() != CalculationStatus.CANCELLED);
    }

    private void completeIfSettled(WorkflowInstance instance, WorkflowStep step) {
        boolean open = calculations.findByMaterial(instance.materialId()).stream()
                .anyMatch(c -> !c.status().isTerminal() && c.status() != CalculationStatus.FAILED);
        if (open) {
            workflows.updateInstance(instance.instanceId(), instance.status(), step.name());
            return;
        }
        workflows.updateInstance(instance.instanceId(), WorkflowStatus.COMPLETED, step.name());
        log.info("Workflow {} for {} completed", instance.instanceId(), instance.materialId());
    }

    private Calculation newCalculation(String materialId, WorkflowStep step, Path inputFile, String prerequisite) {
        CalculationKind kind = step.calculationKind();
        CalculationSettings settings = KindDefaults.resolve(kind, step.settings());
        return Calculation.builder()
                .calcId(Calculation.newId(materialId, kind))
                .materialId(materialId)
                .kind(kind)
                .status(CalculationStatus.PENDING)
                .inputFile(inputFile != null ? inputFile.toString() : null)
                .settings(settings)
                .prerequisiteCalcId(prerequisite)
                .createdAt(Instant.now())
                .build();
    }
}
