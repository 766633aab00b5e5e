package mattrack.tracker.service;

import mattrack.tracker.batch.BatchScheduler;
import mattrack.tracker.batch.LegacyStatusMirror;
import mattrack.tracker.config.KindDefaults;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationSettings;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.StatusUpdate;
import mattrack.tracker.model.TransitionResult;
import mattrack.tracker.repository.CalculationRepository;
import mattrack.tracker.repository.MaterialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Service layer for calculation operations outside the monitor loop.
 */
public class CalculationService {

    private static final Logger log = LoggerFactory.getLogger(CalculationService.class);

    public static final String CANCELLED_ERROR = "cancelled";

    private final CalculationRepository calculations;
    private final MaterialRepository materials;
    private final BatchScheduler scheduler;
    private final LegacyStatusMirror mirror;

    public CalculationService(CalculationRepository calculations, MaterialRepository materials,
            BatchScheduler scheduler, LegacyStatusMirror mirror) {
        this.calculations = calculations;
        this.materials = materials;
        this.scheduler = scheduler;
        this.mirror = mirror;
    }

    /**
     * Create a PENDING calculation for an existing material.
     *
     * @param prerequisiteCalcId calculation that must complete first, or null
     * @throws IllegalArgumentException if the material or prerequisite does not exist
     */
    public Calculation create(String materialId, CalculationKind kind, String inputFile,
            CalculationSettings settings, String prerequisiteCalcId) {
        if (materials.findById(materialId).isEmpty()) {
            throw new IllegalArgumentException("Material not found: " + materialId);
        }
        if (prerequisiteCalcId != null && calculations.findById(prerequisiteCalcId).isEmpty()) {
            throw new IllegalArgumentException("Prerequisite not found: " + prerequisiteCalcId);
        }
        Calculation calc = Calculation.builder()
                .calcId(Calculation.newId(materialId, kind))
                .materialId(materialId)
                .kind(kind)
                .status(CalculationStatus.PENDING)
                .inputFile(inputFile)
                .settings(KindDefaults.resolve(kind, settings))
                .prerequisiteCalcId(prerequisiteCalcId)
                .createdAt(Instant.now())
                .build();
        calculations.save(calc);
        log.info("Created calculation {}", calc.calcId());
        return calc;
    }

    public Optional<Calculation> findById(String calcId) {
        return calculations.findById(calcId);
    }

    /**
     * Calculations matching every given filter; null filters are ignored. Newest first.
     */
    public List<Calculation> list(CalculationStatus status, CalculationKind kind, String materialId, int limit) {
        Stream<Calculation> source;
        if (materialId != null) {
            source = calculations.findByMaterial(materialId).stream();
        } else if (status != null) {
            source = calculations.findByStatus(status).stream();
        } else if (kind != null) {
            source = calculations.findByKind(kind).stream();
        } else {
            return calculations.findRecent(limit);
        }
        return source
                .filter(c -> status == null || c.status() == status)
                .filter(c -> kind == null || c.kind() == kind)
                .limit(limit)
                .toList();
    }

    /**
     * Cancel a calculation. The scheduler job (if any) is cancelled first; the calculation is
     * marked CANCELLED whether or not the scheduler accepted the request.
     *
     * @throws mattrack.tracker.model.IllegalTransitionException if the calculation already finished
     */
    public TransitionResult cancel(String calcId, String reason) {
        Optional<Calculation> found = calculations.findById(calcId);
        if (found.isEmpty()) {
            return TransitionResult.NOT_FOUND;
        }
        Calculation calc = found.get();
        if (calc.externalJobId() != null && calc.status().isActive()) {
            boolean accepted = scheduler.cancel(calc.externalJobId());
            if (!accepted) {
                log.warn("Scheduler did not accept cancel of job {} for {}", calc.externalJobId(), calcId);
            }
        }
        TransitionResult result = calculations.updateStatus(StatusUpdate.to(calcId, CalculationStatus.CANCELLED)
                .error(CANCELLED_ERROR, reason != null ? reason : "cancelled by user")
                .build());
        if (result == TransitionResult.APPLIED) {
            mirror.remove(calc.externalJobId());
        }
        return result;
    }
}
