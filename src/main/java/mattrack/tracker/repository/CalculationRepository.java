package mattrack.tracker.repository;

import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.StatusUpdate;
import mattrack.tracker.model.TransitionResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for Calculation persistence.
 * All list queries are ordered by creation time, newest first.
 */
public interface CalculationRepository {

    /**
     * Save a new calculation.
     *
     * @param calculation the calculation to save
     */
    void save(Calculation calculation);

    /**
     * Find a calculation by ID.
     *
     * @param calcId the calculation ID
     * @return the calculation if found
     */
    Optional<Calculation> findById(String calcId);

    /**
     * Find the calculation currently bound to an external scheduler job.
     *
     * @param externalJobId scheduler job id
     * @return the calculation if found
     */
    Optional<Calculation> findByExternalJobId(String externalJobId);

    List<Calculation> findByStatus(CalculationStatus status);

    List<Calculation> findByKind(CalculationKind kind);

    List<Calculation> findByMaterial(String materialId);

    List<Calculation> findByMaterialAndKind(String materialId, CalculationKind kind);

    /**
     * Get recent calculations.
     *
     * @param limit maximum results
     * @return list of calculations
     */
    List<Calculation> findRecent(int limit);

    int countByStatus(CalculationStatus status);

    Map<CalculationStatus, Integer> countsByStatus();

    Map<CalculationKind, Integer> countsByKind();

    /**
     * Apply a status transition. This is the only way a calculation's status changes.
     * Validates the transition against {@link CalculationStatus}, checks the prerequisite
     * on submission and stamps the timestamp matching the new status.
     * A move to COMPLETED clears the error type and message left by earlier failed
     * attempts; recovery attempts and completion type are kept.
     *
     * @param update requested transition
     * @return outcome of the compare-and-set
     * @throws mattrack.tracker.model.IllegalTransitionException    when the table forbids the move
     * @throws mattrack.tracker.model.PrerequisiteNotMetException when submitting before the prerequisite completed
     */
    TransitionResult updateStatus(StatusUpdate update);

    /**
     * Record where a calculation's artifacts live. Does not touch status.
     *
     * @return true if updated
     */
    boolean updateArtifacts(String calcId, String workDir, String inputFile, String outputFile, String jobScript);
}
