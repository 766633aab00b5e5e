package mattrack.tracker.repository;

import mattrack.tracker.model.WorkflowInstance;
import mattrack.tracker.model.WorkflowStatus;
import mattrack.tracker.model.WorkflowTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for workflow templates and instances.
 */
public interface WorkflowRepository {

    /**
     * Insert or replace a template.
     *
     * @param template the template
     */
    void saveTemplate(WorkflowTemplate template);

    Optional<WorkflowTemplate> findTemplate(String templateId);

    List<WorkflowTemplate> findAllTemplates();

    /**
     * Save a new instance.
     *
     * @param instance the instance
     */
    void createInstance(WorkflowInstance instance);

    /**
     * The active (or paused) instance for a material, most recent first.
     *
     * @param materialId the material ID
     * @return the instance if one is open
     */
    Optional<WorkflowInstance> findOpenInstance(String materialId);

    List<WorkflowInstance> findInstances(String materialId);

    /**
     * Update status and cursor. Sets {@code completed_at} for COMPLETED and FAILED.
     *
     * @return true if updated
     */
    boolean updateInstance(String instanceId, WorkflowStatus status, String currentStep);
}
