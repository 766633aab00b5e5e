package mattrack.tracker.repository;

import mattrack.tracker.model.Material;
import mattrack.tracker.model.MaterialStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Material persistence.
 */
public interface MaterialRepository {

    /**
     * Save a new material.
     *
     * @param material the material to save
     */
    void save(Material material);

    /**
     * Find a material by ID.
     *
     * @param materialId the material ID
     * @return the material if found
     */
    Optional<Material> findById(String materialId);

    /**
     * Get all materials, newest first.
     *
     * @return list of all materials
     */
    List<Material> findAll();

    /**
     * Get materials by lifecycle status, newest first.
     *
     * @param status the status filter
     * @return list of materials
     */
    List<Material> findByStatus(MaterialStatus status);

    /**
     * Change lifecycle status (archive instead of delete).
     *
     * @param materialId the material ID
     * @param status     the new status
     * @return true if updated
     */
    boolean updateStatus(String materialId, MaterialStatus status);

    /**
     * Bump {@code updated_at} to now.
     *
     * @param materialId the material ID
     */
    void touch(String materialId);

    int count();
}
