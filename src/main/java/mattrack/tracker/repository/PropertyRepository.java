package mattrack.tracker.repository;

import mattrack.tracker.model.Property;

import java.util.List;

/**
 * Append-only store of extracted properties.
 */
public interface PropertyRepository {

    /**
     * Append a property.
     *
     * @return generated property id
     */
    long save(Property property);

    List<Property> findByMaterial(String materialId);

    List<Property> findByCalculation(String calcId);

    int count();
}
