package mattrack.tracker.service;

import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.StoreStatistics;
import mattrack.tracker.repository.CalculationRepository;
import mattrack.tracker.repository.FileRecordRepository;
import mattrack.tracker.repository.MaterialRepository;
import mattrack.tracker.repository.PropertyRepository;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts over the store.
 */
public class StatisticsService {

    private final MaterialRepository materials;
    private final CalculationRepository calculations;
    private final PropertyRepository properties;
    private final FileRecordRepository files;

    public StatisticsService(MaterialRepository materials, CalculationRepository calculations,
            PropertyRepository properties, FileRecordRepository files) {
        this.materials = materials;
        this.calculations = calculations;
        this.properties = properties;
        this.files = files;
    }

    public StoreStatistics statistics() {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<CalculationStatus, Integer> e : calculations.countsByStatus().entrySet()) {
            byStatus.put(e.getKey().dbValue(), e.getValue());
            total += e.getValue();
        }
        Map<String, Integer> byKind = new LinkedHashMap<>();
        for (Map.Entry<CalculationKind, Integer> e : calculations.countsByKind().entrySet()) {
            byKind.put(e.getKey().code(), e.getValue());
        }
        return new StoreStatistics(materials.count(), total, byStatus, byKind, properties.count(), files.count());
    }
}
