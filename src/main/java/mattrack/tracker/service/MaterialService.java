package mattrack.tracker.service;

import mattrack.tracker.classify.RuntimeDiagnostics;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.Material;
import mattrack.tracker.model.MaterialStatus;
import mattrack.tracker.model.Property;
import mattrack.tracker.repository.MaterialRepository;
import mattrack.tracker.repository.PropertyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Service layer for materials and their extracted properties.
 */
public class MaterialService {

    private static final Logger log = LoggerFactory.getLogger(MaterialService.class);

    static final String DIAGNOSTICS_CATEGORY = "runtime";
    static final String DIAGNOSTICS_EXTRACTOR = "output_analyzer";

    private final MaterialRepository materials;
    private final PropertyRepository properties;

    public MaterialService(MaterialRepository materials, PropertyRepository properties) {
        this.materials = materials;
        this.properties = properties;
    }

    /**
     * Register a material. Registering an existing id returns the stored material unchanged.
     */
    public Material register(Material material) {
        if (material.materialId().isBlank()) {
            throw new IllegalArgumentException("materialId is required");
        }
        Optional<Material> existing = materials.findById(material.materialId());
        if (existing.isPresent()) {
            log.debug("Material {} already registered", material.materialId());
            return existing.get();
        }
        materials.save(material);
        log.info("Registered material {} ({})", material.materialId(), material.formula());
        return materials.findById(material.materialId()).orElse(material);
    }

    public Optional<Material> findById(String materialId) {
        return materials.findById(materialId);
    }

    public List<Material> list(MaterialStatus status) {
        return status == null ? materials.findAll() : materials.findByStatus(status);
    }

    public boolean setStatus(String materialId, MaterialStatus status) {
        boolean updated = materials.updateStatus(materialId, status);
        if (updated) {
            log.info("Material {} -> {}", materialId, status.dbValue());
        }
        return updated;
    }

    public long addProperty(Property property) {
        return properties.save(property);
    }

    public List<Property> properties(String materialId) {
        return properties.findByMaterial(materialId);
    }

    /**
     * Store the runtime figures of a finished calculation as properties of its material.
     *
     * @return number of properties written
     */
    public int recordDiagnostics(Calculation calc, RuntimeDiagnostics diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            return 0;
        }
        int written = 0;
        if (diagnostics.totalCpuSeconds() != null) {
            written += save(calc, "total_cpu_time", diagnostics.totalCpuSeconds(), "s");
        }
        if (diagnostics.wallSeconds() != null) {
            written += save(calc, "wall_time", diagnostics.wallSeconds(), "s");
        }
        if (diagnostics.scfCycles() != null) {
            written += save(calc, "scf_cycles", diagnostics.scfCycles(), null);
        }
        if (diagnostics.memoryMb() != null) {
            written += save(calc, "memory_used", diagnostics.memoryMb(), "MB");
        }
        materials.touch(calc.materialId());
        return written;
    }

    private int save(Calculation calc, String name, double value, String unit) {
        properties.save(Property.numeric(calc.materialId(), calc.calcId(), DIAGNOSTICS_CATEGORY, name, value, unit,
                DIAGNOSTICS_EXTRACTOR));
        return 1;
    }
}
