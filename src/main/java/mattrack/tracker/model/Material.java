package mattrack.tracker.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable research subject tracked across calculations.
 */
public final class Material {
    private final String materialId;
    private final String formula;
    private final Integer spaceGroup;
    private final Dimensionality dimensionality;
    private final String sourceType; // cif, d12, manual
    private final String sourceFile;
    private final MaterialStatus status;
    private final Map<String, Object> metadata;
    private final String notes;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Material(Builder builder) {
        this.materialId = Objects.requireNonNull(builder.materialId, "materialId is required");
        this.formula = builder.formula;
        this.spaceGroup = builder.spaceGroup;
        this.dimensionality = builder.dimensionality;
        this.sourceType = builder.sourceType;
        this.sourceFile = builder.sourceFile;
        this.status = builder.status != null ? builder.status : MaterialStatus.ACTIVE;
        this.metadata = builder.metadata != null ? Map.copyOf(builder.metadata) : Map.of();
        this.notes = builder.notes;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String materialId() {
        return materialId;
    }

    public String formula() {
        return formula;
    }

    public Integer spaceGroup() {
        return spaceGroup;
    }

    public Dimensionality dimensionality() {
        return dimensionality;
    }

    public String sourceType() {
        return sourceType;
    }

    public String sourceFile() {
        return sourceFile;
    }

    public MaterialStatus status() {
        return status;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public String notes() {
        return notes;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .materialId(materialId)
                .formula(formula)
                .spaceGroup(spaceGroup)
                .dimensionality(dimensionality)
                .sourceType(sourceType)
                .sourceFile(sourceFile)
                .status(status)
                .metadata(metadata)
                .notes(notes)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String materialId;
        private String formula;
        private Integer spaceGroup;
        private Dimensionality dimensionality;
        private String sourceType;
        private String sourceFile;
        private MaterialStatus status;
        private Map<String, Object> metadata;
        private String notes;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder materialId(String materialId) {
            this.materialId = materialId;
            return this;
        }

        public Builder formula(String formula) {
            this.formula = formula;
            return this;
        }

        public Builder spaceGroup(Integer spaceGroup) {
            this.spaceGroup = spaceGroup;
            return this;
        }

        public Builder dimensionality(Dimensionality dimensionality) {
            this.dimensionality = dimensionality;
            return this;
        }

        public Builder sourceType(String sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder sourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
            return this;
        }

        public Builder status(MaterialStatus status) {
            this.status = status;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Material build() {
            return new Material(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Material material = (Material) o;
        return materialId.equals(material.materialId);
    }

    @Override
    public int hashCode() {
        return materialId.hashCode();
    }

    @Override
    public String toString() {
        return "Material{" +
                "materialId='" + materialId + '\'' +
                ", formula='" + formula + '\'' +
                ", status=" + status +
                '}';
    }
}
