package mattrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Named value extracted for a material, optionally attributed to the calculation that produced it.
 * Either {@code value} or {@code textValue} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Property(
        @JsonProperty("propertyId") Long propertyId,
        @JsonProperty("materialId") String materialId,
        @JsonProperty("calcId") String calcId,
        @JsonProperty("category") String category,
        @JsonProperty("name") String name,
        @JsonProperty("value") Double value,
        @JsonProperty("textValue") String textValue,
        @JsonProperty("unit") String unit,
        @JsonProperty("extractedAt") Instant extractedAt,
        @JsonProperty("extractor") String extractor) {

    public Property {
        Objects.requireNonNull(materialId, "materialId is required");
        Objects.requireNonNull(name, "name is required");
        if (value == null && textValue == null) {
            throw new IllegalArgumentException("property " + name + " needs a numeric or text value");
        }
    }

    public static Property numeric(String materialId, String calcId, String category, String name, double value,
            String unit, String extractor) {
        return new Property(null, materialId, calcId, category, name, value, null, unit, Instant.now(), extractor);
    }

    public static Property text(String materialId, String calcId, String category, String name, String textValue,
            String extractor) {
        return new Property(null, materialId, calcId, category, name, null, textValue, null, Instant.now(), extractor);
    }
}
