package mattrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Counts over the calculation store.
 */
public record StoreStatistics(
        @JsonProperty("materials") int materials,
        @JsonProperty("calculations") int calculations,
        @JsonProperty("byStatus") Map<String, Integer> byStatus,
        @JsonProperty("byKind") Map<String, Integer> byKind,
        @JsonProperty("properties") int properties,
        @JsonProperty("files") int files) {
}
