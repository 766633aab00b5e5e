package mattrack.tracker.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for operations that change state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("error") String error,
        @JsonProperty("result") String result) {
    /** Success response */
    public static OperationResponse success() {
        return new OperationResponse(true, null, null);
    }

    /** Success with an outcome tag ("applied", "unchanged", "queued"...) */
    public static OperationResponse success(String result) {
        return new OperationResponse(true, null, result);
    }

    /** Error response */
    public static OperationResponse error(String error) {
        return new OperationResponse(false, error, null);
    }

    public static OperationResponse calculationNotFound() {
        return error("calculation_not_found");
    }
}
