package mattrack.tracker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationSettings;

import java.time.Instant;

/**
 * Response DTO for calculation details.
 * GET /api/v1/calculations/{calcId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalculationResponse(
        @JsonProperty("calcId") String calcId,
        @JsonProperty("materialId") String materialId,
        @JsonProperty("kind") String kind,
        @JsonProperty("status") String status,
        @JsonProperty("priority") int priority,
        @JsonProperty("externalJobId") String externalJobId,
        @JsonProperty("externalState") String externalState,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("submittedAt") Instant submittedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("inputFile") String inputFile,
        @JsonProperty("outputFile") String outputFile,
        @JsonProperty("workDir") String workDir,
        @JsonProperty("settings") CalculationSettings settings,
        @JsonProperty("exitCode") Integer exitCode,
        @JsonProperty("errorType") String errorType,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("recoveryAttempts") int recoveryAttempts,
        @JsonProperty("completionType") String completionType,
        @JsonProperty("prerequisiteCalcId") String prerequisiteCalcId) {

    /** Create response from domain model */
    public static CalculationResponse from(Calculation calc) {
        return new CalculationResponse(
                calc.calcId(),
                calc.materialId(),
                calc.kind().code(),
                calc.status().dbValue(),
                calc.priority(),
                calc.externalJobId(),
                calc.externalState(),
                calc.createdAt(),
                calc.submittedAt(),
                calc.startedAt(),
                calc.completedAt(),
                calc.inputFile(),
                calc.outputFile(),
                calc.workDir(),
                calc.settings(),
                calc.exitCode(),
                calc.errorType(),
                calc.errorMessage(),
                calc.recoveryAttempts(),
                calc.completionType(),
                calc.prerequisiteCalcId());
    }
}
