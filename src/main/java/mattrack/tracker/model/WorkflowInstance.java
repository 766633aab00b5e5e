package mattrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * A workflow template bound to one material.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowInstance(
        @JsonProperty("instanceId") String instanceId,
        @JsonProperty("materialId") String materialId,
        @JsonProperty("templateId") String templateId,
        @JsonProperty("status") WorkflowStatus status,
        @JsonProperty("currentStep") String currentStep,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt) {

    public static WorkflowInstance start(String materialId, String templateId, String firstStep) {
        return new WorkflowInstance("wf-" + UUID.randomUUID(), materialId, templateId, WorkflowStatus.ACTIVE,
                firstStep, Instant.now(), null);
    }
}
