package mattrack.tracker.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Progress of a material through its workflow.
 *
 * @param countsByKind       calculations per kind code, any status
 * @param completedKinds     kind codes with at least one completed calculation
 * @param pendingKinds       template kinds not completed yet
 * @param failedCalculations ids of calculations that ended FAILED
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowProgress(
        @JsonProperty("materialId") String materialId,
        @JsonProperty("instanceId") String instanceId,
        @JsonProperty("templateId") String templateId,
        @JsonProperty("status") String status,
        @JsonProperty("countsByKind") Map<String, Integer> countsByKind,
        @JsonProperty("completedKinds") List<String> completedKinds,
        @JsonProperty("pendingKinds") List<String> pendingKinds,
        @JsonProperty("failedCalculations") List<String> failedCalculations) {
}
