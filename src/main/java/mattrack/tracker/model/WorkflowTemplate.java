package mattrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Named sequence of calculation kinds with dependency edges.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowTemplate(
        @JsonProperty("templateId") String templateId,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("steps") List<WorkflowStep> steps,
        @JsonProperty("createdAt") Instant createdAt) {

    public WorkflowTemplate {
        Objects.requireNonNull(templateId, "templateId is required");
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /** Step that runs the given kind, if the template has one. */
    public Optional<WorkflowStep> stepFor(CalculationKind kind) {
        return steps.stream()
                .filter(s -> s.calculationKind() == kind)
                .findFirst();
    }

    public Optional<WorkflowStep> firstStep() {
        return steps.isEmpty() ? Optional.empty() : Optional.of(steps.get(0));
    }
}
