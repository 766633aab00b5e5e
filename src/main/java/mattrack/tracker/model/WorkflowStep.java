package mattrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One stage of a workflow template: which kind runs, with which settings, and what follows it.
 * {@code kind}, {@code prerequisites} and {@code nextSteps} hold kind codes ("OPT", "SP", ...).
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record WorkflowStep(
        @JsonProperty("name") String name,
        @JsonProperty("kind") String kind,
        @JsonProperty("settings") CalculationSettings settings,
        @JsonProperty("prerequisites") List<String> prerequisites,
        @JsonProperty("nextSteps") List<String> nextSteps) {

    public WorkflowStep {
        Objects.requireNonNull(kind, "kind is required");
        prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
    }

    @JsonIgnore
    public CalculationKind calculationKind() {
        return CalculationKind.fromCode(kind);
    }

    @JsonIgnore
    public List<CalculationKind> nextKinds() {
        return nextSteps.stream().map(CalculationKind::fromCode).toList();
    }
}
