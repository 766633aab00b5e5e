package mattrack.tracker.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts from one monitor cycle.
 */
public record CycleReport(
        @JsonProperty("mode") TriggerMode mode,
        @JsonProperty("polled") int polled,
        @JsonProperty("started") int started,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("recovered") int recovered,
        @JsonProperty("cancelled") int cancelled,
        @JsonProperty("earlyFailures") int earlyFailures,
        @JsonProperty("created") int created,
        @JsonProperty("submitted") int submitted,
        @JsonProperty("errors") int errors) {

    public boolean changedAnything() {
        return started + completed + failed + recovered + cancelled + earlyFailures + created + submitted > 0;
    }

    /**
     * Mutable tally used while a cycle runs.
     */
    static final class Tally {
        int polled;
        int started;
        int completed;
        int failed;
        int recovered;
        int cancelled;
        int earlyFailures;
        int created;
        int submitted;
        int errors;

        CycleReport toReport(TriggerMode mode) {
            return new CycleReport(mode, polled, started, completed, failed, recovered, cancelled, earlyFailures,
                    created, submitted, errors);
        }
    }
}
