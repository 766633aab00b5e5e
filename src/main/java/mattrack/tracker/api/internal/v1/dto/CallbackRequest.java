package mattrack.tracker.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import mattrack.tracker.monitor.TriggerMode;

/**
 * Request DTO sent by job scripts when a job ends.
 * POST /internal/v1/callbacks
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallbackRequest(
        @JsonProperty("mode") String mode,
        @JsonProperty("jobId") String jobId) {

    /** Trigger mode, COMPLETION when omitted. */
    public TriggerMode triggerMode() {
        if (mode == null || mode.isBlank()) {
            return TriggerMode.COMPLETION;
        }
        try {
            return TriggerMode.parse(mode);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown mode: " + mode, e);
        }
    }
}
