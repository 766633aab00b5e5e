package mattrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * File produced or consumed by a calculation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileRecord(
        @JsonProperty("fileId") Long fileId,
        @JsonProperty("calcId") String calcId,
        @JsonProperty("fileType") FileType fileType,
        @JsonProperty("fileName") String fileName,
        @JsonProperty("filePath") String filePath,
        @JsonProperty("fileSize") long fileSize,
        @JsonProperty("checksum") String checksum,
        @JsonProperty("createdAt") Instant createdAt) {
}
