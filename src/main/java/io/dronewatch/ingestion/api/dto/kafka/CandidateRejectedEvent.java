package io.dronewatch.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CandidateRejectedEvent(
        @JsonProperty("rejectionId") String rejectionId,
        @JsonProperty("batchId") String batchId,
        @JsonProperty("title") String title,
        @JsonProperty("stage") String stage,
        @JsonProperty("reason") String reason,
        @JsonProperty("rejectedAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant rejectedAt
) {
    public static CandidateRejectedEvent create(String batchId, String title, String stage,
                                                String reason, Instant rejectedAt) {
        return new CandidateRejectedEvent(
                "REJ-" + java.util.UUID.randomUUID().toString().substring(0, 8),
                batchId, title, stage, reason, rejectedAt
        );
    }
}
