package io.dronewatch.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dronewatch.ingestion.api.dto.BatchResult;

import java.time.Instant;

public record BatchProcessedEvent(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("source") String source,
        @JsonProperty("received") int received,
        @JsonProperty("rejected") int rejected,
        @JsonProperty("created") long created,
        @JsonProperty("merged") long merged,
        @JsonProperty("completed") boolean completed,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("processedAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant processedAt
) {
    public static BatchProcessedEvent create(String source, BatchResult result) {
        return new BatchProcessedEvent(
                result.batchId(),
                source,
                result.received(),
                result.rejections().size(),
                result.created(),
                result.merged(),
                result.completed(),
                result.durationMs(),
                result.startedAt().plusMillis(result.durationMs())
        );
    }
}
