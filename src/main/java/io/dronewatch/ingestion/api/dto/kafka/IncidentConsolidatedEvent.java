package io.dronewatch.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dronewatch.ingestion.api.dto.ConsolidatedIncident;
import io.dronewatch.ingestion.api.dto.SourceRef;

import java.time.Instant;
import java.util.List;

public record IncidentConsolidatedEvent(
        @JsonProperty("incidentId") String incidentId,
        @JsonProperty("contentHash") String contentHash,
        @JsonProperty("merged") boolean merged,
        @JsonProperty("title") String title,
        @JsonProperty("narrative") String narrative,
        @JsonProperty("occurredAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant occurredAt,
        @JsonProperty("lat") Double latitude,
        @JsonProperty("lon") Double longitude,
        @JsonProperty("assetType") String assetType,
        @JsonProperty("country") String country,
        @JsonProperty("sources") List<SourcePayload> sources,
        @JsonProperty("mergedFrom") int mergedFrom,
        @JsonProperty("evidenceScore") int evidenceScore,
        @JsonProperty("aiCategory") String aiCategory,
        @JsonProperty("aiConfidence") Double aiConfidence,
        @JsonProperty("firstSeenAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant firstSeenAt,
        @JsonProperty("lastSeenAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant lastSeenAt
) {
    public static IncidentConsolidatedEvent create(ConsolidatedIncident incident, boolean merged) {
        return new IncidentConsolidatedEvent(
                incident.id(),
                incident.contentHash(),
                merged,
                incident.title(),
                incident.narrative(),
                incident.occurredAt(),
                incident.latitude(),
                incident.longitude(),
                incident.assetType().key(),
                incident.country(),
                incident.sources().stream().map(SourcePayload::from).toList(),
                incident.mergedFrom(),
                incident.evidenceScore(),
                incident.aiCategory() != null ? incident.aiCategory().key() : null,
                incident.aiConfidence(),
                incident.firstSeenAt(),
                incident.lastSeenAt()
        );
    }

    public record SourcePayload(
            @JsonProperty("url") String url,
            @JsonProperty("sourceType") String sourceType,
            @JsonProperty("trustWeight") double trustWeight,
            @JsonProperty("quote") String quote
    ) {
        static SourcePayload from(SourceRef source) {
            return new SourcePayload(source.url(), source.sourceType().key(), source.trustWeight(), source.quote());
        }
    }
}
