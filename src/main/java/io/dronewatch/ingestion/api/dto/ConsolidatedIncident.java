package io.dronewatch.ingestion.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * The durable aggregate of one or more candidates. Only the consolidation engine creates
 * new versions of it; the id and content hash never change once assigned.
 */
public record ConsolidatedIncident(
        String id,
        String contentHash,
        GroupingKey groupingKey,
        String title,
        String narrative,
        Instant occurredAt,
        Double latitude,
        Double longitude,
        AssetType assetType,
        String country,
        List<SourceRef> sources,
        int mergedFrom,
        int evidenceScore,
        IncidentCategory aiCategory,
        Double aiConfidence,
        Instant firstSeenAt,
        Instant lastSeenAt
) {
    public ConsolidatedIncident {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public int sourceCount() {
        return sources.size();
    }

    public SourceType primarySourceType() {
        return sources.isEmpty() ? SourceType.OTHER : sources.get(0).sourceType();
    }
}
