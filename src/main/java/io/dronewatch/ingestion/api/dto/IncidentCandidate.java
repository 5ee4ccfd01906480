package io.dronewatch.ingestion.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * A normalized, not yet consolidated report. Coordinates are either both present or both absent.
 */
public record IncidentCandidate(
        String title,
        String narrative,
        Instant occurredAt,
        Double latitude,
        Double longitude,
        AssetType assetType,
        String country,
        List<SourceRef> sources,
        Instant ingestedAt
) {
    public IncidentCandidate {
        if ((latitude == null) != (longitude == null)) {
            throw new IllegalArgumentException("Latitude and longitude must both be present or both absent");
        }
        narrative = narrative == null ? "" : narrative;
        assetType = assetType == null ? AssetType.OTHER : assetType;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public boolean hasCoordinates() {
        return latitude != null;
    }

    public SourceRef primarySource() {
        return sources.isEmpty() ? null : sources.get(0);
    }

    public String fullText() {
        return (title + " " + narrative).trim();
    }
}
