package io.dronewatch.ingestion.api.service.fake;

import io.dronewatch.ingestion.api.dto.FakeLayer;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.dto.SourceRef;

import java.time.Instant;

public class SourceCredibilityLayer implements FakeDetectionLayer {

    private final double minAverageTrust;

    public SourceCredibilityLayer(double minAverageTrust) {
        this.minAverageTrust = minAverageTrust;
    }

    @Override
    public FakeLayer layer() {
        return FakeLayer.SOURCE_CREDIBILITY;
    }

    @Override
    public boolean passes(IncidentCandidate candidate, Instant now) {
        if (candidate.sources().isEmpty()) return false;

        double average = candidate.sources().stream()
                .mapToDouble(SourceRef::trustWeight)
                .average()
                .orElse(0.0);
        return average >= minAverageTrust;
    }
}
