package io.dronewatch.ingestion.api.service.fake;

import io.dronewatch.ingestion.api.dto.FakeLayer;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;

import java.time.Duration;
import java.time.Instant;

/**
 * Fails reports dated in the future (beyond a small clock-skew tolerance) or older than the staleness window.
 */
public class TemporalConsistencyLayer implements FakeDetectionLayer {

    private final Duration stalenessWindow;
    private final Duration futureTolerance;

    public TemporalConsistencyLayer(Duration stalenessWindow, Duration futureTolerance) {
        this.stalenessWindow = stalenessWindow;
        this.futureTolerance = futureTolerance;
    }

    @Override
    public FakeLayer layer() {
        return FakeLayer.TEMPORAL;
    }

    @Override
    public boolean passes(IncidentCandidate candidate, Instant now) {
        Instant occurredAt = candidate.occurredAt();
        if (occurredAt == null) return false;

        if (occurredAt.isAfter(now.plus(futureTolerance))) {
            return false;
        }
        return !occurredAt.isBefore(now.minus(stalenessWindow));
    }
}
