package io.dronewatch.ingestion.api.service.fake;

import io.dronewatch.ingestion.api.dto.FakeLayer;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;

import java.time.Instant;

/**
 * One independent credibility heuristic. Layers must not depend on each other's results.
 */
public interface FakeDetectionLayer {

    FakeLayer layer();

    boolean passes(IncidentCandidate candidate, Instant now);
}
