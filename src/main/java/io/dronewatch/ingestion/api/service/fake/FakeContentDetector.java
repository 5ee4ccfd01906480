package io.dronewatch.ingestion.api.service.fake;

import io.dronewatch.ingestion.api.dto.DetectionVerdict;
import io.dronewatch.ingestion.api.dto.FakeLayer;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.config.FakeDetectionConfig;
import io.dronewatch.ingestion.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Runs every credibility layer against a candidate. A single failed layer marks the candidate
 * as fake; all failures are reported so the rejection can be audited.
 */
@Service
public class FakeContentDetector {

    private static final Logger logger = LoggerFactory.getLogger(FakeContentDetector.class);

    private final List<FakeDetectionLayer> layers;

    public FakeContentDetector(PipelineConfig config) {
        this(defaultLayers(config.fake()));
    }

    FakeContentDetector(List<FakeDetectionLayer> layers) {
        this.layers = List.copyOf(layers);
    }

    public DetectionVerdict detect(IncidentCandidate candidate, Instant now) {
        Set<FakeLayer> failed = EnumSet.noneOf(FakeLayer.class);

        for (FakeDetectionLayer layer : layers) {
            if (!layer.passes(candidate, now)) {
                failed.add(layer.layer());
            }
        }

        if (!failed.isEmpty()) {
            logger.debug("Fake layers failed for '{}': {}", candidate.title(), failed);
        }
        return DetectionVerdict.of(failed);
    }

    static List<FakeDetectionLayer> defaultLayers(FakeDetectionConfig fake) {
        List<String> blacklist = fake != null && fake.blacklistedDomains() != null ? fake.blacklistedDomains() : List.of();
        Duration staleness = fake != null && fake.stalenessWindow() != null ? fake.stalenessWindow() : Duration.ofDays(30);
        Duration tolerance = fake != null && fake.futureTolerance() != null ? fake.futureTolerance() : Duration.ofHours(1);
        double minTrust = fake != null ? fake.minAverageTrust() : 0.3;

        return List.of(
                new DomainBlacklistLayer(blacklist),
                new SatireKeywordLayer(),
                new ClickbaitLayer(),
                new ConspiracyLayer(),
                new TemporalConsistencyLayer(staleness, tolerance),
                new SourceCredibilityLayer(minTrust)
        );
    }
}
