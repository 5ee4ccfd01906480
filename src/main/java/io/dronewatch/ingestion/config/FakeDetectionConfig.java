package io.dronewatch.ingestion.config;

import java.time.Duration;
import java.util.List;

public record FakeDetectionConfig(
        List<String> blacklistedDomains,
        Duration stalenessWindow,
        Duration futureTolerance,
        double minAverageTrust
) {}
