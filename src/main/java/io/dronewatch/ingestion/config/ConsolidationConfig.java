package io.dronewatch.ingestion.config;

import java.time.Duration;

public record ConsolidationConfig(
        double roundPrecisionDegrees,
        Duration mergeWindow,
        int maxConflictRetries
) {}
