package io.dronewatch.ingestion.api.dto;

import java.util.Set;

public record DetectionVerdict(
        boolean isFake,
        Set<FakeLayer> failedLayers
) {
    public DetectionVerdict {
        failedLayers = Set.copyOf(failedLayers);
    }

    public static DetectionVerdict of(Set<FakeLayer> failedLayers) {
        return new DetectionVerdict(!failedLayers.isEmpty(), failedLayers);
    }
}
