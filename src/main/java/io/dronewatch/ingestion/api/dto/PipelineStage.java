package io.dronewatch.ingestion.api.dto;

public enum PipelineStage {
    NORMALIZER,
    GEO_TOPIC_FILTER,
    FAKE_DETECTOR,
    AI_VERIFIER,
    CONSOLIDATION
}
