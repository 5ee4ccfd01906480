package io.dronewatch.ingestion.api.dto;

public record Rejection(
        String title,
        PipelineStage stage,
        String reason
) {}
