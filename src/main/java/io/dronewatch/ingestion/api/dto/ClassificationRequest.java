package io.dronewatch.ingestion.api.dto;

public record ClassificationRequest(
        String title,
        String narrative,
        String locationHint
) {}
