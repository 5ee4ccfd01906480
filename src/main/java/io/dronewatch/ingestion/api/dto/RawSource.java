package io.dronewatch.ingestion.api.dto;

public record RawSource(
        String url,
        String sourceType,
        Double trustWeight,
        String quote
) {}
