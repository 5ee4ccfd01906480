package io.dronewatch.ingestion.config;

public record GeoConfig(
        BoundingBox boundingBox
) {}
