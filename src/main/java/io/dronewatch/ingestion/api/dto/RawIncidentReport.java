package io.dronewatch.ingestion.api.dto;

import java.util.List;

/**
 * A scraped report as handed over by the external fetchers, before any validation.
 */
public record RawIncidentReport(
        String title,
        String narrative,
        String occurredAt,
        Double latitude,
        Double longitude,
        String assetType,
        String country,
        List<RawSource> sources
) {}
