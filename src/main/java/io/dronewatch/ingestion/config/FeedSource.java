package io.dronewatch.ingestion.config;

import io.dronewatch.ingestion.api.dto.AssetType;
import io.dronewatch.ingestion.api.dto.SourceType;

/**
 * Describes a feed whose entries are handed to the pipeline by an external fetcher.
 */
public record FeedSource(
        String url,
        String name,
        SourceType sourceType,
        String country,
        AssetType defaultAssetType,
        boolean enabled
) {
    public String getSimpleName() {
        return name != null && !name.isBlank() ? name : url;
    }
}
