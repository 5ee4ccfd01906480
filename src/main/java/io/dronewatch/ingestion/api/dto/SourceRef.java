package io.dronewatch.ingestion.api.dto;

import io.dronewatch.ingestion.api.util.UrlNormalizer;

public record SourceRef(
        String url,
        SourceType sourceType,
        double trustWeight,
        String quote
) {
    public static final double MAX_TRUST = 4.0;

    public SourceRef {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Source url is required");
        }
        if (Double.isNaN(trustWeight) || trustWeight < 0.0 || trustWeight > MAX_TRUST) {
            throw new IllegalArgumentException("Trust weight out of range: " + trustWeight);
        }
        if (sourceType == null) {
            sourceType = SourceType.OTHER;
        }
    }

    public String normalizedUrl() {
        return UrlNormalizer.normalize(url);
    }

    public boolean hasQuote() {
        return quote != null && !quote.isBlank();
    }
}
