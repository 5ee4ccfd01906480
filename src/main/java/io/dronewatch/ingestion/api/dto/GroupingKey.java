package io.dronewatch.ingestion.api.dto;

/**
 * Facility identity used to decide whether two reports may describe the same event.
 * Geocoded reports are keyed by rounded coordinate cells; reports without coordinates
 * fall back to a token derived from their text and only match identical re-ingestions.
 */
public record GroupingKey(
        AssetType assetType,
        String country,
        Long latCell,
        Long lonCell,
        String locationToken
) {
    public boolean isLocated() {
        return latCell != null && lonCell != null;
    }

    public String asString() {
        String location = isLocated() ? latCell + "_" + lonCell : "text:" + locationToken;
        return assetType.key() + "|" + (country == null ? "unknown" : country) + "|" + location;
    }
}
