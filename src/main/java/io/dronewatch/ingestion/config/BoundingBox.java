package io.dronewatch.ingestion.config;

public record BoundingBox(
        double minLat,
        double maxLat,
        double minLon,
        double maxLon
) {
    public static BoundingBox europe() {
        return new BoundingBox(35.0, 71.0, -10.0, 31.0);
    }

    // edges are inclusive
    public boolean contains(double lat, double lon) {
        return lat >= minLat && lat <= maxLat && lon >= minLon && lon <= maxLon;
    }
}
