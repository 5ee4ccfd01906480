package io.dronewatch.ingestion.api.dto;

public record FilterVerdict(
        boolean pass,
        String reason
) {
    public static FilterVerdict accept(String reason) {
        return new FilterVerdict(true, reason);
    }

    public static FilterVerdict reject(String reason) {
        return new FilterVerdict(false, reason);
    }
}
