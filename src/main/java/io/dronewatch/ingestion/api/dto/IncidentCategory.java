package io.dronewatch.ingestion.api.dto;

import java.util.Locale;
import java.util.Optional;

public enum IncidentCategory {
    INCIDENT,
    POLICY,
    DEFENSE,
    DISCUSSION;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<IncidentCategory> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();

        try {
            return Optional.of(IncidentCategory.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
