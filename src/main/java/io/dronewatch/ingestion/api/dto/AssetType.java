package io.dronewatch.ingestion.api.dto;

import java.util.Locale;

public enum AssetType {
    AIRPORT,
    MILITARY,
    HARBOR,
    POWERPLANT,
    BRIDGE,
    OTHER,
    NONE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a scraped asset type. Unknown or blank values become {@link #OTHER}.
     */
    public static AssetType fromString(String value) {
        if (value == null || value.isBlank()) return OTHER;

        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "AIRPORT", "AIRFIELD" -> AIRPORT;
            case "MILITARY", "BASE", "MILITARY_BASE" -> MILITARY;
            case "HARBOR", "HARBOUR", "PORT" -> HARBOR;
            case "POWERPLANT", "POWER_PLANT", "ENERGY" -> POWERPLANT;
            case "BRIDGE" -> BRIDGE;
            case "NONE" -> NONE;
            default -> OTHER;
        };
    }
}
