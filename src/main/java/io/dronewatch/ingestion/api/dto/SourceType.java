package io.dronewatch.ingestion.api.dto;

import java.util.Locale;

public enum SourceType {
    POLICE,
    NOTAM,
    MILITARY,
    AVIATION_AUTHORITY,
    OFFICIAL_STATEMENT,
    WIRE_SERVICE,
    VERIFIED_MEDIA,
    MEDIA,
    SOCIAL,
    OTHER;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SourceType fromString(String value) {
        if (value == null || value.isBlank()) return OTHER;

        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "POLICE" -> POLICE;
            case "NOTAM" -> NOTAM;
            case "MILITARY", "DEFENCE", "DEFENSE" -> MILITARY;
            case "AVIATION_AUTHORITY", "AVIATION" -> AVIATION_AUTHORITY;
            case "OFFICIAL_STATEMENT", "OFFICIAL", "GOVERNMENT" -> OFFICIAL_STATEMENT;
            case "WIRE_SERVICE", "WIRE" -> WIRE_SERVICE;
            case "VERIFIED_MEDIA" -> VERIFIED_MEDIA;
            case "MEDIA", "NEWS" -> MEDIA;
            case "SOCIAL", "SOCIAL_MEDIA", "TWITTER", "X" -> SOCIAL;
            default -> OTHER;
        };
    }
}
