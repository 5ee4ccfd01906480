package io.dronewatch.ingestion.api.util;

import java.text.Normalizer;
import java.util.Locale;

public final class TextCleaner {

    private TextCleaner() {
    }

    public static String clean(String text) {
        if (text == null) return "";

        return text
                .replaceAll("<[^>]+>", " ")          // Remove HTML tags
                .replaceAll("&[a-zA-Z0-9#]+;", " ")  // Remove HTML entities
                .replaceAll("\\s+", " ")             // Normalize whitespace
                .trim();
    }

    /**
     * Lower-cased, accent-preserving form with punctuation collapsed, used for cache keys
     * so that near-identical headlines hash the same.
     */
    public static String canonical(String text) {
        if (text == null) return "";

        String normalized = Normalizer.normalize(clean(text), Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        return normalized
                .replaceAll("[\\p{Punct}\\p{IsPunctuation}]+", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
