package io.dronewatch.ingestion.api.util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Whole-word, case-insensitive matching of a keyword vocabulary against free text.
 */
public final class KeywordMatcher {

    private final List<Entry> entries;

    private KeywordMatcher(List<Entry> entries) {
        this.entries = entries;
    }

    public static KeywordMatcher of(Collection<String> keywords) {
        return new KeywordMatcher(keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.toLowerCase(Locale.ROOT).trim())
                .distinct()
                .map(k -> new Entry(k, Pattern.compile(
                        "(?<![\\p{L}\\p{N}])" + Pattern.quote(k) + "(?![\\p{L}\\p{N}])",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)))
                .toList());
    }

    public Set<String> findIn(String text) {
        if (text == null || text.isBlank()) return Set.of();

        Set<String> found = new LinkedHashSet<>();
        for (Entry entry : entries) {
            if (entry.pattern().matcher(text).find()) {
                found.add(entry.keyword());
            }
        }
        return found;
    }

    public boolean matches(String text) {
        if (text == null || text.isBlank()) return false;

        return entries.stream().anyMatch(entry -> entry.pattern().matcher(text).find());
    }

    private record Entry(String keyword, Pattern pattern) {}
}
