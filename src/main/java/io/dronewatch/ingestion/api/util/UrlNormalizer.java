package io.dronewatch.ingestion.api.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Canonical form of source links, so that re-scraped or tracking-decorated URLs compare equal.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        if (url == null) return "";

        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getHost() == null) {
                return stripTrailingSlash(trimmed.toLowerCase(Locale.ROOT));
            }

            String host = stripWww(uri.getHost().toLowerCase(Locale.ROOT));
            String path = uri.getRawPath() == null ? "" : stripTrailingSlash(uri.getRawPath());
            String query = filterQuery(uri.getRawQuery());

            StringBuilder normalized = new StringBuilder(host);
            if (uri.getPort() != -1 && uri.getPort() != 80 && uri.getPort() != 443) {
                normalized.append(':').append(uri.getPort());
            }
            normalized.append(path);
            if (!query.isEmpty()) {
                normalized.append('?').append(query);
            }
            return normalized.toString();

        } catch (URISyntaxException e) {
            return stripTrailingSlash(trimmed.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Host without "www." followed by the path, used for blacklist prefix matching.
     */
    public static String hostAndPath(String url) {
        if (url == null) return "";

        try {
            URI uri = new URI(url.trim());
            if (uri.getHost() == null) return url.trim().toLowerCase(Locale.ROOT);

            String path = uri.getRawPath() == null ? "" : uri.getRawPath().toLowerCase(Locale.ROOT);
            return stripWww(uri.getHost().toLowerCase(Locale.ROOT)) + path;
        } catch (URISyntaxException e) {
            return url.trim().toLowerCase(Locale.ROOT);
        }
    }

    private static String filterQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) return "";

        return Arrays.stream(rawQuery.split("&"))
                .filter(param -> !param.isBlank())
                .filter(param -> {
                    String name = param.split("=", 2)[0].toLowerCase(Locale.ROOT);
                    return !name.startsWith("utm_") && !name.equals("fbclid") && !name.equals("gclid");
                })
                .sorted()
                .collect(Collectors.joining("&"));
    }

    private static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
