package io.dronewatch.ingestion.config;

import java.time.Duration;

public record AiConfig(
        boolean enabled,
        String apiKey,
        String model,
        String baseUrl,
        double rejectThreshold,
        Duration cacheTtl,
        Duration timeout,
        String cacheStore,
        HttpConfig http
) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
