package io.dronewatch.ingestion.config;

public record HttpConfig(
        int connectTimeout,
        int readTimeout,
        String userAgent
) {}
