package io.dronewatch.ingestion.api.dto;

public enum FakeLayer {
    DOMAIN_BLACKLIST,
    SATIRE_KEYWORD,
    CLICKBAIT,
    CONSPIRACY,
    TEMPORAL,
    SOURCE_CREDIBILITY
}
