package io.dronewatch.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Optional;

@ConfigurationProperties(prefix = "feeds")
public record FeedConfig(
        List<FeedSource> sources
) {
    public FeedConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public List<FeedSource> getEnabledSources() {
        return sources.stream()
                .filter(FeedSource::enabled)
                .toList();
    }

    public Optional<FeedSource> findEnabled(String name) {
        return getEnabledSources().stream()
                .filter(source -> source.getSimpleName().equalsIgnoreCase(name))
                .findFirst();
    }
}
