package io.dronewatch.ingestion.api.service.ai;

import io.dronewatch.ingestion.api.dto.VerifyResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAiVerdictCache implements AiVerdictCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryAiVerdictCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public Optional<VerifyResult> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) return Optional.empty();

        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    @Override
    public void put(String key, VerifyResult result) {
        entries.put(key, new Entry(result, clock.instant().plus(ttl)));
    }

    public int size() {
        return entries.size();
    }

    private record Entry(VerifyResult result, Instant expiresAt) {}
}
