package io.dronewatch.ingestion.api.service.ai;

import io.dronewatch.ingestion.api.dto.IncidentCategory;
import io.dronewatch.ingestion.api.dto.VerifyResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryAiVerdictCacheTest {

    private final AiVerifierTest.MutableClock clock = new AiVerifierTest.MutableClock(Instant.parse("2025-09-22T21:00:00Z"));
    private final InMemoryAiVerdictCache cache = new InMemoryAiVerdictCache(clock, Duration.ofMinutes(30));

    @Test
    void shouldReturnEntryWithinTtl() {
        VerifyResult result = VerifyResult.of(true, IncidentCategory.INCIDENT, 0.8, "sighting");
        cache.put("abc", result);

        clock.advance(Duration.ofMinutes(29));

        assertThat(cache.get("abc")).contains(result);
    }

    @Test
    void shouldExpireEntryAfterTtl() {
        cache.put("abc", VerifyResult.of(true, IncidentCategory.INCIDENT, 0.8, "sighting"));

        clock.advance(Duration.ofMinutes(30));

        assertThat(cache.get("abc")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldReturnEmptyForUnknownKey() {
        assertThat(cache.get("missing")).isEmpty();
    }
}
