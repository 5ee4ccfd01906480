package io.dronewatch.ingestion.api.service.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dronewatch.ingestion.api.dto.IncidentCategory;
import io.dronewatch.ingestion.api.dto.VerifyResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisAiVerdictCacheTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RedisAiVerdictCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisAiVerdictCache(redisTemplate, objectMapper, Duration.ofHours(24));
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
    }

    @Test
    void shouldStoreVerdictAsJsonWithTtl() {
        VerifyResult result = VerifyResult.of(false, IncidentCategory.POLICY, 0.85, "announcement of a ban");

        cache.put("hash", result);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("ai:verdict:hash"), json.capture(), eq(Duration.ofHours(24)));
        assertThat(json.getValue()).contains("\"category\":\"POLICY\"", "\"confidence\":0.85");
    }

    @Test
    void shouldReadStoredVerdict() throws Exception {
        VerifyResult result = VerifyResult.of(true, IncidentCategory.INCIDENT, 0.9, "confirmed sighting");
        when(valueOps.get("ai:verdict:hash")).thenReturn(objectMapper.writeValueAsString(result));

        assertThat(cache.get("hash")).contains(result);
    }

    @Test
    void shouldTreatRedisOutageAsMiss() {
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(cache.get("hash")).isEmpty();
    }
}
