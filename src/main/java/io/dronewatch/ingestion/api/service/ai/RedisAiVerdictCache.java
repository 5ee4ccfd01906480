package io.dronewatch.ingestion.api.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dronewatch.ingestion.api.dto.VerifyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Optional;

public class RedisAiVerdictCache implements AiVerdictCache {

    private static final Logger logger = LoggerFactory.getLogger(RedisAiVerdictCache.class);

    static final String AI_VERDICT_PREFIX = "ai:verdict:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisAiVerdictCache(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public Optional<VerifyResult> get(String key) {
        try {
            String json = redisTemplate.opsForValue().get(AI_VERDICT_PREFIX + key);
            if (json == null) return Optional.empty();

            return Optional.of(objectMapper.readValue(json, VerifyResult.class));

        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable cached verdict {}: {}", key, e.getOriginalMessage());
            redisTemplate.delete(AI_VERDICT_PREFIX + key);
            return Optional.empty();
        } catch (DataAccessException e) {
            logger.warn("Verdict cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, VerifyResult result) {
        try {
            redisTemplate.opsForValue().set(AI_VERDICT_PREFIX + key, objectMapper.writeValueAsString(result), ttl);
        } catch (JsonProcessingException | DataAccessException e) {
            logger.warn("Verdict cache write failed for {}: {}", key, e.getMessage());
        }
    }
}
