package io.dronewatch.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dronewatch.ingestion.api.service.ai.AiVerdictCache;
import io.dronewatch.ingestion.api.service.ai.InMemoryAiVerdictCache;
import io.dronewatch.ingestion.api.service.ai.RedisAiVerdictCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AiVerdictCacheConfig {

    private static final Logger logger = LoggerFactory.getLogger(AiVerdictCacheConfig.class);

    @Bean
    public AiVerdictCache aiVerdictCache(PipelineConfig config,
                                         ObjectProvider<RedisTemplate<String, String>> redisTemplate,
                                         ObjectMapper objectMapper,
                                         Clock clock) {
        AiConfig ai = config.ai();
        Duration ttl = ai != null && ai.cacheTtl() != null ? ai.cacheTtl() : Duration.ofHours(24);
        String store = ai != null && ai.cacheStore() != null ? ai.cacheStore() : "redis";

        RedisTemplate<String, String> template = redisTemplate.getIfAvailable();
        if ("redis".equalsIgnoreCase(store) && template != null) {
            logger.info("AI verdict cache: redis (ttl {})", ttl);
            return new RedisAiVerdictCache(template, objectMapper, ttl);
        }

        logger.info("AI verdict cache: in-memory (ttl {})", ttl);
        return new InMemoryAiVerdictCache(clock, ttl);
    }
}
