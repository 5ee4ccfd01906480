package io.dronewatch.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kafka.topics")
public record KafkaProperties(
        String incidentConsolidated,
        String candidateRejected,
        String batchProcessed
) {}
