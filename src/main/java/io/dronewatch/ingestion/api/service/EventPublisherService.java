package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.BatchResult;
import io.dronewatch.ingestion.api.dto.ConsolidationResult;
import io.dronewatch.ingestion.api.dto.Rejection;
import io.dronewatch.ingestion.api.dto.kafka.BatchProcessedEvent;
import io.dronewatch.ingestion.api.dto.kafka.CandidateRejectedEvent;
import io.dronewatch.ingestion.api.dto.kafka.IncidentConsolidatedEvent;
import io.dronewatch.ingestion.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Fans pipeline output out to Kafka. Publishing never fails the pipeline; errors are logged.
 */
@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties topics;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties topics) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
    }

    public void publishIncidentConsolidated(ConsolidationResult result) {
        try {
            IncidentConsolidatedEvent event = IncidentConsolidatedEvent.create(result.incident(), result.merged());

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.incidentConsolidated(), event.contentHash(), event);

            future.whenComplete((sent, ex) -> {
                if (ex == null) {
                    logger.debug("Sent incident {} ({}) to partition: {}",
                            event.incidentId(), result.merged() ? "merged" : "created",
                            sent.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send incident event: {}", event.incidentId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing incident event for: {}", result.incidentId(), e);
        }
    }

    public void publishCandidateRejected(String batchId, Rejection rejection, Instant rejectedAt) {
        try {
            CandidateRejectedEvent event = CandidateRejectedEvent.create(
                    batchId,
                    rejection.title(),
                    rejection.stage().name(),
                    rejection.reason(),
                    rejectedAt
            );

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.candidateRejected(), event.rejectionId(), event);

            future.whenComplete((sent, ex) -> {
                if (ex != null) {
                    logger.error("Failed to send rejection event: {}", event.rejectionId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing rejection event for: {}", rejection.title(), e);
        }
    }

    public void publishBatchProcessed(String source, BatchResult result) {
        try {
            BatchProcessedEvent event = BatchProcessedEvent.create(source, result);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.batchProcessed(), event.batchId(), event);

            future.whenComplete((sent, ex) -> {
                if (ex == null) {
                    logger.info("Sent batch processed event: {} ({} received from {})",
                            event.batchId(), event.received(), source);
                } else {
                    logger.error("Failed to send batch processed event: {}", event.batchId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing batch processed event for source: {}", source, e);
        }
    }
}
