package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.PipelineFixtures;
import io.dronewatch.ingestion.api.dto.BatchResult;
import io.dronewatch.ingestion.api.dto.ConsolidationResult;
import io.dronewatch.ingestion.api.dto.PipelineStage;
import io.dronewatch.ingestion.api.dto.Rejection;
import io.dronewatch.ingestion.api.dto.SourceType;
import io.dronewatch.ingestion.api.dto.kafka.BatchProcessedEvent;
import io.dronewatch.ingestion.api.dto.kafka.CandidateRejectedEvent;
import io.dronewatch.ingestion.api.dto.kafka.IncidentConsolidatedEvent;
import io.dronewatch.ingestion.config.KafkaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static io.dronewatch.ingestion.PipelineFixtures.NOW;
import static io.dronewatch.ingestion.PipelineFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventPublisherServiceTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private EventPublisherService publisher;

    private ConsolidationResult created;

    @BeforeEach
    void setUp() {
        publisher = new EventPublisherService(kafkaTemplate,
                new KafkaProperties("incident.consolidated", "candidate.rejected", "batch.processed"));

        ConsolidationEngine engine = new ConsolidationEngine(PipelineFixtures.config(), new EvidenceScorer());
        created = engine.consolidate(PipelineFixtures.aalborgCandidate(NOW.minus(Duration.ofMinutes(45)),
                source("https://politi.dk/nordjylland/drone", SourceType.POLICE, 4.0)), List.of());
    }

    @Test
    @DisplayName("Should publish consolidated incidents keyed by content hash")
    void shouldPublishIncidentKeyedByContentHash() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        publisher.publishIncidentConsolidated(created);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("incident.consolidated"), eq(created.incident().contentHash()), payload.capture());
        assertThat(payload.getValue()).isInstanceOfSatisfying(IncidentConsolidatedEvent.class, event -> {
            assertThat(event.incidentId()).isEqualTo(created.incidentId());
            assertThat(event.merged()).isFalse();
            assertThat(event.assetType()).isEqualTo("airport");
            assertThat(event.evidenceScore()).isEqualTo(4);
            assertThat(event.sources()).singleElement()
                    .satisfies(s -> assertThat(s.sourceType()).isEqualTo("police"));
        });
    }

    @Test
    @DisplayName("Should publish rejections with stage and reason")
    void shouldPublishRejection() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        publisher.publishCandidateRejected("BATCH-1",
                new Rejection("New drone ban announced", PipelineStage.GEO_TOPIC_FILTER, "policy"), NOW);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("candidate.rejected"), anyString(), payload.capture());
        assertThat(payload.getValue()).isInstanceOfSatisfying(CandidateRejectedEvent.class, event -> {
            assertThat(event.batchId()).isEqualTo("BATCH-1");
            assertThat(event.stage()).isEqualTo("GEO_TOPIC_FILTER");
            assertThat(event.reason()).isEqualTo("policy");
            assertThat(event.rejectedAt()).isEqualTo(NOW);
        });
    }

    @Test
    @DisplayName("Should publish batch summaries keyed by batch id")
    void shouldPublishBatchSummary() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        BatchResult batch = new BatchResult("BATCH-2", 3,
                List.of(new Rejection("x", PipelineStage.NORMALIZER, "malformed: no title")),
                List.of(created), true, NOW, 120);

        publisher.publishBatchProcessed("feed-a", batch);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("batch.processed"), eq("BATCH-2"), payload.capture());
        assertThat(payload.getValue()).isInstanceOfSatisfying(BatchProcessedEvent.class, event -> {
            assertThat(event.received()).isEqualTo(3);
            assertThat(event.rejected()).isEqualTo(1);
            assertThat(event.created()).isEqualTo(1);
            assertThat(event.merged()).isZero();
            assertThat(event.processedAt()).isEqualTo(NOW.plusMillis(120));
        });
    }

    @Test
    @DisplayName("Should not propagate broker failures")
    void shouldSwallowPublishFailures() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatCode(() -> publisher.publishIncidentConsolidated(created)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should not propagate errors thrown while sending")
    void shouldSurviveSendErrors() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("closed"));

        assertThatCode(() -> publisher.publishBatchProcessed("feed-a",
                new BatchResult("BATCH-3", 0, List.of(), List.of(), true, NOW, 1)))
                .doesNotThrowAnyException();
    }
}
