package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.PipelineFixtures;
import io.dronewatch.ingestion.api.dto.ConsolidatedIncident;
import io.dronewatch.ingestion.api.dto.SourceType;
import io.dronewatch.ingestion.api.exception.IncidentConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static io.dronewatch.ingestion.PipelineFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryIncidentRepositoryTest {

    private InMemoryIncidentRepository repository;
    private ConsolidationEngine engine;
    private ConsolidatedIncident incident;

    @BeforeEach
    void setUp() {
        repository = new InMemoryIncidentRepository();
        engine = new ConsolidationEngine(PipelineFixtures.config(), new EvidenceScorer());
        incident = engine.consolidate(PipelineFixtures.aalborgCandidate(Instant.parse("2025-09-22T20:15:00Z"),
                source("https://politi.dk/nordjylland/drone", SourceType.POLICE, 4.0)), List.of()).incident();
    }

    @Test
    void shouldFindInsertedIncidentByKeyAndHash() {
        repository.insert(incident);

        assertThat(repository.findByGroupingKey(incident.groupingKey())).containsExactly(incident);
        assertThat(repository.findByContentHash(incident.contentHash())).contains(incident);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void shouldRejectDuplicateContentHash() {
        repository.insert(incident);

        assertThatThrownBy(() -> repository.insert(incident))
                .isInstanceOf(IncidentConflictException.class)
                .hasMessageContaining(incident.contentHash());
    }

    @Test
    void shouldRefuseToUpdateUnknownIncident() {
        assertThatThrownBy(() -> repository.update(incident, incident)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectUpdateBasedOnStaleRead() {
        repository.insert(incident);
        ConsolidatedIncident first = merged(incident, "https://dr.dk/nyheder/drone");
        ConsolidatedIncident second = merged(incident, "https://tv2.dk/nord/drone");

        repository.update(incident, first);

        assertThatThrownBy(() -> repository.update(incident, second))
                .isInstanceOf(IncidentConflictException.class);
        assertThat(repository.findByContentHash(incident.contentHash())).contains(first);
    }

    private ConsolidatedIncident merged(ConsolidatedIncident into, String url) {
        return engine.consolidate(PipelineFixtures.aalborgCandidate(Instant.parse("2025-09-22T20:30:00Z"),
                source(url, SourceType.MEDIA, 2.0)), List.of(into)).incident();
    }
}
