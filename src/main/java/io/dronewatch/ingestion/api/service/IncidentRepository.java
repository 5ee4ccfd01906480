package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.ConsolidatedIncident;
import io.dronewatch.ingestion.api.dto.GroupingKey;
import io.dronewatch.ingestion.api.exception.IncidentConflictException;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for consolidated incidents. Content hashes are unique.
 */
public interface IncidentRepository {

    List<ConsolidatedIncident> findByGroupingKey(GroupingKey key);

    Optional<ConsolidatedIncident> findByContentHash(String contentHash);

    /**
     * @throws IncidentConflictException when an incident with the same content hash already exists
     */
    void insert(ConsolidatedIncident incident);

    /**
     * Replaces {@code expected} with {@code updated} only if the stored incident is still {@code expected}.
     *
     * @throws IncidentConflictException when the stored incident changed since it was read
     */
    void update(ConsolidatedIncident expected, ConsolidatedIncident updated);

    List<ConsolidatedIncident> findAll();

    int count();
}
