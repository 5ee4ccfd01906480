package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.ConsolidatedIncident;
import io.dronewatch.ingestion.api.dto.GroupingKey;
import io.dronewatch.ingestion.api.exception.IncidentConflictException;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryIncidentRepository implements IncidentRepository {

    private final Map<String, ConsolidatedIncident> byContentHash = new ConcurrentHashMap<>();

    @Override
    public List<ConsolidatedIncident> findByGroupingKey(GroupingKey key) {
        return byContentHash.values().stream()
                .filter(incident -> key.equals(incident.groupingKey()))
                .sorted(Comparator.comparing(ConsolidatedIncident::occurredAt))
                .toList();
    }

    @Override
    public Optional<ConsolidatedIncident> findByContentHash(String contentHash) {
        return Optional.ofNullable(byContentHash.get(contentHash));
    }

    @Override
    public void insert(ConsolidatedIncident incident) {
        if (byContentHash.putIfAbsent(incident.contentHash(), incident) != null) {
            throw new IncidentConflictException(incident.contentHash());
        }
    }

    @Override
    public void update(ConsolidatedIncident expected, ConsolidatedIncident updated) {
        if (!expected.contentHash().equals(updated.contentHash())) {
            throw new IllegalArgumentException("Content hash of incident " + expected.id() + " cannot change");
        }
        if (!byContentHash.containsKey(updated.contentHash())) {
            throw new IllegalStateException("No incident stored for content hash " + updated.contentHash());
        }
        if (!byContentHash.replace(updated.contentHash(), expected, updated)) {
            throw new IncidentConflictException(updated.contentHash());
        }
    }

    @Override
    public List<ConsolidatedIncident> findAll() {
        List<ConsolidatedIncident> all = new ArrayList<>(byContentHash.values());
        all.sort(Comparator.comparing(ConsolidatedIncident::firstSeenAt).thenComparing(ConsolidatedIncident::id));
        return all;
    }

    @Override
    public int count() {
        return byContentHash.size();
    }
}
