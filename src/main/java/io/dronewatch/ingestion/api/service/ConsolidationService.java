package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.ConsolidatedIncident;
import io.dronewatch.ingestion.api.dto.ConsolidationResult;
import io.dronewatch.ingestion.api.dto.GroupingKey;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.dto.VerifyResult;
import io.dronewatch.ingestion.api.exception.IncidentConflictException;
import io.dronewatch.ingestion.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the consolidation engine against stored incidents and persists the outcome.
 * <p>
 * Consolidation for one grouping key is serialised across batches by a striped lock. Writers
 * outside this process surface as content-hash conflicts (a concurrent insert, or an update whose
 * expected version is stale); the attempt is then repeated against a fresh read.
 */
@Service
public class ConsolidationService {

    private static final Logger logger = LoggerFactory.getLogger(ConsolidationService.class);

    private static final int LOCK_STRIPES = 64;

    private final ConsolidationEngine engine;
    private final IncidentRepository repository;
    private final RetryTemplate retryTemplate;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public ConsolidationService(ConsolidationEngine engine, IncidentRepository repository, PipelineConfig config) {
        this.engine = engine;
        this.repository = repository;

        int attempts = config.consolidation() != null && config.consolidation().maxConflictRetries() > 0
                ? config.consolidation().maxConflictRetries() + 1
                : 3;
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(attempts)
                .retryOn(IncidentConflictException.class)
                .noBackoff()
                .build();

        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public ConsolidationResult consolidateAndStore(IncidentCandidate candidate, VerifyResult verification) {
        GroupingKey key = engine.groupingKey(candidate);

        ReentrantLock lock = locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    logger.warn("Content hash conflict for '{}', retrying against a fresh read (attempt {})",
                            candidate.title(), context.getRetryCount() + 1);
                }
                return store(key, candidate, verification);
            });
        } finally {
            lock.unlock();
        }
    }

    private ConsolidationResult store(GroupingKey key, IncidentCandidate candidate, VerifyResult verification) {
        List<ConsolidatedIncident> existing = repository.findByGroupingKey(key);
        ConsolidationResult result = engine.consolidate(candidate, verification, existing);

        if (!result.merged()) {
            repository.insert(result.incident());
            return result;
        }

        ConsolidatedIncident previous = existing.stream()
                .filter(incident -> incident.id().equals(result.incidentId()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Merged into unknown incident " + result.incidentId()));
        repository.update(previous, result.incident());
        return result;
    }
}
