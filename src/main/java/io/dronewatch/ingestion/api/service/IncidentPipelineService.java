package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.BatchResult;
import io.dronewatch.ingestion.api.dto.ConsolidationResult;
import io.dronewatch.ingestion.api.dto.DetectionVerdict;
import io.dronewatch.ingestion.api.dto.FakeLayer;
import io.dronewatch.ingestion.api.dto.FilterVerdict;
import io.dronewatch.ingestion.api.dto.GroupingKey;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.dto.PipelineStage;
import io.dronewatch.ingestion.api.dto.RawIncidentReport;
import io.dronewatch.ingestion.api.dto.Rejection;
import io.dronewatch.ingestion.api.dto.VerifyResult;
import io.dronewatch.ingestion.api.exception.MalformedCandidateException;
import io.dronewatch.ingestion.api.service.ai.AiVerifier;
import io.dronewatch.ingestion.api.service.fake.FakeContentDetector;
import io.dronewatch.ingestion.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Runs a batch of raw reports through normalization, filtering, fake detection, AI verification
 * and consolidation. Screening runs concurrently per candidate; consolidation runs one partition
 * per grouping key, each partition in occurrence order.
 */
@Service
public class IncidentPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(IncidentPipelineService.class);

    private static final int DEFAULT_PARALLELISM = 4;

    private final IncidentNormalizer normalizer;
    private final GeoTopicFilter geoTopicFilter;
    private final FakeContentDetector fakeDetector;
    private final AiVerifier aiVerifier;
    private final ConsolidationEngine consolidationEngine;
    private final ConsolidationService consolidationService;
    private final EventPublisherService eventPublisher;
    private final Clock clock;
    private final int parallelism;

    private final AtomicReference<BatchResult> lastBatch = new AtomicReference<>();

    public IncidentPipelineService(IncidentNormalizer normalizer,
                                   GeoTopicFilter geoTopicFilter,
                                   FakeContentDetector fakeDetector,
                                   AiVerifier aiVerifier,
                                   ConsolidationEngine consolidationEngine,
                                   ConsolidationService consolidationService,
                                   EventPublisherService eventPublisher,
                                   PipelineConfig config,
                                   Clock clock) {
        this.normalizer = normalizer;
        this.geoTopicFilter = geoTopicFilter;
        this.fakeDetector = fakeDetector;
        this.aiVerifier = aiVerifier;
        this.consolidationEngine = consolidationEngine;
        this.consolidationService = consolidationService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.parallelism = config.processing() != null && config.processing().parallelism() > 0
                ? config.processing().parallelism()
                : DEFAULT_PARALLELISM;
    }

    public BatchResult processBatch(List<RawIncidentReport> reports) {
        return processBatch("manual", reports);
    }

    public BatchResult processBatch(String source, List<RawIncidentReport> reports) {
        Instant now = clock.instant();
        long startTime = System.currentTimeMillis();
        String batchId = "BATCH-" + UUID.randomUUID().toString().substring(0, 8);

        logger.info("Starting batch {} from {} with {} reports", batchId, source, reports.size());

        List<Rejection> rejections = new ArrayList<>();
        List<ConsolidationResult> results = new ArrayList<>();
        boolean completed = true;

        ExecutorService pool = newPool(batchId);
        try {
            List<IncidentCandidate> candidates = new ArrayList<>();
            for (RawIncidentReport report : reports) {
                try {
                    candidates.add(normalizer.normalize(report, now));
                } catch (MalformedCandidateException e) {
                    reject(batchId, rejections, titleOf(report), PipelineStage.NORMALIZER, "malformed: " + e.getMessage(), now);
                }
            }

            List<Future<Screening>> screenings = new ArrayList<>();
            for (IncidentCandidate candidate : candidates) {
                screenings.add(pool.submit(() -> screen(candidate, now)));
            }

            List<Screening> survivors = new ArrayList<>();
            for (Future<Screening> future : screenings) {
                Screening screening = future.get();
                if (screening.rejection() != null) {
                    reject(batchId, rejections, screening.rejection(), now);
                } else {
                    survivors.add(screening);
                }
            }

            List<Future<PartitionOutcome>> partitions = new ArrayList<>();
            for (List<Screening> partition : partition(survivors).values()) {
                partitions.add(pool.submit(() -> consolidatePartition(partition)));
            }

            for (Future<PartitionOutcome> future : partitions) {
                PartitionOutcome outcome = future.get();
                results.addAll(outcome.results());
                outcome.rejections().forEach(rejection -> reject(batchId, rejections, rejection, now));
                if (!outcome.completed()) {
                    completed = false;
                }
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            completed = false;
            logger.warn("Batch {} interrupted; {} incidents consolidated before stopping", batchId, results.size());

        } catch (ExecutionException e) {
            completed = false;
            logger.error("Batch {} stopped on unexpected failure: {}", batchId, e.getCause().getMessage(), e.getCause());

        } finally {
            pool.shutdownNow();
        }

        BatchResult result = new BatchResult(
                batchId,
                reports.size(),
                List.copyOf(rejections),
                List.copyOf(results),
                completed,
                now,
                System.currentTimeMillis() - startTime
        );
        lastBatch.set(result);
        eventPublisher.publishBatchProcessed(source, result);

        logger.info("Batch {} finished: {} received, {} rejected, {} created, {} merged in {}ms",
                batchId, result.received(), rejections.size(), result.created(), result.merged(), result.durationMs());
        return result;
    }

    public Optional<BatchResult> getLastBatch() {
        return Optional.ofNullable(lastBatch.get());
    }

    /**
     * Stages 2 to 4. Each stage only runs when the previous one passed.
     */
    private Screening screen(IncidentCandidate candidate, Instant now) {
        PipelineStage stage = PipelineStage.GEO_TOPIC_FILTER;
        try {
            FilterVerdict filterVerdict = geoTopicFilter.filter(candidate);
            if (!filterVerdict.pass()) {
                return Screening.rejected(candidate, PipelineStage.GEO_TOPIC_FILTER, filterVerdict.reason());
            }

            stage = PipelineStage.FAKE_DETECTOR;
            DetectionVerdict detection = fakeDetector.detect(candidate, now);
            if (detection.isFake()) {
                String layers = detection.failedLayers().stream()
                        .sorted()
                        .map(FakeLayer::name)
                        .map(name -> name.toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(","));
                return Screening.rejected(candidate, PipelineStage.FAKE_DETECTOR, "fake: " + layers);
            }

            stage = PipelineStage.AI_VERIFIER;
            VerifyResult verification = aiVerifier.verify(candidate);
            if (aiVerifier.isConfidentRejection(verification)) {
                return Screening.rejected(candidate, PipelineStage.AI_VERIFIER, String.format(Locale.ROOT,
                        "not_incident: %s (%.2f)", verification.category().key(), verification.confidence()));
            }

            return Screening.passed(candidate, verification);

        } catch (RuntimeException e) {
            logger.error("Unexpected error screening '{}' at {}: {}", candidate.title(), stage, e.getMessage(), e);
            return Screening.rejected(candidate, stage, "error: " + e.getClass().getSimpleName());
        }
    }

    private Map<GroupingKey, List<Screening>> partition(List<Screening> survivors) {
        Map<GroupingKey, List<Screening>> partitions = new LinkedHashMap<>();
        for (Screening screening : survivors) {
            partitions.computeIfAbsent(consolidationEngine.groupingKey(screening.candidate()), key -> new ArrayList<>())
                    .add(screening);
        }
        partitions.values().forEach(list -> list.sort(Comparator.comparing(s -> s.candidate().occurredAt())));
        return partitions;
    }

    private PartitionOutcome consolidatePartition(List<Screening> partition) {
        List<ConsolidationResult> results = new ArrayList<>();
        List<Rejection> rejections = new ArrayList<>();

        for (Screening screening : partition) {
            if (Thread.currentThread().isInterrupted()) {
                return new PartitionOutcome(results, rejections, false);
            }

            IncidentCandidate candidate = screening.candidate();
            try {
                ConsolidationResult result = consolidationService.consolidateAndStore(candidate, screening.verification());
                results.add(result);
                eventPublisher.publishIncidentConsolidated(result);
            } catch (RuntimeException e) {
                logger.error("Consolidation failed for '{}': {}", candidate.title(), e.getMessage(), e);
                rejections.add(new Rejection(candidate.title(), PipelineStage.CONSOLIDATION,
                        "error: " + e.getClass().getSimpleName()));
            }
        }
        return new PartitionOutcome(results, rejections, true);
    }

    private void reject(String batchId, List<Rejection> rejections, String title, PipelineStage stage,
                        String reason, Instant now) {
        reject(batchId, rejections, new Rejection(title, stage, reason), now);
    }

    private void reject(String batchId, List<Rejection> rejections, Rejection rejection, Instant now) {
        logger.info("Rejected '{}' at {}: {}", rejection.title(), rejection.stage(), rejection.reason());
        rejections.add(rejection);
        eventPublisher.publishCandidateRejected(batchId, rejection, now);
    }

    private ExecutorService newPool(String batchId) {
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, batchId.toLowerCase(Locale.ROOT) + "-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private static String titleOf(RawIncidentReport report) {
        return report != null && report.title() != null ? report.title() : "<untitled>";
    }

    private record Screening(IncidentCandidate candidate, VerifyResult verification, Rejection rejection) {

        static Screening passed(IncidentCandidate candidate, VerifyResult verification) {
            return new Screening(candidate, verification, null);
        }

        static Screening rejected(IncidentCandidate candidate, PipelineStage stage, String reason) {
            return new Screening(candidate, null, new Rejection(candidate.title(), stage, reason));
        }
    }

    private record PartitionOutcome(List<ConsolidationResult> results, List<Rejection> rejections, boolean completed) {}
}
