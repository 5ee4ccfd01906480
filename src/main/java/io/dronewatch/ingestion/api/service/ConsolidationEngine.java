package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.ConsolidatedIncident;
import io.dronewatch.ingestion.api.dto.ConsolidationResult;
import io.dronewatch.ingestion.api.dto.ConsolidationStats;
import io.dronewatch.ingestion.api.dto.GroupingKey;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.dto.IncidentCategory;
import io.dronewatch.ingestion.api.dto.SourceRef;
import io.dronewatch.ingestion.api.dto.VerifyResult;
import io.dronewatch.ingestion.api.util.TextCleaner;
import io.dronewatch.ingestion.config.ConsolidationConfig;
import io.dronewatch.ingestion.config.PipelineConfig;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a candidate creates a new incident or merges into an existing one at the
 * same facility within the merge window, and builds the resulting incident version.
 * Pure: the caller supplies the existing incidents and persists the result.
 */
@Service
public class ConsolidationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ConsolidationEngine.class);

    private static final Comparator<SourceRef> BY_TRUST_DESC =
            Comparator.comparingDouble(SourceRef::trustWeight).reversed();

    static final Duration DEFAULT_MERGE_WINDOW = Duration.ofHours(6);

    private final EvidenceScorer evidenceScorer;
    private final double precision;
    private final Duration mergeWindow;

    public ConsolidationEngine(PipelineConfig config, EvidenceScorer evidenceScorer) {
        ConsolidationConfig consolidation = config.consolidation();
        this.evidenceScorer = evidenceScorer;
        this.precision = consolidation != null && consolidation.roundPrecisionDegrees() > 0
                ? consolidation.roundPrecisionDegrees()
                : 0.01;
        // the window buckets content hashes in whole seconds
        this.mergeWindow = consolidation != null && consolidation.mergeWindow() != null
                && consolidation.mergeWindow().toSeconds() > 0
                ? consolidation.mergeWindow()
                : DEFAULT_MERGE_WINDOW;
    }

    public GroupingKey groupingKey(IncidentCandidate candidate) {
        if (candidate.hasCoordinates()) {
            return new GroupingKey(
                    candidate.assetType(),
                    candidate.country(),
                    Math.round(candidate.latitude() / precision),
                    Math.round(candidate.longitude() / precision),
                    null
            );
        }
        return new GroupingKey(
                candidate.assetType(),
                candidate.country(),
                null,
                null,
                DigestUtils.md5Hex(TextCleaner.canonical(candidate.title()))
        );
    }

    /**
     * Stable identity of the incident a candidate would create: grouping key plus merge-window bucket.
     */
    public String contentHash(GroupingKey key, Instant occurredAt) {
        long bucket = Math.floorDiv(occurredAt.getEpochSecond(), mergeWindow.toSeconds());
        return DigestUtils.md5Hex(key.asString() + "|" + bucket);
    }

    public ConsolidationResult consolidate(IncidentCandidate candidate, Collection<ConsolidatedIncident> existing) {
        return consolidate(candidate, VerifyResult.noOpinion("not verified"), existing);
    }

    public ConsolidationResult consolidate(IncidentCandidate candidate,
                                           VerifyResult verification,
                                           Collection<ConsolidatedIncident> existing) {
        GroupingKey key = groupingKey(candidate);

        Optional<ConsolidatedIncident> match = findMatch(key, candidate.occurredAt(), existing);
        if (match.isPresent()) {
            ConsolidatedIncident merged = merge(match.get(), candidate, verification);
            logger.debug("Merged '{}' into incident {} (merged_from={}, score={})",
                    candidate.title(), merged.id(), merged.mergedFrom(), merged.evidenceScore());
            return new ConsolidationResult(merged, true);
        }

        ConsolidatedIncident created = create(key, candidate, verification);
        logger.debug("Created incident {} for '{}' (key={}, score={})",
                created.id(), candidate.title(), key.asString(), created.evidenceScore());
        return new ConsolidationResult(created, false);
    }

    /**
     * Groups candidates the way consolidation would, without touching any incident.
     */
    public ConsolidationStats previewStats(List<IncidentCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return new ConsolidationStats(0, 0, 0, 0, 0.0);
        }

        Map<String, Integer> groups = new LinkedHashMap<>();
        for (IncidentCandidate candidate : candidates) {
            String hash = contentHash(groupingKey(candidate), candidate.occurredAt());
            groups.merge(hash, 1, Integer::sum);
        }

        int multiGroups = (int) groups.values().stream().filter(size -> size > 1).count();
        int potentialMerges = groups.values().stream().filter(size -> size > 1).mapToInt(size -> size - 1).sum();
        double mergeRate = (double) multiGroups / groups.size() * 100.0;

        return new ConsolidationStats(candidates.size(), groups.size(), multiGroups, potentialMerges, mergeRate);
    }

    /**
     * Closest incident with the same key inside the merge window. An incident already holding the
     * content hash this candidate would create is the same event even when its occurrence time has
     * drifted outside the window through earlier merges.
     */
    private Optional<ConsolidatedIncident> findMatch(GroupingKey key, Instant occurredAt,
                                                     Collection<ConsolidatedIncident> existing) {
        if (existing == null) return Optional.empty();

        Optional<ConsolidatedIncident> inWindow = existing.stream()
                .filter(incident -> key.equals(incident.groupingKey()))
                .filter(incident -> distance(incident.occurredAt(), occurredAt).compareTo(mergeWindow) <= 0)
                .min(Comparator
                        .comparing((ConsolidatedIncident incident) -> distance(incident.occurredAt(), occurredAt))
                        .thenComparing(ConsolidatedIncident::firstSeenAt));
        if (inWindow.isPresent()) {
            return inWindow;
        }

        String hash = contentHash(key, occurredAt);
        return existing.stream()
                .filter(incident -> key.equals(incident.groupingKey()))
                .filter(incident -> hash.equals(incident.contentHash()))
                .findFirst();
    }

    private ConsolidatedIncident create(GroupingKey key, IncidentCandidate candidate, VerifyResult verification) {
        List<SourceRef> sources = mergeSources(List.of(), candidate.sources());

        return new ConsolidatedIncident(
                UUID.randomUUID().toString(),
                contentHash(key, candidate.occurredAt()),
                key,
                candidate.title(),
                candidate.narrative(),
                candidate.occurredAt(),
                candidate.latitude(),
                candidate.longitude(),
                candidate.assetType(),
                candidate.country(),
                sources,
                0,
                evidenceScorer.score(sources),
                aiCategory(verification),
                aiConfidence(verification),
                candidate.ingestedAt(),
                candidate.ingestedAt()
        );
    }

    private ConsolidatedIncident merge(ConsolidatedIncident incident, IncidentCandidate candidate, VerifyResult verification) {
        List<SourceRef> sources = mergeSources(incident.sources(), candidate.sources());

        Instant seenAt = candidate.ingestedAt();
        boolean candidateSeenFirst = seenAt.isBefore(incident.firstSeenAt());

        IncidentCategory category = incident.aiCategory() != null ? incident.aiCategory() : aiCategory(verification);
        Double confidence = incident.aiCategory() != null ? incident.aiConfidence() : aiConfidence(verification);

        return new ConsolidatedIncident(
                incident.id(),
                incident.contentHash(),
                incident.groupingKey(),
                preferLonger(incident.title(), candidate.title(), candidateSeenFirst),
                preferLonger(incident.narrative(), candidate.narrative(), candidateSeenFirst),
                min(incident.occurredAt(), candidate.occurredAt()),
                incident.latitude(),
                incident.longitude(),
                incident.assetType(),
                incident.country(),
                sources,
                incident.mergedFrom() + 1,
                evidenceScorer.upgrade(incident.evidenceScore(), sources),
                category,
                confidence,
                min(incident.firstSeenAt(), seenAt),
                max(incident.lastSeenAt(), seenAt)
        );
    }

    /**
     * Existing sources first, new ones appended when their normalized URL is unseen, then ranked by trust.
     */
    static List<SourceRef> mergeSources(List<SourceRef> existing, List<SourceRef> incoming) {
        Map<String, SourceRef> byUrl = new LinkedHashMap<>();
        for (SourceRef source : existing) {
            byUrl.putIfAbsent(source.normalizedUrl(), source);
        }
        for (SourceRef source : incoming) {
            byUrl.putIfAbsent(source.normalizedUrl(), source);
        }

        List<SourceRef> ranked = new ArrayList<>(byUrl.values());
        ranked.sort(BY_TRUST_DESC);
        return ranked;
    }

    // ties go to the earliest-seen text
    private static String preferLonger(String current, String incoming, boolean incomingSeenFirst) {
        String a = current == null ? "" : current.trim();
        String b = incoming == null ? "" : incoming.trim();

        if (b.length() > a.length()) return incoming;
        if (b.length() == a.length() && incomingSeenFirst && !b.isEmpty()) return incoming;
        return current;
    }

    private static IncidentCategory aiCategory(VerifyResult verification) {
        return verification != null && verification.hasOpinion() ? verification.category() : null;
    }

    private static Double aiConfidence(VerifyResult verification) {
        return verification != null && verification.hasOpinion() ? verification.confidence() : null;
    }

    private static Duration distance(Instant a, Instant b) {
        return Duration.between(a, b).abs();
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
