package io.dronewatch.ingestion.api.dto;

public record ConsolidationStats(
        int totalCandidates,
        int distinctKeys,
        int multiCandidateGroups,
        int potentialMerges,
        double mergeRate
) {}
