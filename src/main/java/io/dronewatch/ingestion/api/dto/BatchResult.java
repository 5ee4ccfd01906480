package io.dronewatch.ingestion.api.dto;

import java.time.Instant;
import java.util.List;

public record BatchResult(
        String batchId,
        int received,
        List<Rejection> rejections,
        List<ConsolidationResult> results,
        boolean completed,
        Instant startedAt,
        long durationMs
) {
    public long created() {
        return results.stream().filter(r -> !r.merged()).count();
    }

    public long merged() {
        return results.stream().filter(ConsolidationResult::merged).count();
    }
}
