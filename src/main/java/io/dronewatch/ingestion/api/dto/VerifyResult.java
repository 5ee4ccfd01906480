package io.dronewatch.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of AI verification. {@code hasOpinion == false} means the classifier was not
 * consulted or gave nothing usable, and the candidate proceeds on rule-based verdicts alone.
 */
public record VerifyResult(
        @JsonProperty("hasOpinion") boolean hasOpinion,
        @JsonProperty("isIncident") boolean isIncident,
        @JsonProperty("category") IncidentCategory category,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("reasoning") String reasoning
) {
    public static VerifyResult noOpinion(String reason) {
        return new VerifyResult(false, true, null, 0.0, reason);
    }

    public static VerifyResult of(boolean isIncident, IncidentCategory category, double confidence, String reasoning) {
        return new VerifyResult(true, isIncident, category, confidence, reasoning);
    }
}
