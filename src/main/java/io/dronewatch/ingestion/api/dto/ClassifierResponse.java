package io.dronewatch.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw answer of the external classifier. Fields may be missing; the verifier validates them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassifierResponse(
        @JsonProperty("is_incident") Boolean isIncident,
        @JsonProperty("category") String category,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("reasoning") String reasoning
) {}
