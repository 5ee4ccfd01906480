package io.dronewatch.ingestion.api.service.ai;

import io.dronewatch.ingestion.api.dto.VerifyResult;

import java.util.Optional;

/**
 * Verdicts of the external classifier keyed by a hash of the normalized text.
 * Entries expire after the configured TTL.
 */
public interface AiVerdictCache {

    Optional<VerifyResult> get(String key);

    void put(String key, VerifyResult result);
}
