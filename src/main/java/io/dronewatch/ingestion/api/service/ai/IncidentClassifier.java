package io.dronewatch.ingestion.api.service.ai;

import io.dronewatch.ingestion.api.dto.ClassificationRequest;
import io.dronewatch.ingestion.api.dto.ClassifierResponse;
import io.dronewatch.ingestion.api.exception.ClassifierException;

/**
 * External language-model classifier deciding whether a text describes an actual drone incident.
 */
public interface IncidentClassifier {

    /**
     * @return false when the classifier is not configured and must not be called
     */
    boolean isAvailable();

    ClassifierResponse classify(ClassificationRequest request) throws ClassifierException;
}
