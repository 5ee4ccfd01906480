package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.RawIncidentReport;

import java.util.List;

/**
 * Hands raw reports collected by an external scraper to the scheduled pipeline run.
 */
public interface CandidateFeed {

    String name();

    List<RawIncidentReport> fetch() throws Exception;
}
