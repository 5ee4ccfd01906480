package io.dronewatch.ingestion.api.dto;

public record ConsolidationResult(
        ConsolidatedIncident incident,
        boolean merged
) {
    public String incidentId() {
        return incident.id();
    }
}
