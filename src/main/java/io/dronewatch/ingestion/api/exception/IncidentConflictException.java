package io.dronewatch.ingestion.api.exception;

/**
 * Thrown by the persistence boundary when an incident with the same content hash already exists.
 */
public class IncidentConflictException extends RuntimeException {
    private final String contentHash;

    public IncidentConflictException(String contentHash) {
        super("Incident already exists for content hash " + contentHash);
        this.contentHash = contentHash;
    }

    public String getContentHash() {
        return contentHash;
    }
}
