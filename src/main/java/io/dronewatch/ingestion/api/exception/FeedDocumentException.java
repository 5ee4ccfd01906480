package io.dronewatch.ingestion.api.exception;

/**
 * A feed document handed over by an external fetcher could not be accepted.
 */
public class FeedDocumentException extends Exception {
    private final ErrorCategory category;

    public FeedDocumentException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public FeedDocumentException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
