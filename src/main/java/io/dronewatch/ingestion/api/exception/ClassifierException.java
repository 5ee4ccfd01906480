package io.dronewatch.ingestion.api.exception;

public class ClassifierException extends Exception {
    private final ErrorCategory category;

    public ClassifierException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public ClassifierException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
