package io.dronewatch.ingestion.api.exception;

public class MalformedCandidateException extends Exception {

    public MalformedCandidateException(String message) {
        super(message);
    }

    public MalformedCandidateException(String message, Throwable cause) {
        super(message, cause);
    }
}
