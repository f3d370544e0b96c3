package com.triage.exception;

/**
 * Base class for all routing-core failures.
 */
public class TriageException extends RuntimeException {

    public TriageException(String message) {
        super(message);
    }

    public TriageException(String message, Throwable cause) {
        super(message, cause);
    }
}
