package com.triage.exception;

/**
 * Thrown when a feature extractor or anomaly detector is used before it has been trained.
 * This is a programming error: the request fails and is not retried.
 */
public class NotFittedException extends TriageException {

    public NotFittedException(String component) {
        super(component + " has not been fitted; call fit() before use");
    }
}
