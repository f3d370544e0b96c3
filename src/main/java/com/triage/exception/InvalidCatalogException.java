package com.triage.exception;

/**
 * Thrown when the model profile catalog violates its validation rules.
 * Raised at startup; the process must not serve traffic with a bad catalog.
 */
public class InvalidCatalogException extends TriageException {

    public InvalidCatalogException(String message) {
        super(message);
    }
}
