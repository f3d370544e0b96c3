package com.triage.exception;

/**
 * Thrown when no model profile is eligible for a query.
 */
public class RoutingException extends TriageException {

    public RoutingException(String message) {
        super(message);
    }
}
