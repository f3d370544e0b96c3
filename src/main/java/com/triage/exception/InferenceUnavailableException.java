package com.triage.exception;

/**
 * The inference backend could not be reached or answered with a server error.
 */
public class InferenceUnavailableException extends InferenceException {

    public InferenceUnavailableException(String modelName, String message) {
        this(modelName, message, null);
    }

    public InferenceUnavailableException(String modelName, String message, Throwable cause) {
        super(modelName, message, cause);
    }
}
