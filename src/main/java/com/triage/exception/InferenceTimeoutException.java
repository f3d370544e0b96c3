package com.triage.exception;

/**
 * The inference backend did not answer within the configured timeout.
 */
public class InferenceTimeoutException extends InferenceException {

    public InferenceTimeoutException(String modelName, String message) {
        this(modelName, message, null);
    }

    public InferenceTimeoutException(String modelName, String message, Throwable cause) {
        super(modelName, message, cause);
    }
}
