package com.triage.exception;

/**
 * Recoverable failure reported by the inference collaborator.
 */
public abstract class InferenceException extends TriageException {

    private final String modelName;

    protected InferenceException(String modelName, String message, Throwable cause) {
        super(message, cause);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
