package com.triage.provider;

import com.triage.exception.InferenceTimeoutException;
import com.triage.exception.InferenceUnavailableException;

/**
 * Black-box inference backend.
 */
public interface InferenceClient {

    /**
     * Backend name for logs (e.g., "ollama").
     */
    String getName();

    /**
     * Run a query against a model.
     *
     * @param modelName  backend model identifier
     * @param queryText  prompt text
     * @return response text
     * @throws InferenceUnavailableException if the backend cannot serve the request
     * @throws InferenceTimeoutException     if the backend does not answer in time
     */
    String invoke(String modelName, String queryText);
}
