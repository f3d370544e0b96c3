package com.triage.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.triage.config.TriageProperties;
import com.triage.exception.InferenceException;
import com.triage.exception.InferenceTimeoutException;
import com.triage.exception.InferenceUnavailableException;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Ollama generate-endpoint client.
 * POST {baseUrl}/api/generate {model, prompt, stream:false} and read the "response" field.
 */
@Slf4j
public class OllamaInferenceClient implements InferenceClient {

    private final WebClient webClient;
    private final TriageProperties.InferenceConfig config;

    public OllamaInferenceClient(WebClient webClient, TriageProperties.InferenceConfig config) {
        this.webClient = webClient;
        this.config = config;
    }

    @Override
    public String getName() {
        return "ollama";
    }

    @Override
    public String invoke(String modelName, String queryText) {
        log.debug("Forwarding query to Ollama: model={}, chars={}", modelName, queryText.length());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelName);
        body.put("prompt", queryText);
        body.put("stream", false);

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(config.getBaseUrl() + "/api/generate")
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(config.getTimeout())
                    .block();
        } catch (RuntimeException e) {
            throw translate(modelName, e);
        }

        if (response == null || !response.hasNonNull("response")) {
            throw new InferenceUnavailableException(modelName, "Ollama returned no response field for model " + modelName);
        }
        return response.get("response").asText();
    }

    private InferenceException translate(String modelName, RuntimeException error) {
        Throwable cause = Exceptions.unwrap(error);
        if (isTimeout(cause)) {
            log.warn("Ollama timed out after {} for model {}", config.getTimeout(), modelName);
            return new InferenceTimeoutException(modelName,
                    "Model " + modelName + " did not answer within " + config.getTimeout(), cause);
        }
        if (cause instanceof WebClientResponseException) {
            WebClientResponseException responseError = (WebClientResponseException) cause;
            log.warn("Ollama returned {} for model {}", responseError.getStatusCode(), modelName);
            return new InferenceUnavailableException(modelName,
                    "Model " + modelName + " failed with HTTP " + responseError.getStatusCode().value(), cause);
        }
        log.warn("Ollama unreachable for model {}: {}", modelName, cause.getMessage());
        return new InferenceUnavailableException(modelName,
                "Model " + modelName + " is unavailable: " + cause.getMessage(), cause);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof ReadTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
