package com.triage.controller;

import com.triage.exception.InferenceTimeoutException;
import com.triage.exception.InferenceUnavailableException;
import com.triage.exception.NotFittedException;
import com.triage.exception.RoutingException;
import com.triage.exception.TriageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps routing failures to {@code {"error": {"code", "message"}}} responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", ex.getMessage());
    }

    @ExceptionHandler(NotFittedException.class)
    public ResponseEntity<Map<String, Object>> handleNotFitted(NotFittedException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "not_fitted", ex.getMessage());
    }

    @ExceptionHandler(RoutingException.class)
    public ResponseEntity<Map<String, Object>> handleRouting(RoutingException ex) {
        log.error("Routing failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "routing_failed", ex.getMessage());
    }

    @ExceptionHandler(InferenceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(InferenceUnavailableException ex) {
        return error(HttpStatus.BAD_GATEWAY, "inference_unavailable", ex.getMessage());
    }

    @ExceptionHandler(InferenceTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(InferenceTimeoutException ex) {
        return error(HttpStatus.GATEWAY_TIMEOUT, "inference_timeout", ex.getMessage());
    }

    @ExceptionHandler(TriageException.class)
    public ResponseEntity<Map<String, Object>> handleOther(TriageException ex) {
        log.error("Request failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> err = new LinkedHashMap<>();
        err.put("code", code);
        err.put("message", message != null ? message : status.getReasonPhrase());
        return ResponseEntity.status(status).body(Map.of("error", err));
    }
}
