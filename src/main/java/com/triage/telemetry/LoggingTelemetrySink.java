package com.triage.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.triage.model.LoadSnapshot;
import com.triage.model.RoutingDecision;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each routing decision as one JSON log line.
 */
@Slf4j
public class LoggingTelemetrySink implements TelemetrySink {

    private final ObjectMapper objectMapper;

    public LoggingTelemetrySink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void recordDecision(RoutingDecision decision) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", decision.getDecidedAt().toString());
        line.put("query_id", decision.getQueryId());
        line.put("query", decision.getQueryPreview());
        line.put("profile", decision.getProfile().getName());
        line.put("model", decision.getProfile().getModel());
        line.put("anomaly_score", decision.getAnomalyScore());
        line.put("anomalous", decision.isAnomalous());
        line.put("complexity", decision.getComplexityScore());
        line.put("risk", decision.getRiskScore());
        line.put("in_flight", decision.getLoad().getInFlightRequestCount());
        line.put("load_degraded", decision.isLoadDegraded());
        log.info("Query routed: {}", toJson(line));
    }

    @Override
    public void recordLoad(LoadSnapshot snapshot) {
        log.debug("Load snapshot: cpu={}, memory={}, in_flight={}",
                snapshot.getCpuUtilization(), snapshot.getMemoryUtilization(), snapshot.getInFlightRequestCount());
    }

    private String toJson(Map<String, Object> line) {
        try {
            return objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render routing decision", e);
        }
    }
}
