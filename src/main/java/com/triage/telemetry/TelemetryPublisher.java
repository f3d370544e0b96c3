package com.triage.telemetry;

import com.triage.model.LoadSnapshot;
import com.triage.model.RoutingDecision;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Fans telemetry out to every sink. A failing sink is logged and skipped.
 */
@Slf4j
public class TelemetryPublisher {

    private final List<TelemetrySink> sinks;

    public TelemetryPublisher(List<TelemetrySink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public static TelemetryPublisher none() {
        return new TelemetryPublisher(List.of());
    }

    public void publishDecision(RoutingDecision decision) {
        for (TelemetrySink sink : sinks) {
            try {
                sink.recordDecision(decision);
            } catch (RuntimeException e) {
                log.warn("Telemetry sink {} failed to record decision {}: {}",
                        sink.getClass().getSimpleName(), decision.getQueryId(), e.getMessage());
            }
        }
    }

    public void publishLoad(LoadSnapshot snapshot) {
        for (TelemetrySink sink : sinks) {
            try {
                sink.recordLoad(snapshot);
            } catch (RuntimeException e) {
                log.warn("Telemetry sink {} failed to record load snapshot: {}",
                        sink.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
