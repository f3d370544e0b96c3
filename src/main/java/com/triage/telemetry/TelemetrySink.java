package com.triage.telemetry;

import com.triage.model.LoadSnapshot;
import com.triage.model.RoutingDecision;

/**
 * Export target for routing decisions and load updates (log pipeline, cloud monitoring, ...).
 * Calls are fire-and-forget; implementations may throw and callers must not be affected.
 */
public interface TelemetrySink {

    void recordDecision(RoutingDecision decision);

    default void recordLoad(LoadSnapshot snapshot) {
    }
}
