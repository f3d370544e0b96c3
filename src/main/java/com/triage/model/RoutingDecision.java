package com.triage.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Record of how one query was routed. Emitted to telemetry, never mutated.
 */
@Value
@Builder
public class RoutingDecision {

    String queryId;

    /**
     * First 100 characters of the query text.
     */
    String queryPreview;

    ModelProfile profile;

    double anomalyScore;

    boolean anomalous;

    double complexityScore;

    double riskScore;

    LoadSnapshot load;

    /**
     * Set when the load snapshot used for the decision was stale.
     */
    boolean loadDegraded;

    Instant decidedAt;
}
