package com.triage.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Summary of routing performance since startup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingStatistics {

    private long totalQueries;

    private double queriesPerMinute;

    private double errorRate;

    private double cacheHitRate;

    /**
     * Share of successfully routed queries served by each profile.
     */
    private Map<String, Double> modelDistribution;

    private LatencySummary latency;

    private double uptimeHours;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LatencySummary {
        private double meanMs;
        private double medianMs;
        private double p95Ms;
        private double minMs;
        private double maxMs;
    }
}
