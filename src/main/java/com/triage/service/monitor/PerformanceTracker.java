package com.triage.service.monitor;

import com.triage.model.dto.RoutingStatistics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-query outcome counters with a sliding latency window.
 */
public class PerformanceTracker {

    private final Clock clock;
    private final int windowSize;
    private final Instant startedAt;

    private final Deque<Long> latenciesMs = new ArrayDeque<>();
    private final Map<String, Long> modelUsage = new TreeMap<>();
    private long totalQueries;
    private long errors;
    private long cacheHits;

    public PerformanceTracker(Clock clock, int windowSize) {
        this.clock = clock;
        this.windowSize = Math.max(1, windowSize);
        this.startedAt = clock.instant();
    }

    /**
     * @param modelName profile that served the query, or null when routing failed before selection
     */
    public synchronized void record(String modelName, Duration latency, boolean success, boolean cacheHit) {
        totalQueries++;
        if (!success) {
            errors++;
        }
        if (cacheHit) {
            cacheHits++;
        }
        if (modelName != null && success) {
            modelUsage.merge(modelName, 1L, Long::sum);
        }
        latenciesMs.addLast(latency.toMillis());
        while (latenciesMs.size() > windowSize) {
            latenciesMs.removeFirst();
        }
    }

    public synchronized RoutingStatistics summary() {
        double uptimeSeconds = Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;

        long served = modelUsage.values().stream().mapToLong(Long::longValue).sum();
        Map<String, Double> distribution = new LinkedHashMap<>();
        modelUsage.forEach((model, count) -> distribution.put(model, served > 0 ? (double) count / served : 0.0));

        return RoutingStatistics.builder()
                .totalQueries(totalQueries)
                .queriesPerMinute(uptimeSeconds > 0 ? totalQueries / uptimeSeconds * 60.0 : 0.0)
                .errorRate(totalQueries > 0 ? (double) errors / totalQueries : 0.0)
                .cacheHitRate(totalQueries > 0 ? (double) cacheHits / totalQueries : 0.0)
                .modelDistribution(distribution)
                .latency(latencySummary())
                .uptimeHours(uptimeSeconds / 3600.0)
                .build();
    }

    private RoutingStatistics.LatencySummary latencySummary() {
        if (latenciesMs.isEmpty()) {
            return RoutingStatistics.LatencySummary.builder().build();
        }
        long[] sorted = latenciesMs.stream().mapToLong(Long::longValue).toArray();
        Arrays.sort(sorted);
        double mean = Arrays.stream(sorted).average().orElse(0.0);
        return RoutingStatistics.LatencySummary.builder()
                .meanMs(mean)
                .medianMs(percentile(sorted, 50))
                .p95Ms(percentile(sorted, 95))
                .minMs(sorted[0])
                .maxMs(sorted[sorted.length - 1])
                .build();
    }

    // Linear interpolation between closest ranks
    private static double percentile(long[] sorted, double p) {
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
