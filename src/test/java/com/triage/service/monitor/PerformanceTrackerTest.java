package com.triage.service.monitor;

import com.triage.model.dto.RoutingStatistics;
import com.triage.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceTrackerTest {

    @Test
    void testSummary() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        PerformanceTracker tracker = new PerformanceTracker(clock, 100);

        tracker.record("simple", Duration.ofMillis(100), true, false);
        tracker.record("simple", Duration.ofMillis(200), true, true);
        tracker.record("technical", Duration.ofMillis(300), true, false);
        tracker.record(null, Duration.ofMillis(400), false, false);
        clock.advance(Duration.ofMinutes(2));

        RoutingStatistics stats = tracker.summary();

        assertEquals(4, stats.getTotalQueries());
        assertEquals(2.0, stats.getQueriesPerMinute(), 1e-9);
        assertEquals(0.25, stats.getErrorRate(), 1e-9);
        assertEquals(0.25, stats.getCacheHitRate(), 1e-9);
        assertEquals(2.0 / 3, stats.getModelDistribution().get("simple"), 1e-9);
        assertEquals(1.0 / 3, stats.getModelDistribution().get("technical"), 1e-9);
        assertEquals(250.0, stats.getLatency().getMeanMs(), 1e-9);
        assertEquals(250.0, stats.getLatency().getMedianMs(), 1e-9);
        assertEquals(385.0, stats.getLatency().getP95Ms(), 1e-9);
        assertEquals(100.0, stats.getLatency().getMinMs(), 1e-9);
        assertEquals(400.0, stats.getLatency().getMaxMs(), 1e-9);
    }

    @Test
    void testLatencyWindowIsBounded() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        PerformanceTracker tracker = new PerformanceTracker(clock, 2);

        tracker.record("simple", Duration.ofMillis(1000), true, false);
        tracker.record("simple", Duration.ofMillis(10), true, false);
        tracker.record("simple", Duration.ofMillis(20), true, false);

        RoutingStatistics stats = tracker.summary();
        assertEquals(3, stats.getTotalQueries());
        assertEquals(20.0, stats.getLatency().getMaxMs(), 1e-9);
    }

    @Test
    void testEmptySummary() {
        PerformanceTracker tracker = new PerformanceTracker(MutableClock.startingAt("2026-03-01T12:00:00Z"), 10);

        RoutingStatistics stats = tracker.summary();
        assertEquals(0, stats.getTotalQueries());
        assertEquals(0.0, stats.getErrorRate());
        assertTrue(stats.getModelDistribution().isEmpty());
    }
}
