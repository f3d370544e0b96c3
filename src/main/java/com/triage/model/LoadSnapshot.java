package com.triage.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of system load. Utilizations are fractions in [0, 1].
 */
@Value
@Builder
public class LoadSnapshot {

    double cpuUtilization;

    double memoryUtilization;

    int inFlightRequestCount;

    Instant capturedAt;

    public static LoadSnapshot initial(Instant now) {
        return LoadSnapshot.builder()
                .cpuUtilization(0.0)
                .memoryUtilization(0.0)
                .inFlightRequestCount(0)
                .capturedAt(now)
                .build();
    }

    /**
     * A snapshot older than twice the refresh interval is stale.
     */
    public boolean isStale(Instant now, Duration refreshInterval) {
        return Duration.between(capturedAt, now).compareTo(refreshInterval.multipliedBy(2)) > 0;
    }
}
