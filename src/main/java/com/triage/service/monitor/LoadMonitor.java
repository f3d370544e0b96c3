package com.triage.service.monitor;

import com.triage.model.LoadSnapshot;
import com.triage.telemetry.TelemetryPublisher;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks system load on a fixed refresh interval.
 *
 * A single background thread writes snapshots; readers get the latest one through an
 * atomic reference and never block. A failed refresh keeps the previous snapshot, which
 * then ages into the degraded state instead of failing routing.
 */
@Slf4j
public class LoadMonitor {

    private final SystemMetricsProbe probe;
    private final TelemetryPublisher telemetry;
    private final Clock clock;
    private final Duration interval;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicReference<LoadSnapshot> snapshot;

    private ScheduledExecutorService scheduler;

    public LoadMonitor(SystemMetricsProbe probe, TelemetryPublisher telemetry, Clock clock, Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Monitor interval must be positive, got " + interval);
        }
        this.probe = probe;
        this.telemetry = telemetry;
        this.clock = clock;
        this.interval = interval;
        this.snapshot = new AtomicReference<>(LoadSnapshot.initial(clock.instant()));
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "load-monitor");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::refreshQuietly, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Load monitor started, interval={}", interval);
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        log.info("Load monitor stopped");
    }

    /**
     * Take a new snapshot and publish it.
     */
    public LoadSnapshot refresh() {
        LoadSnapshot next = LoadSnapshot.builder()
                .cpuUtilization(probe.cpuUtilization())
                .memoryUtilization(probe.memoryUtilization())
                .inFlightRequestCount(inFlight.get())
                .capturedAt(clock.instant())
                .build();
        snapshot.set(next);
        telemetry.publishLoad(next);
        return next;
    }

    /**
     * Most recent snapshot; never blocks on the refresh cycle.
     */
    public LoadSnapshot current() {
        return snapshot.get();
    }

    /**
     * True when the latest snapshot is older than twice the refresh interval.
     */
    public boolean isDegraded() {
        return snapshot.get().isStale(clock.instant(), interval);
    }

    public void requestStarted() {
        inFlight.incrementAndGet();
    }

    public void requestFinished() {
        inFlight.decrementAndGet();
    }

    /**
     * Live in-flight count (the snapshot holds the value at refresh time).
     */
    public int getInFlight() {
        return inFlight.get();
    }

    public Duration getInterval() {
        return interval;
    }

    private void refreshQuietly() {
        try {
            refresh();
        } catch (RuntimeException e) {
            log.warn("Load refresh failed, keeping snapshot from {}", snapshot.get().getCapturedAt(), e);
        }
    }
}
