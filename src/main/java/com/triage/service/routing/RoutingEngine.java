package com.triage.service.routing;

import com.triage.exception.InferenceException;
import com.triage.exception.InferenceTimeoutException;
import com.triage.model.AnomalyResult;
import com.triage.model.FeatureVector;
import com.triage.model.LoadSnapshot;
import com.triage.model.ModelProfile;
import com.triage.model.Query;
import com.triage.model.RoutingDecision;
import com.triage.provider.InferenceClient;
import com.triage.service.anomaly.AnomalyDetector;
import com.triage.service.cache.CacheKeys;
import com.triage.service.cache.CacheLookup;
import com.triage.service.cache.ResponseCache;
import com.triage.service.catalog.ModelCatalog;
import com.triage.service.feature.ComplexityEstimator;
import com.triage.service.feature.FeatureExtractor;
import com.triage.service.monitor.LoadMonitor;
import com.triage.service.monitor.PerformanceTracker;
import com.triage.service.training.RecentQueryCorpusSource;
import com.triage.telemetry.TelemetryPublisher;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Routes queries to model profiles and executes them through the response cache.
 *
 * Flow:
 * 1. Extract features, score anomaly and complexity
 * 2. Combine anomaly with the current load into a risk score and select a profile
 * 3. Publish the decision to telemetry
 * 4. Serve from cache, or invoke the model once for all concurrent callers of the same key
 * 5. On inference failure retry against a cheaper eligible profile, else the same one
 */
@Slf4j
public class RoutingEngine {

    private static final int PREVIEW_LENGTH = 100;

    private final FeatureExtractor extractor;
    private final ComplexityEstimator complexityEstimator;
    private final AnomalyDetector detector;
    private final ModelCatalog catalog;
    private final ModelSelector selector;
    private final LoadMonitor loadMonitor;
    private final ResponseCache cache;
    private final InferenceClient inference;
    private final TelemetryPublisher telemetry;
    private final PerformanceTracker tracker;
    private final RecentQueryCorpusSource history;
    private final Clock clock;
    private final int maxRetries;
    private final Duration waitTimeout;

    @Builder
    public RoutingEngine(FeatureExtractor extractor,
                         ComplexityEstimator complexityEstimator,
                         AnomalyDetector detector,
                         ModelCatalog catalog,
                         ModelSelector selector,
                         LoadMonitor loadMonitor,
                         ResponseCache cache,
                         InferenceClient inference,
                         TelemetryPublisher telemetry,
                         PerformanceTracker tracker,
                         RecentQueryCorpusSource history,
                         Clock clock,
                         int maxRetries,
                         Duration waitTimeout) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative, got " + maxRetries);
        }
        this.extractor = extractor;
        this.complexityEstimator = complexityEstimator;
        this.detector = detector;
        this.catalog = catalog;
        this.selector = selector;
        this.loadMonitor = loadMonitor;
        this.cache = cache;
        this.inference = inference;
        this.telemetry = telemetry != null ? telemetry : TelemetryPublisher.none();
        this.tracker = tracker;
        this.history = history;
        this.clock = clock;
        this.maxRetries = maxRetries;
        this.waitTimeout = waitTimeout;
    }

    /**
     * Route and execute a query.
     *
     * @throws com.triage.exception.NotFittedException   if no model has been trained yet
     * @throws com.triage.exception.RoutingException     if no profile is eligible
     * @throws InferenceException                        once retries are exhausted
     */
    public RouteResult route(Query query) {
        Instant start = clock.instant();
        loadMonitor.requestStarted();
        String servedModel = null;
        boolean success = false;
        boolean cacheHit = false;
        try {
            RoutingDecision decision = decide(query);
            telemetry.publishDecision(decision);

            RouteResult result = execute(query, decision);
            servedModel = result.getServedBy().getName();
            cacheHit = result.isCacheHit();
            success = true;

            if (history != null) {
                history.record(result.getServedBy().getName(), query.getText());
            }
            log.info("Query {} served by {} (anomaly={}, complexity={}, cacheHit={}, attempts={})",
                    query.getId(), result.getServedBy().getName(),
                    String.format("%.3f", decision.getAnomalyScore()),
                    String.format("%.1f", decision.getComplexityScore()),
                    cacheHit, result.getAttempts());
            return result;
        } finally {
            loadMonitor.requestFinished();
            if (tracker != null) {
                tracker.record(servedModel, Duration.between(start, clock.instant()), success, cacheHit);
            }
        }
    }

    /**
     * Pure routing decision for a query, without executing it.
     */
    public RoutingDecision decide(Query query) {
        FeatureVector vector = extractor.extract(query.getText());
        AnomalyResult anomaly = detector.score(vector);
        double complexity = complexityEstimator.estimate(vector);

        LoadSnapshot load = loadMonitor.current();
        boolean degraded = loadMonitor.isDegraded();
        if (degraded) {
            log.warn("Load snapshot from {} is stale, routing on last known load", load.getCapturedAt());
        }

        double risk = selector.riskScore(anomaly.getScore(), load);
        ModelProfile profile = selector.select(complexity, risk, catalog);
        log.debug("Query {}: anomaly={} ({}), complexity={}, risk={} -> {}",
                query.getId(), anomaly.getScore(), anomaly.getModality(), complexity, risk, profile.getName());

        return RoutingDecision.builder()
                .queryId(query.getId())
                .queryPreview(preview(query.getText()))
                .profile(profile)
                .anomalyScore(anomaly.getScore())
                .anomalous(anomaly.isAnomalous())
                .complexityScore(complexity)
                .riskScore(risk)
                .load(load)
                .loadDegraded(degraded)
                .decidedAt(clock.instant())
                .build();
    }

    private RouteResult execute(Query query, RoutingDecision decision) {
        ModelProfile profile = decision.getProfile();
        InferenceException failure = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            try {
                CacheLookup lookup = invokeThroughCache(profile, query.getText());
                return RouteResult.builder()
                        .decision(decision)
                        .servedBy(profile)
                        .responseText(lookup.getPayload())
                        .cacheHit(lookup.isCacheHit())
                        .attempts(attempt)
                        .build();
            } catch (InferenceException e) {
                failure = e;
                if (attempt <= maxRetries) {
                    ModelProfile next = selector
                            .cheaperAlternative(profile, decision.getComplexityScore(), catalog)
                            .orElse(profile);
                    log.warn("Inference on {} failed ({}), retrying with {}",
                            profile.getName(), e.getMessage(), next.getName());
                    profile = next;
                }
            }
        }
        log.error("Query {} failed after {} attempt(s): {}", query.getId(), maxRetries + 1, failure.getMessage());
        throw failure;
    }

    private CacheLookup invokeThroughCache(ModelProfile profile, String text) {
        String key = CacheKeys.fingerprint(text, profile.getModel());
        try {
            return cache.getOrCompute(key, () -> inference.invoke(profile.getModel(), text), waitTimeout);
        } catch (TimeoutException e) {
            throw new InferenceTimeoutException(profile.getModel(),
                    "Gave up waiting " + waitTimeout + " for " + profile.getModel(), e);
        }
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH);
    }
}
