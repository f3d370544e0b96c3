package com.triage.service.routing;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.triage.exception.InferenceTimeoutException;
import com.triage.exception.InferenceUnavailableException;
import com.triage.exception.NotFittedException;
import com.triage.model.CacheEntry;
import com.triage.model.ModelProfile;
import com.triage.model.Query;
import com.triage.model.RoutingDecision;
import com.triage.provider.InferenceClient;
import com.triage.repository.CaffeineResponseStore;
import com.triage.service.anomaly.AnomalyDetector;
import com.triage.service.cache.ResponseCache;
import com.triage.service.catalog.ModelCatalog;
import com.triage.service.feature.ComplexityEstimator;
import com.triage.service.feature.FeatureExtractor;
import com.triage.service.feature.StopWords;
import com.triage.service.monitor.LoadMonitor;
import com.triage.service.monitor.PerformanceTracker;
import com.triage.service.monitor.SystemMetricsProbe;
import com.triage.service.training.RecentQueryCorpusSource;
import com.triage.service.training.SeedCorpusSource;
import com.triage.service.training.TrainingService;
import com.triage.support.MutableClock;
import com.triage.telemetry.TelemetryPublisher;
import com.triage.telemetry.TelemetrySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for RoutingEngine.
 */
class RoutingEngineTest {

    private static final String QUERY = "What is the capital of Spain?";

    private MutableClock clock;
    private ExecutorService executor;
    private FeatureExtractor extractor;
    private AnomalyDetector detector;
    private LoadMonitor loadMonitor;
    private InferenceClient inference;
    private TelemetrySink sink;
    private PerformanceTracker tracker;
    private RecentQueryCorpusSource history;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        executor = Executors.newCachedThreadPool();

        extractor = new FeatureExtractor(50, StopWords.ENGLISH);
        detector = new AnomalyDetector(50, 0.1, 128, 10, 21L);
        new TrainingService(extractor, detector,
                List.of(new SeedCorpusSource(new ClassPathResource("corpus/seed-queries.txt"))), clock).retrain();

        SystemMetricsProbe probe = mock(SystemMetricsProbe.class);
        loadMonitor = new LoadMonitor(probe, TelemetryPublisher.none(), clock, Duration.ofSeconds(60));
        inference = mock(InferenceClient.class);
        sink = mock(TelemetrySink.class);
        tracker = new PerformanceTracker(clock, 100);
        history = new RecentQueryCorpusSource(10);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testRoutesAndServesFromCache() {
        when(inference.invoke(anyString(), anyString())).thenReturn("Madrid");
        RoutingEngine engine = engine(standardCatalog(), 1, Duration.ofSeconds(5));

        RouteResult first = engine.route(query(QUERY));
        RouteResult second = engine.route(query(QUERY));

        assertEquals("Madrid", first.getResponseText());
        assertFalse(first.isCacheHit());
        assertEquals("Madrid", second.getResponseText());
        assertTrue(second.isCacheHit());
        assertEquals(first.getServedBy(), second.getServedBy());
        verify(inference, times(1)).invoke(anyString(), anyString());

        double anomaly = first.getDecision().getAnomalyScore();
        assertTrue(anomaly >= 0.0 && anomaly <= 1.0);
        assertEquals(0, loadMonitor.getInFlight());
        assertEquals(2, tracker.summary().getTotalQueries());
        assertEquals(2, history.size());
        verify(sink, times(2)).recordDecision(any(RoutingDecision.class));
    }

    @Test
    void testShortQueryGoesToZeroFloorProfile() {
        RoutingEngine engine = engine(standardCatalog(), 1, Duration.ofSeconds(5));

        RoutingDecision decision = engine.decide(query("hi"));

        assertEquals("simple", decision.getProfile().getName());
        assertTrue(decision.getComplexityScore() < 10);
    }

    @Test
    void testRetryMovesToCheaperProfile() {
        ModelCatalog catalog = new ModelCatalog(List.of(
                profile("small", 0.01, 0, 1),
                profile("large", 0.02, 0, 5)));
        when(inference.invoke(eq("large-model"), anyString()))
                .thenThrow(new InferenceUnavailableException("large-model", "connection refused"));
        when(inference.invoke(eq("small-model"), anyString())).thenReturn("fallback answer");
        RoutingEngine engine = engine(catalog, 1, Duration.ofSeconds(5));

        RouteResult result = engine.route(query(QUERY));

        assertEquals("large", result.getDecision().getProfile().getName());
        assertEquals("small", result.getServedBy().getName());
        assertEquals("fallback answer", result.getResponseText());
        assertEquals(2, result.getAttempts());
    }

    @Test
    void testRetrySameProfileWhenNothingCheaper() {
        ModelCatalog catalog = new ModelCatalog(List.of(profile("only", 0.5, 0, 1)));
        when(inference.invoke(eq("only-model"), anyString()))
                .thenThrow(new InferenceUnavailableException("only-model", "overloaded"))
                .thenReturn("second time lucky");
        RoutingEngine engine = engine(catalog, 1, Duration.ofSeconds(5));

        RouteResult result = engine.route(query(QUERY));

        assertEquals("second time lucky", result.getResponseText());
        assertEquals(2, result.getAttempts());
        verify(inference, times(2)).invoke(eq("only-model"), anyString());
    }

    @Test
    void testExhaustedRetriesSurfaceFailure() {
        when(inference.invoke(anyString(), anyString()))
                .thenThrow(new InferenceUnavailableException("any", "down"));
        RoutingEngine engine = engine(standardCatalog(), 1, Duration.ofSeconds(5));

        assertThrows(InferenceUnavailableException.class, () -> engine.route(query(QUERY)));

        assertEquals(1.0, tracker.summary().getErrorRate(), 1e-9);
        assertEquals(0, loadMonitor.getInFlight());
        assertEquals(0, history.size());
    }

    @Test
    void testWaitTimeoutBecomesInferenceTimeout() {
        CountDownLatch release = new CountDownLatch(1);
        when(inference.invoke(anyString(), anyString())).thenAnswer(invocation -> {
            release.await();
            return "too late";
        });
        RoutingEngine engine = engine(standardCatalog(), 0, Duration.ofMillis(50));
        try {
            assertThrows(InferenceTimeoutException.class, () -> engine.route(query(QUERY)));
        } finally {
            release.countDown();
        }
    }

    @Test
    void testNotFittedFailsRequest() {
        FeatureExtractor unfitted = new FeatureExtractor(50, StopWords.ENGLISH);
        RoutingEngine engine = RoutingEngine.builder()
                .extractor(unfitted)
                .complexityEstimator(new ComplexityEstimator(0.5))
                .detector(detector)
                .catalog(standardCatalog())
                .selector(new ModelSelector(0.5, 32))
                .loadMonitor(loadMonitor)
                .cache(cache())
                .inference(inference)
                .clock(clock)
                .maxRetries(1)
                .waitTimeout(Duration.ofSeconds(5))
                .build();

        assertThrows(NotFittedException.class, () -> engine.route(query(QUERY)));
        assertEquals(0, loadMonitor.getInFlight());
        verify(inference, times(0)).invoke(anyString(), anyString());
    }

    @Test
    void testStaleLoadIsFlaggedButRoutes() {
        when(inference.invoke(anyString(), anyString())).thenReturn("ok");
        RoutingEngine engine = engine(standardCatalog(), 1, Duration.ofSeconds(5));
        clock.advance(Duration.ofMinutes(5));

        RouteResult result = engine.route(query(QUERY));

        assertTrue(result.getDecision().isLoadDegraded());
        assertEquals("ok", result.getResponseText());
    }

    @Test
    void testTelemetryFailureDoesNotAbortRouting() {
        when(inference.invoke(anyString(), anyString())).thenReturn("ok");
        doThrow(new RuntimeException("exporter down")).when(sink).recordDecision(any());
        RoutingEngine engine = engine(standardCatalog(), 1, Duration.ofSeconds(5));

        assertEquals("ok", engine.route(query(QUERY)).getResponseText());
    }

    @Test
    void testQueryPreviewIsTruncated() {
        RoutingEngine engine = engine(standardCatalog(), 1, Duration.ofSeconds(5));
        String longText = "word ".repeat(60);

        RoutingDecision decision = engine.decide(query(longText));

        assertEquals(100, decision.getQueryPreview().length());
    }

    private RoutingEngine engine(ModelCatalog catalog, int maxRetries, Duration waitTimeout) {
        return RoutingEngine.builder()
                .extractor(extractor)
                .complexityEstimator(new ComplexityEstimator(0.5))
                .detector(detector)
                .catalog(catalog)
                .selector(new ModelSelector(0.5, 32))
                .loadMonitor(loadMonitor)
                .cache(cache())
                .inference(inference)
                .telemetry(new TelemetryPublisher(List.of(sink)))
                .tracker(tracker)
                .history(history)
                .clock(clock)
                .maxRetries(maxRetries)
                .waitTimeout(waitTimeout)
                .build();
    }

    private ResponseCache cache() {
        return new ResponseCache(new CaffeineResponseStore(Caffeine.newBuilder().<String, CacheEntry>build()),
                Duration.ofHours(1), clock, executor, true);
    }

    private Query query(String text) {
        return Query.of(text, null, clock.instant());
    }

    private static ModelCatalog standardCatalog() {
        return new ModelCatalog(List.of(
                profile("simple", 0.3, 0, 1),
                profile("technical", 0.5, 10, 3),
                profile("analytical", 0.6, 15, 5)));
    }

    private static ModelProfile profile(String name, double threshold, double minComplexity, int intensity) {
        return ModelProfile.builder()
                .name(name)
                .model(name + "-model")
                .threshold(threshold)
                .minComplexity(minComplexity)
                .resourceIntensity(intensity)
                .build();
    }
}
