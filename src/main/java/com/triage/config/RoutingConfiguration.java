package com.triage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.triage.model.ModelProfile;
import com.triage.provider.InferenceClient;
import com.triage.service.anomaly.AnomalyDetector;
import com.triage.service.cache.ResponseCache;
import com.triage.service.catalog.ModelCatalog;
import com.triage.service.feature.ComplexityEstimator;
import com.triage.service.feature.FeatureExtractor;
import com.triage.service.feature.StopWords;
import com.triage.service.monitor.JvmSystemMetricsProbe;
import com.triage.service.monitor.LoadMonitor;
import com.triage.service.monitor.PerformanceTracker;
import com.triage.service.monitor.SystemMetricsProbe;
import com.triage.service.routing.ModelSelector;
import com.triage.service.routing.RoutingEngine;
import com.triage.service.training.RecentQueryCorpusSource;
import com.triage.telemetry.LoggingTelemetrySink;
import com.triage.telemetry.TelemetryPublisher;
import com.triage.telemetry.TelemetrySink;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Wiring for the routing core: features, anomaly detection, catalog, selection and load.
 */
@Configuration
public class RoutingConfiguration {

    private final TriageProperties properties;

    public RoutingConfiguration(TriageProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Built once at startup; an invalid table fails the context.
     */
    @Bean
    public ModelCatalog modelCatalog() {
        List<ModelProfile> profiles = new ArrayList<>();
        for (Map.Entry<String, TriageProperties.ProfileConfig> entry : properties.getModels().entrySet()) {
            TriageProperties.ProfileConfig config = entry.getValue();
            profiles.add(ModelProfile.builder()
                    .name(entry.getKey())
                    .model(config.getModel())
                    .threshold(config.getThreshold())
                    .minComplexity(config.getMinComplexity())
                    .resourceIntensity(config.getResourceIntensity())
                    .build());
        }
        return new ModelCatalog(profiles);
    }

    @Bean
    public FeatureExtractor featureExtractor() {
        TriageProperties.FeatureConfig config = properties.getFeatures();
        Collection<String> stopWords = config.getStopWords().isEmpty() ? StopWords.ENGLISH : config.getStopWords();
        return new FeatureExtractor(config.getMaxFeatures(), stopWords);
    }

    @Bean
    public ComplexityEstimator complexityEstimator() {
        return new ComplexityEstimator(properties.getFeatures().getRarityWeight());
    }

    @Bean
    public AnomalyDetector anomalyDetector() {
        TriageProperties.AnomalyConfig config = properties.getAnomaly();
        return new AnomalyDetector(config.getEstimatorCount(), config.getContamination(),
                config.getMaxSamples(), config.getMinSamples(), config.getSeed());
    }

    @Bean
    public ModelSelector modelSelector() {
        TriageProperties.RoutingConfig config = properties.getRouting();
        return new ModelSelector(config.getLoadSensitivity(), config.getInFlightCapacity());
    }

    @Bean
    public LoggingTelemetrySink loggingTelemetrySink(ObjectMapper objectMapper) {
        return new LoggingTelemetrySink(objectMapper);
    }

    @Bean
    public TelemetryPublisher telemetryPublisher(List<TelemetrySink> sinks) {
        return new TelemetryPublisher(sinks);
    }

    @Bean
    public SystemMetricsProbe systemMetricsProbe() {
        return new JvmSystemMetricsProbe();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public LoadMonitor loadMonitor(SystemMetricsProbe probe, TelemetryPublisher telemetry, Clock clock) {
        return new LoadMonitor(probe, telemetry, clock, properties.getMonitor().getInterval());
    }

    @Bean
    public PerformanceTracker performanceTracker(Clock clock) {
        return new PerformanceTracker(clock, properties.getMonitor().getStatsWindow());
    }

    @Bean
    public RecentQueryCorpusSource recentQueryCorpusSource() {
        return new RecentQueryCorpusSource(properties.getTraining().getHistorySize());
    }

    @Bean
    public RoutingEngine routingEngine(FeatureExtractor extractor,
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
                                       Clock clock) {
        TriageProperties.RoutingConfig config = properties.getRouting();
        return RoutingEngine.builder()
                .extractor(extractor)
                .complexityEstimator(complexityEstimator)
                .detector(detector)
                .catalog(catalog)
                .selector(selector)
                .loadMonitor(loadMonitor)
                .cache(cache)
                .inference(inference)
                .telemetry(telemetry)
                .tracker(tracker)
                .history(history)
                .clock(clock)
                .maxRetries(config.getMaxRetries())
                .waitTimeout(config.getWaitTimeout())
                .build();
    }
}
