package com.triage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Triage.
 */
@Data
@Component
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    private FeatureConfig features = new FeatureConfig();
    private AnomalyConfig anomaly = new AnomalyConfig();
    private Map<String, ProfileConfig> models = new LinkedHashMap<>();
    private RoutingConfig routing = new RoutingConfig();
    private CacheConfig cache = new CacheConfig();
    private MonitorConfig monitor = new MonitorConfig();
    private TrainingConfig training = new TrainingConfig();
    private InferenceConfig inference = new InferenceConfig();

    @Data
    public static class FeatureConfig {
        private int maxFeatures = 50;
        /**
         * Empty means the built-in English list.
         */
        private List<String> stopWords = new ArrayList<>();
        private double rarityWeight = 0.5;
    }

    @Data
    public static class AnomalyConfig {
        private int estimatorCount = 100;
        private double contamination = 0.1;
        private int maxSamples = 256;
        private int minSamples = 10;
        private Long seed;
    }

    @Data
    public static class ProfileConfig {
        private String model;
        private double threshold;
        private double minComplexity;
        private int resourceIntensity = 1;
    }

    @Data
    public static class RoutingConfig {
        /**
         * Weight of normalized in-flight load added to the anomaly score.
         */
        private double loadSensitivity = 0.5;
        /**
         * In-flight request count that counts as full load.
         */
        private int inFlightCapacity = 32;
        private int maxRetries = 1;
        private Duration waitTimeout = Duration.ofSeconds(120);
        private int inferenceThreads = 16;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(24);
        private int maxSize = 10000;
        /**
         * "memory" or "redis".
         */
        private String store = "memory";
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class MonitorConfig {
        private Duration interval = Duration.ofSeconds(60);
        /**
         * Number of recent latencies kept for the statistics summary.
         */
        private int statsWindow = 1000;
    }

    @Data
    public static class TrainingConfig {
        private boolean enabled = true;
        private Duration refitInterval = Duration.ofMinutes(30);
        private String seedCorpus = "classpath:corpus/seed-queries.txt";
        private int historySize = 100;
    }

    @Data
    public static class InferenceConfig {
        private String baseUrl = "http://localhost:11434";
        private Duration timeout = Duration.ofSeconds(60);
    }
}
