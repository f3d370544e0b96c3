package com.triage.config;

import com.triage.service.anomaly.AnomalyDetector;
import com.triage.service.feature.FeatureExtractor;
import com.triage.service.training.RecentQueryCorpusSource;
import com.triage.service.training.SeedCorpusSource;
import com.triage.service.training.TrainingService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.List;

/**
 * Refit pipeline wiring and scheduling.
 */
@Configuration
@EnableScheduling
public class TrainingConfiguration {

    private final TriageProperties properties;

    public TrainingConfiguration(TriageProperties properties) {
        this.properties = properties;
    }

    @Bean
    public SeedCorpusSource seedCorpusSource(ResourceLoader resourceLoader) {
        return new SeedCorpusSource(resourceLoader.getResource(properties.getTraining().getSeedCorpus()));
    }

    @Bean
    public TrainingService trainingService(FeatureExtractor extractor,
                                           AnomalyDetector detector,
                                           SeedCorpusSource seedCorpusSource,
                                           RecentQueryCorpusSource recentQueryCorpusSource,
                                           Clock clock) {
        return new TrainingService(extractor, detector, List.of(seedCorpusSource, recentQueryCorpusSource), clock);
    }
}
