package com.triage.service.training;

import com.triage.model.FeatureVector;
import com.triage.model.dto.TrainingReport;
import com.triage.service.anomaly.AnomalyDetector;
import com.triage.service.feature.FeatureExtractor;
import com.triage.service.feature.Vocabulary;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Refits the feature extractor and anomaly detector from all corpus sources.
 *
 * Steps:
 * 1. Pull every source and merge texts per modality
 * 2. Skip the cycle when the merged corpus is below the detector's minimum
 * 3. Build a new extractor vocabulary on all texts, unpublished
 * 4. Vectorize each modality with that vocabulary and fit the detector
 * 5. Publish the vocabulary once the detector has been replaced
 *
 * Cycles are serialized; scoring continues on the previously published models meanwhile.
 * A failed detector fit leaves both previous models in place.
 */
@Slf4j
public class TrainingService {

    private final FeatureExtractor extractor;
    private final AnomalyDetector detector;
    private final List<HistoricalCorpusSource> sources;
    private final Clock clock;

    public TrainingService(FeatureExtractor extractor, AnomalyDetector detector,
                           List<HistoricalCorpusSource> sources, Clock clock) {
        this.extractor = extractor;
        this.detector = detector;
        this.sources = List.copyOf(sources);
        this.clock = clock;
    }

    public synchronized TrainingReport retrain() {
        Map<String, List<String>> corpus = collect();
        List<String> all = new ArrayList<>();
        Map<String, Integer> sizes = new LinkedHashMap<>();
        corpus.forEach((modality, texts) -> {
            all.addAll(texts);
            sizes.put(modality, texts.size());
        });

        if (all.size() < detector.getMinSamples()) {
            String reason = "Insufficient history: " + all.size() + " queries (< " + detector.getMinSamples() + ")";
            log.warn("Skipping refit: {}", reason);
            return TrainingReport.builder()
                    .fitted(false)
                    .documents(all.size())
                    .modalitySizes(sizes)
                    .vocabularySize(extractor.isFitted() ? extractor.getVocabulary().size() : 0)
                    .reason(reason)
                    .completedAt(clock.instant())
                    .build();
        }

        long start = System.nanoTime();
        Vocabulary vocabulary = extractor.build(all);
        Map<String, List<FeatureVector>> vectors = new LinkedHashMap<>();
        corpus.forEach((modality, texts) -> vectors.put(modality, extractor.extractAll(vocabulary, texts)));
        detector.fit(vectors);
        extractor.publish(vocabulary);

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        log.info("Refit complete in {}ms: {} queries across {}", elapsedMs, all.size(), sizes.keySet());

        return TrainingReport.builder()
                .fitted(true)
                .documents(all.size())
                .modalitySizes(sizes)
                .vocabularySize(vocabulary.size())
                .completedAt(clock.instant())
                .build();
    }

    private Map<String, List<String>> collect() {
        Map<String, List<String>> merged = new LinkedHashMap<>();
        for (HistoricalCorpusSource source : sources) {
            Map<String, List<String>> batch;
            try {
                batch = source.fetch();
            } catch (RuntimeException e) {
                log.warn("Corpus source {} failed, skipping it this cycle", source.getName(), e);
                continue;
            }
            batch.forEach((modality, texts) ->
                    merged.computeIfAbsent(modality, k -> new ArrayList<>()).addAll(texts));
        }
        return merged;
    }
}
