package com.triage.service.training;

import com.triage.exception.NotFittedException;
import com.triage.model.FeatureVector;
import com.triage.model.dto.TrainingReport;
import com.triage.service.anomaly.AnomalyDetector;
import com.triage.service.feature.FeatureExtractor;
import com.triage.service.feature.StopWords;
import com.triage.service.feature.Vocabulary;
import com.triage.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for TrainingService.
 */
class TrainingServiceTest {

    private FeatureExtractor extractor;
    private AnomalyDetector detector;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        extractor = new FeatureExtractor(50, StopWords.ENGLISH);
        detector = new AnomalyDetector(50, 0.1, 128, 10, 5L);
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    }

    @Test
    void testFitsFromSeedCorpus() {
        TrainingService service = new TrainingService(extractor, detector,
                List.of(new SeedCorpusSource(new ClassPathResource("corpus/seed-queries.txt"))), clock);

        TrainingReport report = service.retrain();

        assertTrue(report.isFitted());
        assertTrue(extractor.isFitted());
        assertTrue(detector.isFitted());
        assertEquals(50, report.getVocabularySize());
        assertTrue(detector.getModalities().containsAll(List.of("simple", "technical", "analytical")));
        assertFalse(detector.getModalities().contains(AnomalyDetector.UNION));
        assertEquals(clock.instant(), report.getCompletedAt());

        double score = detector.scoreAnomaly(extractor.extract("What is the capital of Spain?"));
        assertTrue(score >= 0.0 && score <= 1.0);
    }

    @Test
    void testSmallBatchIsSkipped() {
        RecentQueryCorpusSource recent = new RecentQueryCorpusSource(100);
        recent.record("simple", "hello there");
        recent.record("simple", "what time is it");
        TrainingService service = new TrainingService(extractor, detector, List.of(recent), clock);

        TrainingReport report = service.retrain();

        assertFalse(report.isFitted());
        assertNotNull(report.getReason());
        assertEquals(2, report.getDocuments());
        assertThrows(NotFittedException.class, () -> extractor.extract("hello"));
    }

    @Test
    void testSkippedRefitKeepsPreviousModel() {
        RecentQueryCorpusSource recent = new RecentQueryCorpusSource(100);
        for (int i = 0; i < 12; i++) {
            recent.record("simple", "query number " + i + " about topic " + (i % 3));
        }
        TrainingService service = new TrainingService(extractor, detector, List.of(recent), clock);
        assertTrue(service.retrain().isFitted());

        TrainingService starved = new TrainingService(extractor, detector, List.of(new RecentQueryCorpusSource(5)), clock);
        assertFalse(starved.retrain().isFitted());

        assertTrue(extractor.isFitted());
        assertTrue(detector.isFitted());
    }

    @Test
    void testFailingSourceIsSkipped() {
        HistoricalCorpusSource broken = mock(HistoricalCorpusSource.class);
        when(broken.getName()).thenReturn("broken");
        when(broken.fetch()).thenThrow(new IllegalStateException("unreachable"));
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            texts.add("sample query " + i);
        }
        HistoricalCorpusSource healthy = mock(HistoricalCorpusSource.class);
        when(healthy.getName()).thenReturn("healthy");
        when(healthy.fetch()).thenReturn(Map.of("simple", texts));

        TrainingReport report = new TrainingService(extractor, detector, List.of(broken, healthy), clock).retrain();

        assertTrue(report.isFitted());
        assertEquals(15, report.getDocuments());
    }

    @Test
    void testVocabularyPublishedOnlyAfterDetectorRefit() {
        RecordingDetector recording = new RecordingDetector(extractor, false);
        new TrainingService(extractor, recording, List.of(history("password reset request")), clock).retrain();
        Vocabulary previous = extractor.getVocabulary();

        TrainingReport report = new TrainingService(extractor, recording,
                List.of(history("quantum lattice entanglement")), clock).retrain();

        assertTrue(report.isFitted());
        assertSame(previous, recording.vocabularyDuringFit);
        assertNotSame(previous, extractor.getVocabulary());
        assertTrue(extractor.getVocabulary().contains("quantum"));
        assertFalse(extractor.getVocabulary().contains("password"));
    }

    @Test
    void testFailedDetectorRefitKeepsPreviousVocabulary() {
        RecordingDetector recording = new RecordingDetector(extractor, true);
        new TrainingService(extractor, recording, List.of(history("password reset request")), clock).retrain();
        Vocabulary previous = extractor.getVocabulary();

        TrainingService refit = new TrainingService(extractor, recording,
                List.of(history("quantum lattice entanglement")), clock);

        assertThrows(IllegalStateException.class, refit::retrain);
        assertSame(previous, extractor.getVocabulary());
        assertTrue(extractor.getVocabulary().contains("password"));
        assertTrue(recording.isFitted());
    }

    private static RecentQueryCorpusSource history(String topic) {
        RecentQueryCorpusSource source = new RecentQueryCorpusSource(100);
        for (int i = 0; i < 12; i++) {
            source.record("simple", topic + " case " + (i % 4));
        }
        return source;
    }

    /**
     * Captures the extractor's published vocabulary when a fit starts; optionally fails every refit.
     */
    private static class RecordingDetector extends AnomalyDetector {

        private final FeatureExtractor extractor;
        private final boolean failOnRefit;
        private int fits;
        private Vocabulary vocabularyDuringFit;

        RecordingDetector(FeatureExtractor extractor, boolean failOnRefit) {
            super(50, 0.1, 128, 10, 5L);
            this.extractor = extractor;
            this.failOnRefit = failOnRefit;
        }

        @Override
        public void fit(Map<String, List<FeatureVector>> historyByModality) {
            fits++;
            vocabularyDuringFit = extractor.getVocabulary();
            if (failOnRefit && fits > 1) {
                throw new IllegalStateException("forest build failed");
            }
            super.fit(historyByModality);
        }
    }
}
