package com.triage.service.feature;

import com.triage.exception.NotFittedException;
import com.triage.model.FeatureVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FeatureExtractor.
 */
class FeatureExtractorTest {

    private static final List<String> CORPUS = List.of(
            "How do I reset my password",
            "Reset the router password",
            "What is the capital of France",
            "Explain database indexing strategies",
            "How do database transactions work"
    );

    private FeatureExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new FeatureExtractor(8, StopWords.ENGLISH);
    }

    @Test
    void testExtractBeforeFitFails() {
        assertFalse(extractor.isFitted());
        assertThrows(NotFittedException.class, () -> extractor.extract("anything"));
    }

    @Test
    void testFitOnEmptyCorpusFails() {
        assertThrows(IllegalArgumentException.class, () -> extractor.fit(List.of()));
    }

    @Test
    void testVectorLengthIsFixed() {
        extractor.fit(CORPUS);

        for (String text : List.of("", "password", "a completely unrelated and much longer query about astronomy",
                "!!!???")) {
            FeatureVector vector = extractor.extract(text);
            assertEquals(extractor.dimension(), vector.dimension());
            assertEquals(8 + FeatureVector.SCALAR_COUNT, vector.dimension());
        }
    }

    @Test
    void testSmallVocabularyIsZeroPadded() {
        FeatureExtractor wide = new FeatureExtractor(500, StopWords.ENGLISH);
        Vocabulary vocabulary = wide.fit(CORPUS);

        assertTrue(vocabulary.size() < 500);
        assertEquals(500 + FeatureVector.SCALAR_COUNT, wide.extract("reset password").dimension());
    }

    @Test
    void testVocabularyKeepsMostFrequentTerms() {
        FeatureExtractor narrow = new FeatureExtractor(2, StopWords.ENGLISH);
        Vocabulary vocabulary = narrow.fit(CORPUS);

        // "database", "password" and "reset" all appear twice; alphabetical order breaks the tie
        assertEquals(2, vocabulary.size());
        assertTrue(vocabulary.contains("database"));
        assertTrue(vocabulary.contains("password"));
        assertFalse(vocabulary.contains("reset"));
        assertFalse(vocabulary.contains("how"), "stop words are never kept");
    }

    @Test
    void testTermWeightsAreL2Normalized() {
        extractor.fit(CORPUS);
        FeatureVector vector = extractor.extract("reset password database");

        double sumOfSquares = 0;
        for (int i = 0; i < vector.termDimensions(); i++) {
            sumOfSquares += vector.get(i) * vector.get(i);
        }
        assertEquals(1.0, sumOfSquares, 1e-9);
    }

    @Test
    void testScalarFeatures() {
        extractor.fit(CORPUS);
        FeatureVector vector = extractor.extract("Reset password, quantum chromodynamics!");

        assertEquals(39, vector.scalar(FeatureVector.Scalar.CHAR_LENGTH));
        assertEquals(4, vector.scalar(FeatureVector.Scalar.TOKEN_COUNT));
        assertEquals(2.0 / 39, vector.scalar(FeatureVector.Scalar.PUNCTUATION_DENSITY), 1e-9);
        assertEquals(2, vector.scalar(FeatureVector.Scalar.RARE_TOKEN_COUNT));
    }

    @Test
    void testEmptyTextProducesZeroVector() {
        extractor.fit(CORPUS);
        FeatureVector vector = extractor.extract("");

        for (int i = 0; i < vector.dimension(); i++) {
            assertEquals(0.0, vector.get(i));
        }
    }

    @Test
    void testRefitDoesNotChangeSnapshotVectors() {
        Vocabulary first = extractor.fit(CORPUS);
        FeatureVector before = extractor.extract(first, "reset password");

        extractor.fit(List.of("completely different words here", "nothing overlapping at all"));

        assertEquals(before, extractor.extract(first, "reset password"));
        assertNotEquals(before, extractor.extract("reset password"));
    }
}
