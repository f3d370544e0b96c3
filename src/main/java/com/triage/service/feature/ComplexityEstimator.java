package com.triage.service.feature;

import com.triage.model.FeatureVector;

/**
 * Deterministic complexity score derived from a feature vector.
 *
 * complexity = tokenCount + rarityWeight * outOfVocabularyCount
 *
 * Both counts only grow as tokens are appended, so the score is non-decreasing
 * in query length under a fixed vocabulary.
 */
public class ComplexityEstimator {

    private final double rarityWeight;

    public ComplexityEstimator(double rarityWeight) {
        if (rarityWeight < 0 || Double.isNaN(rarityWeight)) {
            throw new IllegalArgumentException("rarityWeight must be non-negative, got " + rarityWeight);
        }
        this.rarityWeight = rarityWeight;
    }

    public double estimate(FeatureVector vector) {
        return vector.scalar(FeatureVector.Scalar.TOKEN_COUNT)
                + rarityWeight * vector.scalar(FeatureVector.Scalar.RARE_TOKEN_COUNT);
    }
}
