package com.triage.service.anomaly;

import java.util.Arrays;
import java.util.Random;

/**
 * Immutable isolation-forest ensemble trained on one population.
 *
 * score(x) = 2^(-E[h(x)] / c(psi)) where h is the path length in one tree, psi the
 * per-tree sample size and c(n) the average path length of an unsuccessful search
 * in a binary search tree of n points.
 */
final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final IsolationTree[] trees;
    private final FeatureScaler scaler;
    private final double normalizer;
    private final double threshold;
    private final int trainingSize;

    private IsolationForest(IsolationTree[] trees, FeatureScaler scaler, double normalizer, int trainingSize,
                            double contamination, double[][] scaledTraining) {
        this.trees = trees;
        this.scaler = scaler;
        this.normalizer = normalizer;
        this.trainingSize = trainingSize;
        this.threshold = computeThreshold(scaledTraining, contamination);
    }

    /**
     * Train a forest.
     *
     * @param data          training rows, at least two, all of equal length
     * @param estimators    number of trees
     * @param maxSamples    per-tree sub-sample size cap
     * @param contamination expected share of anomalies, in (0, 0.5]
     */
    static IsolationForest fit(double[][] data, int estimators, int maxSamples, double contamination, Random random) {
        if (data.length < 2) {
            throw new IllegalArgumentException("Isolation forest needs at least 2 samples, got " + data.length);
        }
        FeatureScaler scaler = FeatureScaler.fit(data);
        double[][] scaled = scaler.transform(data);

        int sampleSize = Math.min(maxSamples, scaled.length);
        int heightLimit = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

        IsolationTree[] trees = new IsolationTree[estimators];
        for (int t = 0; t < estimators; t++) {
            trees[t] = IsolationTree.build(subSample(scaled, sampleSize, random), heightLimit, random);
        }
        return new IsolationForest(trees, scaler, averagePathLength(sampleSize), data.length, contamination, scaled);
    }

    double score(double[] point) {
        if (point.length != scaler.dimension()) {
            throw new IllegalArgumentException("Expected vector of dimension " + scaler.dimension()
                    + ", got " + point.length);
        }
        return scoreScaled(scaler.transform(point));
    }

    boolean isAnomalous(double score) {
        return score > threshold;
    }

    double getThreshold() {
        return threshold;
    }

    int getTrainingSize() {
        return trainingSize;
    }

    int dimension() {
        return scaler.dimension();
    }

    private double scoreScaled(double[] scaled) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(scaled);
        }
        double mean = total / trees.length;
        return Math.pow(2.0, -mean / normalizer);
    }

    private double computeThreshold(double[][] scaledTraining, double contamination) {
        double[] scores = new double[scaledTraining.length];
        for (int i = 0; i < scaledTraining.length; i++) {
            scores[i] = scoreScaled(scaledTraining[i]);
        }
        Arrays.sort(scores);
        int index = (int) Math.floor((1.0 - contamination) * (scores.length - 1));
        return scores[Math.max(0, Math.min(scores.length - 1, index))];
    }

    /**
     * c(n): expected path length of an unsuccessful BST search over n points.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static double[][] subSample(double[][] data, int size, Random random) {
        if (size == data.length) {
            return data;
        }
        // Partial Fisher-Yates over row indices
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
