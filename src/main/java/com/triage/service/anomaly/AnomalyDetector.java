package com.triage.service.anomaly;

import com.triage.exception.NotFittedException;
import com.triage.model.AnomalyResult;
import com.triage.model.FeatureVector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Multi-modal isolation-forest anomaly detector.
 *
 * One sub-ensemble is trained per historical population (modality) plus one on the
 * union of all populations. A vector is only as anomalous as its best-fitting
 * population: scoring returns the minimum score across the applicable modalities,
 * and falls back to the union ensemble when no modality applies.
 *
 * fit() builds the new ensembles off to the side and publishes them with a single
 * atomic swap; scoring calls keep the snapshot they started with.
 */
@Slf4j
public class AnomalyDetector {

    public static final String UNION = "union";

    private final int estimators;
    private final int maxSamples;
    private final int minSamples;
    private final double contamination;
    private final Random random;
    private final AtomicReference<DetectorModel> model = new AtomicReference<>();

    public AnomalyDetector(int estimators, double contamination, int maxSamples, int minSamples, Long seed) {
        if (estimators < 1) {
            throw new IllegalArgumentException("estimators must be at least 1, got " + estimators);
        }
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        if (maxSamples < 2) {
            throw new IllegalArgumentException("maxSamples must be at least 2, got " + maxSamples);
        }
        this.estimators = estimators;
        this.contamination = contamination;
        this.maxSamples = maxSamples;
        this.minSamples = Math.max(2, minSamples);
        this.random = seed != null ? new Random(seed) : new Random();
    }

    /**
     * Train on a single population.
     */
    public void fit(List<FeatureVector> history) {
        fit(Map.of(UNION, history));
    }

    /**
     * Train one sub-ensemble per modality and a union ensemble over all of them.
     * Modalities with fewer than {@code minSamples} vectors only contribute to the union.
     *
     * @throws IllegalArgumentException if the union holds fewer than {@code minSamples} vectors
     *                                  or the vectors disagree on dimension
     */
    public void fit(Map<String, List<FeatureVector>> historyByModality) {
        List<FeatureVector> all = new ArrayList<>();
        historyByModality.values().forEach(all::addAll);
        if (all.size() < minSamples) {
            throw new IllegalArgumentException("Need at least " + minSamples
                    + " historical vectors to fit, got " + all.size());
        }
        int dimension = all.get(0).dimension();
        for (FeatureVector vector : all) {
            if (vector.dimension() != dimension) {
                throw new IllegalArgumentException("Mixed vector dimensions in history: "
                        + dimension + " and " + vector.dimension());
            }
        }

        Random fitRandom;
        synchronized (random) {
            fitRandom = new Random(random.nextLong());
        }

        Map<String, IsolationForest> modalities = new LinkedHashMap<>();
        if (historyByModality.size() > 1 || !historyByModality.containsKey(UNION)) {
            for (Map.Entry<String, List<FeatureVector>> entry : historyByModality.entrySet()) {
                if (UNION.equals(entry.getKey())) {
                    continue;
                }
                if (entry.getValue().size() < minSamples) {
                    log.debug("Skipping modality '{}' with {} vectors (< {})",
                            entry.getKey(), entry.getValue().size(), minSamples);
                    continue;
                }
                modalities.put(entry.getKey(), train(entry.getValue(), fitRandom));
            }
        }
        IsolationForest union = train(all, fitRandom);

        model.set(new DetectorModel(Collections.unmodifiableMap(modalities), union, dimension));
        log.info("Fitted anomaly detector: {} vectors, dimension {}, modalities {}",
                all.size(), dimension, modalities.keySet());
    }

    /**
     * Score a vector whose modality is not known, as at routing time. The result is the
     * minimum score across every fitted modality ensemble. The union ensemble is used only
     * when no named modality has been fitted.
     *
     * @throws NotFittedException if fit() has not succeeded yet
     */
    public AnomalyResult score(FeatureVector vector) {
        DetectorModel current = requireModel();
        return score(current, vector, current.modalities.keySet());
    }

    /**
     * Score against the named modalities; unknown names are ignored and the union
     * ensemble is used when none of them has been fitted.
     */
    public AnomalyResult score(FeatureVector vector, Collection<String> applicable) {
        return score(requireModel(), vector, applicable);
    }

    /**
     * Anomaly score in [0, 1].
     */
    public double scoreAnomaly(FeatureVector vector) {
        return score(vector).getScore();
    }

    public boolean isFitted() {
        return model.get() != null;
    }

    public Set<String> getModalities() {
        DetectorModel current = model.get();
        return current == null ? Set.of() : current.modalities.keySet();
    }

    public int getMinSamples() {
        return minSamples;
    }

    private AnomalyResult score(DetectorModel snapshot, FeatureVector vector, Collection<String> applicable) {
        if (vector.dimension() != snapshot.dimension) {
            throw new IllegalArgumentException("Detector was fitted on dimension " + snapshot.dimension
                    + ", got " + vector.dimension());
        }
        double[] point = vector.toArray();

        String bestModality = null;
        double best = Double.POSITIVE_INFINITY;
        IsolationForest bestForest = null;
        for (String name : applicable) {
            IsolationForest forest = snapshot.modalities.get(name);
            if (forest == null) {
                continue;
            }
            double s = forest.score(point);
            if (s < best) {
                best = s;
                bestModality = name;
                bestForest = forest;
            }
        }

        if (bestForest == null) {
            bestForest = snapshot.union;
            bestModality = UNION;
            best = bestForest.score(point);
        }

        return AnomalyResult.builder()
                .score(clamp(best))
                .anomalous(bestForest.isAnomalous(best))
                .modality(bestModality)
                .build();
    }

    private IsolationForest train(List<FeatureVector> vectors, Random fitRandom) {
        double[][] data = new double[vectors.size()][];
        for (int i = 0; i < data.length; i++) {
            data[i] = vectors.get(i).toArray();
        }
        return IsolationForest.fit(data, estimators, maxSamples, contamination, fitRandom);
    }

    private DetectorModel requireModel() {
        DetectorModel current = model.get();
        if (current == null) {
            throw new NotFittedException("AnomalyDetector");
        }
        return current;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static final class DetectorModel {
        final Map<String, IsolationForest> modalities;
        final IsolationForest union;
        final int dimension;

        DetectorModel(Map<String, IsolationForest> modalities, IsolationForest union, int dimension) {
            this.modalities = modalities;
            this.union = union;
            this.dimension = dimension;
        }
    }
}
