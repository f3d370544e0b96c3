package com.triage.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of scoring one feature vector against the fitted ensembles.
 */
@Value
@Builder
public class AnomalyResult {

    /**
     * Anomaly score in [0, 1], higher is more unusual.
     */
    double score;

    /**
     * Whether the score crosses the contamination-derived threshold of the modality that produced it.
     */
    boolean anomalous;

    /**
     * Modality whose ensemble produced the score.
     */
    String modality;
}
