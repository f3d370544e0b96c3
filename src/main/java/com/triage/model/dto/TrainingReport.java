package com.triage.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one refit cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingReport {

    /**
     * False when the cycle was skipped and the previous models stay in place.
     */
    private boolean fitted;

    private int documents;

    private Map<String, Integer> modalitySizes;

    private int vocabularySize;

    private String reason;

    private Instant completedAt;
}
