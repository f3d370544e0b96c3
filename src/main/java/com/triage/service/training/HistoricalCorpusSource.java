package com.triage.service.training;

import java.util.List;
import java.util.Map;

/**
 * Pull-based supplier of past query texts, called only during refit cycles.
 */
public interface HistoricalCorpusSource {

    String getName();

    /**
     * Query texts grouped by modality (historical population). Texts filed under
     * {@link com.triage.service.anomaly.AnomalyDetector#UNION} belong to no specific modality.
     */
    Map<String, List<String>> fetch();
}
