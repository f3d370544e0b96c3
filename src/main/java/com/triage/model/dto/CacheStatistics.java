package com.triage.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response cache counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private long hits;

    private long misses;

    /**
     * Requests that joined a computation already in flight for the same key.
     */
    private long sharedWaits;

    private long stores;

    /**
     * Store reads or writes that failed and were treated as misses.
     */
    private long storeFailures;

    private long expired;

    private long entries;

    /**
     * (hits + sharedWaits) / lookups, 0.0 when there were no lookups.
     */
    private double hitRate;
}
