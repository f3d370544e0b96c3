package com.triage.service.cache;

import com.triage.model.CacheEntry;
import lombok.Value;

/**
 * Result of a single-flight lookup.
 */
@Value
public class CacheLookup {

    public enum Source {
        /**
         * Served from a stored, unexpired entry.
         */
        HIT,
        /**
         * Joined a computation another caller had already started.
         */
        SHARED,
        /**
         * This caller started the computation.
         */
        COMPUTED
    }

    CacheEntry entry;

    Source source;

    public String getPayload() {
        return entry.getPayload();
    }

    /**
     * True unless this caller triggered the computation itself.
     */
    public boolean isCacheHit() {
        return source != Source.COMPUTED;
    }
}
