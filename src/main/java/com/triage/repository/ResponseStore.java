package com.triage.repository;

import com.triage.model.CacheEntry;

import java.time.Instant;
import java.util.Optional;

/**
 * Backing store for cached responses. Implementations may throw on failure;
 * the response cache treats any failure as a miss.
 */
public interface ResponseStore {

    /**
     * Store name for logs and statistics (e.g., "caffeine", "redis").
     */
    String getName();

    Optional<CacheEntry> get(String key);

    /**
     * Write the entry, replacing any existing entry under the same key.
     */
    void put(CacheEntry entry);

    void delete(String key);

    void clear();

    /**
     * Number of stored entries, or -1 when the store cannot count cheaply.
     */
    long size();

    /**
     * Remove entries that expired before {@code now}.
     *
     * @return number of entries removed
     */
    default int removeExpired(Instant now) {
        return 0;
    }
}
