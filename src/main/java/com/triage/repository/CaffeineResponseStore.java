package com.triage.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.triage.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;

/**
 * Bounded in-memory store. Expiry is decided by the entry's own timestamp, not by Caffeine.
 */
@Slf4j
public class CaffeineResponseStore implements ResponseStore {

    private final Cache<String, CacheEntry> cache;

    public CaffeineResponseStore(Cache<String, CacheEntry> cache) {
        this.cache = cache;
    }

    @Override
    public String getName() {
        return "caffeine";
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(CacheEntry entry) {
        cache.put(entry.getKey(), entry);
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public int removeExpired(Instant now) {
        int removed = 0;
        for (CacheEntry entry : cache.asMap().values()) {
            if (entry.isExpired(now) && cache.asMap().remove(entry.getKey(), entry)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Removed {} expired entries from in-memory store", removed);
        }
        return removed;
    }
}
