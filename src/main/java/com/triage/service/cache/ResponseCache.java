package com.triage.service.cache;

import com.triage.exception.TriageException;
import com.triage.model.CacheEntry;
import com.triage.model.dto.CacheStatistics;
import com.triage.repository.ResponseStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;

/**
 * TTL response cache with single-flight computation.
 *
 * Flow of getOrCompute():
 * 1. Unexpired stored entry: return it
 * 2. Computation already pending for the key: wait on it and share its result
 * 3. Otherwise register a pending marker, run the computation on the executor,
 *    store the result, deregister, then complete the shared future
 *
 * The pending registry is only touched to register and deregister markers; the
 * computation itself runs outside it. Waiter timeouts stop that waiter only and
 * never cancel the shared computation. Failed computations are not stored.
 *
 * Store failures are logged and treated as misses.
 */
@Slf4j
public class ResponseCache {

    private final ResponseStore store;
    private final Duration ttl;
    private final Clock clock;
    private final Executor executor;
    private final boolean enabled;
    private final ConcurrentMap<String, CompletableFuture<CacheEntry>> pending = new ConcurrentHashMap<>();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder sharedWaits = new LongAdder();
    private final LongAdder stores = new LongAdder();
    private final LongAdder storeFailures = new LongAdder();
    private final LongAdder expired = new LongAdder();

    public ResponseCache(ResponseStore store, Duration ttl, Clock clock, Executor executor, boolean enabled) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive, got " + ttl);
        }
        this.store = store;
        this.ttl = ttl;
        this.clock = clock;
        this.executor = executor;
        this.enabled = enabled;
        log.info("Response cache initialized: store={}, ttl={}, enabled={}", store.getName(), ttl, enabled);
    }

    /**
     * Get an unexpired entry.
     *
     * @param key fingerprint
     * @return the entry, or empty on miss, expiry or store failure
     */
    public Optional<CacheEntry> get(String key) {
        Optional<CacheEntry> entry = read(key);
        if (entry.isPresent()) {
            hits.increment();
        } else {
            misses.increment();
        }
        return entry;
    }

    /**
     * Store a payload under {@code key} with the configured TTL, replacing any existing entry.
     */
    public CacheEntry put(String key, String payload) {
        Instant now = clock.instant();
        CacheEntry entry = CacheEntry.builder()
                .key(key)
                .payload(payload)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .build();
        write(entry);
        return entry;
    }

    /**
     * Return the cached payload for {@code key}, computing it at most once across concurrent callers.
     *
     * @param key         fingerprint
     * @param computation produces the payload on a miss; runs on the cache executor
     * @param waitTimeout how long this caller waits for the result
     * @throws TimeoutException if this caller stops waiting; the computation keeps running
     * @throws RuntimeException the computation's own failure, shared by every waiter
     */
    public CacheLookup getOrCompute(String key, Callable<String> computation, Duration waitTimeout)
            throws TimeoutException {
        Optional<CacheEntry> cached = read(key);
        if (cached.isPresent()) {
            hits.increment();
            return new CacheLookup(cached.get(), CacheLookup.Source.HIT);
        }

        CompletableFuture<CacheEntry> mine = new CompletableFuture<>();
        CompletableFuture<CacheEntry> existing = pending.putIfAbsent(key, mine);
        if (existing != null) {
            sharedWaits.increment();
            log.debug("Joining in-flight computation for key={}", key);
            return new CacheLookup(await(existing, waitTimeout), CacheLookup.Source.SHARED);
        }

        // A computation may have finished between the read and the registration
        Optional<CacheEntry> raced = read(key);
        if (raced.isPresent()) {
            pending.remove(key, mine);
            mine.complete(raced.get());
            hits.increment();
            return new CacheLookup(raced.get(), CacheLookup.Source.HIT);
        }

        misses.increment();
        try {
            executor.execute(() -> compute(key, computation, mine));
        } catch (RejectedExecutionException e) {
            pending.remove(key, mine);
            mine.completeExceptionally(e);
            throw new TriageException("Inference executor rejected computation for key " + key, e);
        }
        return new CacheLookup(await(mine, waitTimeout), CacheLookup.Source.COMPUTED);
    }

    public void evict(String key) {
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            storeFailures.increment();
            log.warn("Failed to evict key={} from {} store", key, store.getName(), e);
        }
    }

    public void clear() {
        try {
            store.clear();
            log.info("Cleared response cache ({})", store.getName());
        } catch (RuntimeException e) {
            storeFailures.increment();
            log.error("Failed to clear {} store", store.getName(), e);
        }
    }

    /**
     * Remove expired entries from the store.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        try {
            int removed = store.removeExpired(clock.instant());
            if (removed > 0) {
                expired.add(removed);
                log.info("Swept {} expired cache entries", removed);
            }
            return removed;
        } catch (RuntimeException e) {
            storeFailures.increment();
            log.warn("Expiry sweep failed on {} store", store.getName(), e);
            return 0;
        }
    }

    /**
     * Number of computations currently in flight.
     */
    public int pendingCount() {
        return pending.size();
    }

    public CacheStatistics getStatistics() {
        long hitCount = hits.sum();
        long missCount = misses.sum();
        long shared = sharedWaits.sum();
        long lookups = hitCount + missCount + shared;
        long entries;
        try {
            entries = store.size();
        } catch (RuntimeException e) {
            log.debug("Could not count {} store entries", store.getName(), e);
            entries = -1;
        }
        return CacheStatistics.builder()
                .hits(hitCount)
                .misses(missCount)
                .sharedWaits(shared)
                .stores(stores.sum())
                .storeFailures(storeFailures.sum())
                .expired(expired.sum())
                .entries(entries)
                .hitRate(lookups > 0 ? (double) (hitCount + shared) / lookups : 0.0)
                .build();
    }

    private void compute(String key, Callable<String> computation, CompletableFuture<CacheEntry> future) {
        CacheEntry entry;
        try {
            entry = put(key, computation.call());
        } catch (Throwable t) {
            pending.remove(key, future);
            future.completeExceptionally(t);
            log.debug("Computation failed for key={}: {}", key, t.toString());
            return;
        }
        pending.remove(key, future);
        future.complete(entry);
    }

    private Optional<CacheEntry> read(String key) {
        if (!enabled) {
            return Optional.empty();
        }
        Optional<CacheEntry> entry;
        try {
            entry = store.get(key);
        } catch (RuntimeException e) {
            storeFailures.increment();
            log.warn("Cache read failed on {} store, treating as miss: key={}", store.getName(), key, e);
            return Optional.empty();
        }
        if (entry.isPresent() && entry.get().isExpired(clock.instant())) {
            expired.increment();
            log.debug("Cache entry expired: key={}", key);
            evict(key);
            return Optional.empty();
        }
        return entry;
    }

    private void write(CacheEntry entry) {
        if (!enabled) {
            return;
        }
        try {
            store.put(entry);
            stores.increment();
        } catch (RuntimeException e) {
            storeFailures.increment();
            log.warn("Cache write failed on {} store: key={}", store.getName(), entry.getKey(), e);
        }
    }

    private static CacheEntry await(CompletableFuture<CacheEntry> future, Duration timeout) throws TimeoutException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TriageException("Interrupted while waiting for cached computation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CompletionException(cause);
        }
    }
}
