package com.triage.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.triage.model.CacheEntry;
import com.triage.repository.CaffeineResponseStore;
import com.triage.repository.ResponseStore;
import com.triage.service.cache.ResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Response cache wiring. The in-memory Caffeine store is the default;
 * see {@link RedisConfiguration} for the shared store.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final TriageProperties properties;

    public CacheConfiguration(TriageProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnProperty(prefix = "triage.cache", name = "store", havingValue = "memory", matchIfMissing = true)
    public ResponseStore caffeineResponseStore() {
        return new CaffeineResponseStore(caffeineCache());
    }

    /**
     * Runs single-flight computations so that every caller, including the first, waits with a timeout.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService inferenceExecutor() {
        AtomicInteger counter = new AtomicInteger();
        int threads = properties.getRouting().getInferenceThreads();
        log.info("Inference executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "inference-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ResponseCache responseCache(ResponseStore store,
                                       @Qualifier("inferenceExecutor") ExecutorService inferenceExecutor,
                                       Clock clock) {
        TriageProperties.CacheConfig config = properties.getCache();
        return new ResponseCache(store, config.getTtl(), clock, inferenceExecutor, config.isEnabled());
    }

    private Cache<String, CacheEntry> caffeineCache() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getCache().getMaxSize())
                .expireAfterWrite(properties.getCache().getTtl())
                .recordStats()
                .build();
    }
}
