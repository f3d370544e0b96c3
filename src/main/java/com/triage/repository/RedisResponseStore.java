package com.triage.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.triage.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-backed store with compression.
 * Key pattern: triage:response:{fingerprint}. Redis expires entries natively.
 */
@Slf4j
public class RedisResponseStore implements ResponseStore {

    private static final String KEY_PREFIX = "triage:response:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RedisResponseStore(RedisTemplate<String, byte[]> redisTemplate, ObjectMapper objectMapper, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "redis";
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        byte[] compressed = redisTemplate.opsForValue().get(buildKey(key));
        if (compressed == null) {
            log.debug("Redis miss: {}", key);
            return Optional.empty();
        }
        return Optional.of(decompress(compressed));
    }

    @Override
    public void put(CacheEntry entry) {
        Duration ttl = Duration.between(clock.instant(), entry.getExpiresAt());
        if (ttl.isNegative() || ttl.isZero()) {
            log.debug("Skipping already expired entry: {}", entry.getKey());
            return;
        }
        byte[] compressed = compress(entry);
        redisTemplate.opsForValue().set(buildKey(entry.getKey()), compressed, ttl);
        log.debug("Stored in Redis: key={}, ttl={}, size={}B", entry.getKey(), ttl, compressed.length);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(buildKey(key));
    }

    @Override
    public void clear() {
        Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
            log.info("Cleared {} entries from Redis", keys.size());
        }
    }

    @Override
    public long size() {
        return -1;
    }

    private String buildKey(String key) {
        return KEY_PREFIX + key;
    }

    private byte[] compress(CacheEntry entry) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
                gzipOut.write(objectMapper.writeValueAsBytes(entry));
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize cache entry " + entry.getKey(), e);
        }
    }

    private CacheEntry decompress(byte[] compressed) {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CacheEntry.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Corrupt cache entry in Redis", e);
        }
    }
}
