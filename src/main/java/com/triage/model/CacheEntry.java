package com.triage.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;

/**
 * Stored response. Entries are replaced wholesale, never modified.
 */
@Value
@Builder
@Jacksonized
public class CacheEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Fingerprint of normalized query text and model name.
     */
    String key;

    String payload;

    Instant createdAt;

    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
