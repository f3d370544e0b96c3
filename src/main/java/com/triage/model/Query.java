package com.triage.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable incoming query.
 */
@Value
@Builder
public class Query {

    /**
     * Caller-supplied identifier, or a generated one when the caller sent none.
     */
    String id;

    String text;

    Instant arrivedAt;

    /**
     * Whether {@link #id} was supplied by the caller.
     */
    boolean callerSupplied;

    public static Query of(String text, String callerId, Instant arrivedAt) {
        boolean supplied = callerId != null && !callerId.isBlank();
        return Query.builder()
                .id(supplied ? callerId : UUID.randomUUID().toString())
                .text(text)
                .arrivedAt(arrivedAt)
                .callerSupplied(supplied)
                .build();
    }
}
