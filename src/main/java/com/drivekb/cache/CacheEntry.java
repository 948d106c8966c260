package com.drivekb.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached response and the query embedding it was computed for. Only {@code lastAccessedAt}
 * changes after creation.
 */
final class CacheEntry<V> {
    private final float[] queryEmbedding;
    private final V response;
    private final Instant createdAt;
    private final long insertionOrder;
    private Instant lastAccessedAt;

    CacheEntry(float[] queryEmbedding, V response, Instant createdAt, long insertionOrder) {
        this.queryEmbedding = queryEmbedding;
        this.response = response;
        this.createdAt = createdAt;
        this.insertionOrder = insertionOrder;
        this.lastAccessedAt = createdAt;
    }

    float[] queryEmbedding() {
        return queryEmbedding;
    }

    V response() {
        return response;
    }

    long insertionOrder() {
        return insertionOrder;
    }

    Instant lastAccessedAt() {
        return lastAccessedAt;
    }

    void touch(Instant now) {
        lastAccessedAt = now;
    }

    boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
