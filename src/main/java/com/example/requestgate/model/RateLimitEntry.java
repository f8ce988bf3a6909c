package com.example.requestgate.model;

import java.time.Instant;

/**
 * Fixed-window counter state for one client key.
 * <p>
 * Immutable: the in-memory store replaces entries atomically instead of mutating them.
 */
public record RateLimitEntry(String key, int count, Instant windowStart, Instant windowEnd) {

    public static RateLimitEntry open(String key, Instant now, RateLimitPolicy policy) {
        return new RateLimitEntry(key, 1, now, now.plus(policy.window()));
    }

    /**
     * An entry observed strictly after its window end must be treated as if it did not exist.
     */
    public boolean isExpired(Instant now) {
        return now.isAfter(windowEnd);
    }

    public RateLimitEntry increment() {
        return new RateLimitEntry(key, count + 1, windowStart, windowEnd);
    }
}
