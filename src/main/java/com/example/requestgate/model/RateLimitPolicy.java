package com.example.requestgate.model;

import java.time.Duration;

/**
 * Quota applied to every rate-limited client: at most {@code maxRequests} per fixed {@code window}.
 * Built once at startup and shared read-only.
 */
public record RateLimitPolicy(int maxRequests, Duration window) {

    public RateLimitPolicy {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0, was " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be a positive duration, was " + window);
        }
    }

    /**
     * Window length in whole seconds, rounded up, as sent in {@code Retry-After}.
     */
    public long windowSeconds() {
        long seconds = window.getSeconds();
        return window.getNano() > 0 ? seconds + 1 : seconds;
    }
}
