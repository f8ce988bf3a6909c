package com.example.requestgate.store;

import com.example.requestgate.model.RateLimitResult;

import java.time.Instant;

/**
 * Holds the per-client fixed window counters.
 * <p>
 * Implementations must make the check-and-increment for a key atomic: for a cap of C,
 * at most C concurrent calls for the same key within one window are allowed.
 */
public interface RateLimitStore {

    /**
     * Record one request for {@code key} at {@code now} if the key still has quota in its current window.
     */
    RateLimitResult tryAcquire(String key, Instant now);
}
