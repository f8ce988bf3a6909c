package com.example.requestgate.model;

import java.time.Instant;

/**
 * Result returned by a rate limit store for a single request.
 */
public class RateLimitResult {

    private final RateLimitDecision decision;
    private final long remaining;
    private final Instant windowEnd;
    private final boolean degraded;

    public RateLimitResult(RateLimitDecision decision, long remaining, Instant windowEnd, boolean degraded) {
        this.decision = decision;
        this.remaining = remaining;
        this.windowEnd = windowEnd;
        this.degraded = degraded;
    }

    public static RateLimitResult allow(long remaining, Instant windowEnd) {
        return new RateLimitResult(RateLimitDecision.ALLOW, remaining, windowEnd, false);
    }

    public static RateLimitResult allowDegraded() {
        return new RateLimitResult(RateLimitDecision.ALLOW, -1, null, true);
    }

    public static RateLimitResult rejectRateLimited(Instant windowEnd) {
        return new RateLimitResult(RateLimitDecision.REJECT_RATE_LIMITED, 0, windowEnd, false);
    }

    public static RateLimitResult rejectStoreFailure() {
        return new RateLimitResult(RateLimitDecision.REJECT_STORE_FAILURE, 0, null, true);
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    public boolean isAllowed() {
        return decision == RateLimitDecision.ALLOW;
    }

    /**
     * @return requests still available in the current window, or -1 when unknown (degraded mode).
     */
    public long getRemaining() {
        return remaining;
    }

    /**
     * @return end of the window the decision was taken in, or null when no store state was consulted.
     */
    public Instant getWindowEnd() {
        return windowEnd;
    }

    /**
     * @return true if the result was produced while the store was unavailable
     * and the fail-open / fail-closed policy decided the outcome.
     */
    public boolean isDegraded() {
        return degraded;
    }
}
