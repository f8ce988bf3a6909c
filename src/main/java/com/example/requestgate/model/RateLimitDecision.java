package com.example.requestgate.model;

/**
 * High-level outcome of a single rate-limit evaluation.
 */
public enum RateLimitDecision {
    /**
     * Request is within the current window's quota and may proceed.
     */
    ALLOW,

    /**
     * The client has used its quota for the current window and must be rejected with 429.
     */
    REJECT_RATE_LIMITED,

    /**
     * The counter store could not be consulted (e.g. Redis unavailable) and we are configured to fail closed.
     */
    REJECT_STORE_FAILURE
}
