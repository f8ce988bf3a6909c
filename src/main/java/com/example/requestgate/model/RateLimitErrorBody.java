package com.example.requestgate.model;

/**
 * JSON body written by the gate when it rejects a request itself.
 */
public record RateLimitErrorBody(String error, String message) {

    public static RateLimitErrorBody tooManyRequests() {
        return new RateLimitErrorBody("Too Many Requests", "Rate limit exceeded. Please try again later.");
    }

    public static RateLimitErrorBody storeUnavailable() {
        return new RateLimitErrorBody("Service Unavailable", "Rate limiter backend error. Please try again later.");
    }
}
