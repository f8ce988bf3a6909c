package com.example.requestgate.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@Validated
@ConfigurationProperties(prefix = "rate-limiter")
public class RateLimiterProperties {

    public enum Store {
        IN_MEMORY,
        REDIS
    }

    /**
     * Requests a single client may make per window.
     */
    @Min(1)
    private int maxRequests = 100;

    /**
     * Length of the fixed window. A plain number is read as milliseconds.
     */
    @NotNull
    private Duration window = Duration.ofMillis(900_000);

    /**
     * Paths starting with any of these prefixes are subject to rate limiting.
     */
    @NotEmpty
    private List<String> limitedPathPrefixes = new ArrayList<>(List.of("/api", "/auth"));

    /**
     * Where counters live: in this process, or in Redis shared by every instance.
     */
    @NotNull
    private Store store = Store.IN_MEMORY;

    /**
     * If true, requests are allowed when Redis is unavailable or the Lua script fails.
     * If false, requests are rejected when we cannot reliably enforce limits.
     */
    private boolean failOpenOnRedisError = true;

    /**
     * How often the in-memory store drops expired entries.
     */
    @NotNull
    private Duration sweepInterval = Duration.ofMinutes(1);

    /**
     * How long past its window end an entry is kept before a sweep may drop it.
     */
    @NotNull
    private Duration sweepGrace = Duration.ofMinutes(1);

    /**
     * Entry count above which the in-memory store sweeps eagerly.
     */
    @Min(1)
    private int maxKeys = 100_000;

    @AssertTrue(message = "rate-limiter.window must be a positive duration")
    public boolean isWindowPositive() {
        return window == null || (!window.isZero() && !window.isNegative());
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
        this.maxRequests = maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public List<String> getLimitedPathPrefixes() {
        return limitedPathPrefixes;
    }

    public void setLimitedPathPrefixes(List<String> limitedPathPrefixes) {
        this.limitedPathPrefixes = limitedPathPrefixes;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public boolean isFailOpenOnRedisError() {
        return failOpenOnRedisError;
    }

    public void setFailOpenOnRedisError(boolean failOpenOnRedisError) {
        this.failOpenOnRedisError = failOpenOnRedisError;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public Duration getSweepGrace() {
        return sweepGrace;
    }

    public void setSweepGrace(Duration sweepGrace) {
        this.sweepGrace = sweepGrace;
    }

    public int getMaxKeys() {
        return maxKeys;
    }

    public void setMaxKeys(int maxKeys) {
        this.maxKeys = maxKeys;
    }
}
