package com.example.requestgate.service;

import com.example.requestgate.model.RateLimitPolicy;
import com.example.requestgate.model.RateLimitResult;
import com.example.requestgate.store.RateLimitStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Fixed window rate limiter keyed by client.
 * <p>
 * A client may make {@link RateLimitPolicy#maxRequests()} requests per window. The window opens on the
 * client's first request and the whole quota comes back the instant it ends, so a client can burst up to
 * the cap at the start of every window. There is no smoothing between windows.
 * <p>
 * Rejected requests are not counted.
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final RateLimitStore store;
    private final RateLimitPolicy policy;
    private final Clock clock;

    public RateLimiterService(RateLimitStore store, RateLimitPolicy policy, Clock clock) {
        this.store = store;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Evaluate whether the client may perform one request now.
     *
     * @param clientKey identifier of the client, normally its network address
     */
    public RateLimitResult check(String clientKey) {
        return check(clientKey, clock.instant());
    }

    public RateLimitResult check(String clientKey, Instant now) {
        RateLimitResult result = store.tryAcquire(clientKey, now);
        if (!result.isAllowed()) {
            log.debug("Client {} denied: {} (window ends {})", clientKey, result.getDecision(), result.getWindowEnd());
        }
        return result;
    }

    /**
     * @return true if the request is allowed and has been counted
     */
    public boolean allow(String clientKey, Instant now) {
        return check(clientKey, now).isAllowed();
    }

    public RateLimitPolicy getPolicy() {
        return policy;
    }
}
