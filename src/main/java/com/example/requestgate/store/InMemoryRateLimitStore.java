package com.example.requestgate.store;

import com.example.requestgate.model.RateLimitDecision;
import com.example.requestgate.model.RateLimitEntry;
import com.example.requestgate.model.RateLimitPolicy;
import com.example.requestgate.model.RateLimitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed window counters kept in this process.
 * <p>
 * Every read-check-write of an entry happens inside {@link ConcurrentMap#compute}, which runs
 * atomically per key, so concurrent requests from one client can never push the count past the cap.
 * Counts are per instance: a fleet of N instances admits up to N times the cap per client.
 * <p>
 * The map holds at most {@code maxKeys} clients. When a new client arrives at a full map, expired
 * entries are swept (at most once per {@link #EAGER_SWEEP_MIN_INTERVAL}); if the map is still full
 * the new client is refused with a store failure. Known clients are always served.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRateLimitStore.class);

    static final Duration EAGER_SWEEP_MIN_INTERVAL = Duration.ofSeconds(1);
    private static final long NEVER = Long.MIN_VALUE;

    private final ConcurrentMap<String, RateLimitEntry> entries = new ConcurrentHashMap<>();
    private final RateLimitPolicy policy;
    private final Clock clock;
    private final Duration sweepGrace;
    private final int maxKeys;
    private final AtomicLong lastEagerSweepMillis = new AtomicLong(NEVER);

    public InMemoryRateLimitStore(RateLimitPolicy policy, Clock clock, Duration sweepGrace, int maxKeys) {
        this.policy = policy;
        this.clock = clock;
        this.sweepGrace = sweepGrace;
        this.maxKeys = maxKeys;
    }

    @Override
    public RateLimitResult tryAcquire(String key, Instant now) {
        if (entries.size() >= maxKeys && !entries.containsKey(key)) {
            sweepEagerly(now);
        }

        // written by the remapping function, which runs under the key's lock
        RateLimitResult[] outcome = new RateLimitResult[1];

        entries.compute(key, (k, current) -> {
            if (current == null && entries.size() >= maxKeys) {
                outcome[0] = RateLimitResult.rejectStoreFailure();
                return null;
            }
            if (current == null || current.isExpired(now)) {
                RateLimitEntry fresh = RateLimitEntry.open(k, now, policy);
                outcome[0] = RateLimitResult.allow(policy.maxRequests() - 1L, fresh.windowEnd());
                return fresh;
            }
            if (current.count() < policy.maxRequests()) {
                RateLimitEntry next = current.increment();
                outcome[0] = RateLimitResult.allow((long) policy.maxRequests() - next.count(), next.windowEnd());
                return next;
            }
            outcome[0] = RateLimitResult.rejectRateLimited(current.windowEnd());
            return current;
        });

        if (outcome[0].getDecision() == RateLimitDecision.REJECT_STORE_FAILURE) {
            log.debug("Rate limit store full ({} keys), refusing new client {}", entries.size(), key);
        }
        return outcome[0];
    }

    private void sweepEagerly(Instant now) {
        long nowMillis = now.toEpochMilli();
        long last = lastEagerSweepMillis.get();
        if (last != NEVER && nowMillis - last < EAGER_SWEEP_MIN_INTERVAL.toMillis()) {
            return;
        }
        // one caller per interval wins the sweep
        if (!lastEagerSweepMillis.compareAndSet(last, nowMillis)) {
            return;
        }
        int removed = evictExpired(now);
        if (removed == 0) {
            log.warn("Rate limit store is full ({} keys, max {}) and holds no expired entries; new clients are refused",
                    entries.size(), maxKeys);
        } else {
            log.debug("Eager sweep removed {} expired rate limit entries, {} remaining", removed, entries.size());
        }
    }

    /**
     * Periodic sweep bounding memory under many distinct keys.
     */
    @Scheduled(fixedDelayString = "${rate-limiter.sweep-interval:PT1M}",
            initialDelayString = "${rate-limiter.sweep-interval:PT1M}")
    public void sweep() {
        int removed = evictExpired(clock.instant());
        if (removed > 0) {
            log.debug("Swept {} expired rate limit entries, {} remaining", removed, entries.size());
        }
    }

    /**
     * Drop every entry whose window ended more than the sweep grace before {@code now}.
     *
     * @return number of entries removed
     */
    public int evictExpired(Instant now) {
        Instant cutoff = now.minus(sweepGrace);
        int removed = 0;
        for (String key : entries.keySet()) {
            boolean[] dropped = new boolean[1];
            // re-checked under the key's lock so a concurrent request that just renewed the window keeps it
            entries.computeIfPresent(key, (k, entry) -> {
                if (entry.isExpired(cutoff)) {
                    dropped[0] = true;
                    return null;
                }
                return entry;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Live view of the stored entry for a key, for diagnostics and tests.
     */
    public Optional<RateLimitEntry> find(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public int size() {
        return entries.size();
    }
}
