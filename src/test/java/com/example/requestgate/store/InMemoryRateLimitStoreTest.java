package com.example.requestgate.store;

import com.example.requestgate.MutableClock;
import com.example.requestgate.model.RateLimitDecision;
import com.example.requestgate.model.RateLimitEntry;
import com.example.requestgate.model.RateLimitPolicy;
import com.example.requestgate.model.RateLimitResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRateLimitStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration WINDOW = Duration.ofSeconds(60);

    private MutableClock clock;
    private InMemoryRateLimitStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryRateLimitStore(new RateLimitPolicy(3, WINDOW), clock, Duration.ofSeconds(30), 1_000);
    }

    @Test
    void allowsUpToCapThenRejects() {
        assertThat(store.tryAcquire("a", T0).getDecision()).isEqualTo(RateLimitDecision.ALLOW);
        assertThat(store.tryAcquire("a", T0.plusMillis(1)).getDecision()).isEqualTo(RateLimitDecision.ALLOW);
        assertThat(store.tryAcquire("a", T0.plusMillis(2)).getDecision()).isEqualTo(RateLimitDecision.ALLOW);

        RateLimitResult fourth = store.tryAcquire("a", T0.plusMillis(3));
        assertThat(fourth.getDecision()).isEqualTo(RateLimitDecision.REJECT_RATE_LIMITED);
        assertThat(fourth.getWindowEnd()).isEqualTo(T0.plus(WINDOW));
    }

    @Test
    void reportsRemainingQuota() {
        assertThat(store.tryAcquire("a", T0).getRemaining()).isEqualTo(2);
        assertThat(store.tryAcquire("a", T0).getRemaining()).isEqualTo(1);
        assertThat(store.tryAcquire("a", T0).getRemaining()).isEqualTo(0);
    }

    @Test
    void rejectedRequestsAreNotCounted() {
        for (int i = 0; i < 10; i++) {
            store.tryAcquire("a", T0);
        }

        assertThat(store.find("a").orElseThrow().count()).isEqualTo(3);
    }

    @Test
    void windowEndItselfIsStillLive() {
        for (int i = 0; i < 3; i++) {
            store.tryAcquire("a", T0);
        }

        assertThat(store.tryAcquire("a", T0.plus(WINDOW)).getDecision())
                .isEqualTo(RateLimitDecision.REJECT_RATE_LIMITED);
    }

    @Test
    void expiredWindowStartsOverWithOnlyTheCurrentRequest() {
        for (int i = 0; i < 4; i++) {
            store.tryAcquire("a", T0);
        }

        Instant later = T0.plus(WINDOW).plusMillis(1);
        RateLimitResult result = store.tryAcquire("a", later);

        assertThat(result.getDecision()).isEqualTo(RateLimitDecision.ALLOW);
        RateLimitEntry entry = store.find("a").orElseThrow();
        assertThat(entry.count()).isEqualTo(1);
        assertThat(entry.windowStart()).isEqualTo(later);
        assertThat(entry.windowEnd()).isEqualTo(later.plus(WINDOW));
    }

    @Test
    void keysDoNotInterfere() {
        for (int i = 0; i < 4; i++) {
            store.tryAcquire("a", T0);
        }

        assertThat(store.tryAcquire("b", T0).getDecision()).isEqualTo(RateLimitDecision.ALLOW);
        assertThat(store.tryAcquire("a", T0).getDecision()).isEqualTo(RateLimitDecision.REJECT_RATE_LIMITED);
    }

    @Test
    void sweepDropsOnlyEntriesPastWindowAndGrace() {
        store.tryAcquire("old", T0);
        store.tryAcquire("fresh", T0.plus(WINDOW));

        // old window ended at T0+60s; with 30s grace it goes at T0+90s+
        clock.set(T0.plus(WINDOW).plusSeconds(31));
        store.sweep();

        assertThat(store.find("old")).isEmpty();
        assertThat(store.find("fresh")).isPresent();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void growingPastMaxKeysTriggersEagerSweep() {
        InMemoryRateLimitStore small = new InMemoryRateLimitStore(
                new RateLimitPolicy(3, WINDOW), clock, Duration.ZERO, 2);

        small.tryAcquire("k1", T0);
        small.tryAcquire("k2", T0);
        Instant later = T0.plus(WINDOW).plusSeconds(1);
        small.tryAcquire("k3", later);

        assertThat(small.size()).isEqualTo(1);
        assertThat(small.find("k3")).isPresent();
    }

    @Test
    void fullStoreOfLiveClientsRefusesNewClientsWithoutSweepingOnEveryRequest() {
        Duration shortWindow = Duration.ofMillis(100);
        InMemoryRateLimitStore full = new InMemoryRateLimitStore(
                new RateLimitPolicy(3, shortWindow), clock, Duration.ZERO, 2);

        full.tryAcquire("k1", T0);
        full.tryAcquire("k2", T0);

        // first sweep finds only live entries
        assertThat(full.tryAcquire("k3", T0.plusMillis(10)).getDecision())
                .isEqualTo(RateLimitDecision.REJECT_STORE_FAILURE);
        assertThat(full.size()).isEqualTo(2);

        // k1 and k2 have expired, but the next sweep is not due yet
        for (int i = 0; i < 50; i++) {
            assertThat(full.tryAcquire("new-" + i, T0.plusMillis(200 + i)).getDecision())
                    .isEqualTo(RateLimitDecision.REJECT_STORE_FAILURE);
        }
        assertThat(full.size()).isEqualTo(2);
        assertThat(full.find("k1")).isPresent();

        // known clients are still served while the store is full
        assertThat(full.tryAcquire("k1", T0.plusMillis(300)).isAllowed()).isTrue();

        Instant nextSweep = T0.plusMillis(10).plus(InMemoryRateLimitStore.EAGER_SWEEP_MIN_INTERVAL);
        RateLimitResult admitted = full.tryAcquire("k4", nextSweep);

        assertThat(admitted.isAllowed()).isTrue();
        assertThat(full.find("k2")).isEmpty();
        assertThat(full.find("k4")).isPresent();
        assertThat(full.size()).isLessThanOrEqualTo(2);
    }

    @Test
    void storeNeverGrowsPastMaxKeys() {
        InMemoryRateLimitStore small = new InMemoryRateLimitStore(
                new RateLimitPolicy(3, WINDOW), clock, Duration.ZERO, 5);

        for (int i = 0; i < 100; i++) {
            small.tryAcquire("client-" + i, T0.plusMillis(i));
        }

        assertThat(small.size()).isEqualTo(5);
    }

    @Test
    void concurrentRequestsForOneKeyNeverExceedCap() throws InterruptedException {
        InMemoryRateLimitStore contended = new InMemoryRateLimitStore(
                new RateLimitPolicy(30, WINDOW), clock, Duration.ofSeconds(30), 1_000);

        int numThreads = 50;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger allowCount = new AtomicInteger();
        AtomicInteger rejectCount = new AtomicInteger();

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (contended.tryAcquire("10.0.0.1", T0).isAllowed()) {
                        allowCount.incrementAndGet();
                    } else {
                        rejectCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertThat(doneLatch.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(allowCount.get()).isEqualTo(30);
        assertThat(rejectCount.get()).isEqualTo(20);
        assertThat(contended.find("10.0.0.1").orElseThrow().count()).isEqualTo(30);
    }

    @Test
    void concurrentRequestsAcrossKeysAreCountedIndependently() throws InterruptedException {
        int keys = 8;
        int perKey = 10;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(keys * perKey);
        AtomicInteger allowCount = new AtomicInteger();

        for (int k = 0; k < keys; k++) {
            String key = "client-" + k;
            for (int i = 0; i < perKey; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        if (store.tryAcquire(key, T0).isAllowed()) {
                            allowCount.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }
        }

        startLatch.countDown();
        assertThat(doneLatch.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(allowCount.get()).isEqualTo(keys * 3);
    }
}
