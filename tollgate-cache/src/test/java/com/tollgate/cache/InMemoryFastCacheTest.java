package com.tollgate.cache;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryFastCacheTest {

    @Test
    void get_returnsStoredValueUntilTtlElapses() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        InMemoryFastCache cache = new InMemoryFastCache(clock, 60);

        cache.set("quota:p:202403", 42L, 10);
        assertEquals(Optional.of(42L), cache.get("quota:p:202403"));

        clock.advance(Duration.ofSeconds(9));
        assertEquals(Optional.of(42L), cache.get("quota:p:202403"));

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("quota:p:202403").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void set_withoutTtlUsesDefault() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        InMemoryFastCache cache = new InMemoryFastCache(clock, 30);

        cache.set("k", 1L, 0);
        clock.advance(Duration.ofSeconds(29));
        assertEquals(Optional.of(1L), cache.get("k"));
        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    void get_missingKeyIsEmpty() {
        assertTrue(new InMemoryFastCache(60).get("absent").isEmpty());
    }

    @Test
    void set_overwritesPreviousValue() {
        InMemoryFastCache cache = new InMemoryFastCache(60);
        cache.set("k", 1L, 60);
        cache.set("k", 5L, 60);
        assertEquals(Optional.of(5L), cache.get("k"));
    }

    @Test
    void increment_startsFromZeroAndAccumulates() {
        InMemoryFastCache cache = new InMemoryFastCache(60);

        assertEquals(Optional.of(3L), cache.increment("k", 3, 60));
        assertEquals(Optional.of(1L), cache.increment("k", -2, 60));
        assertEquals(Optional.of(1L), cache.get("k"));
    }

    @Test
    void increment_restartsExpiredEntry() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        InMemoryFastCache cache = new InMemoryFastCache(clock, 60);
        cache.set("k", 40L, 5);

        clock.advance(Duration.ofSeconds(5));

        assertEquals(Optional.of(2L), cache.increment("k", 2, 5));
    }

    @Test
    void increment_concurrentAddsAreNeverLost() throws Exception {
        InMemoryFastCache cache = new InMemoryFastCache(60);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 16; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 1000; i++) {
                        cache.increment("counter", 1, 60);
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(Optional.of(16_000L), cache.get("counter"));
    }

    @Test
    void setIfAbsent_keepsLiveValue() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        InMemoryFastCache cache = new InMemoryFastCache(clock, 60);

        assertTrue(cache.setIfAbsent("k", 7L, 10));
        assertFalse(cache.setIfAbsent("k", 9L, 10));
        assertEquals(Optional.of(7L), cache.get("k"));

        clock.advance(Duration.ofSeconds(10));
        assertTrue(cache.setIfAbsent("k", 9L, 10));
        assertEquals(Optional.of(9L), cache.get("k"));
    }

    @Test
    void getAndSet_returnsPreviousLiveValue() {
        InMemoryFastCache cache = new InMemoryFastCache(60);

        assertTrue(cache.getAndSet("pending", 0L, 60).isEmpty());
        cache.increment("pending", 12, 60);
        assertEquals(Optional.of(12L), cache.getAndSet("pending", 0L, 60));
        assertEquals(Optional.of(0L), cache.get("pending"));
    }

    @Test
    void writes_sweepEntriesThatAreNeverReadAgain() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-31T23:59:00Z"));
        InMemoryFastCache cache = new InMemoryFastCache(clock, 60);
        cache.set("quota:p:202403", 10L, 60);
        cache.set("quota:p:202403:limit", 100L, 60);
        cache.increment("quota:p:202403:pending", 1, 60);
        assertEquals(3, cache.size());

        clock.advance(Duration.ofMillis(InMemoryFastCache.SWEEP_INTERVAL_MILLIS));
        cache.set("quota:p:202404", 0L, 3600);

        assertEquals(1, cache.size());
        assertEquals(Optional.of(0L), cache.get("quota:p:202404"));
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
