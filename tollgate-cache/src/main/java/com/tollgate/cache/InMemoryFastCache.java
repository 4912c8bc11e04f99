package com.tollgate.cache;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link FastCache} used when no external cache is configured. Expired entries are dropped on
 * read and by a sweep that runs on writes at most once per {@link #SWEEP_INTERVAL_MILLIS}.
 * Per-process only: several instances each hold their own counters.
 */
public final class InMemoryFastCache implements FastCache {

    static final long SWEEP_INTERVAL_MILLIS = 60_000L;

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long defaultTtlSeconds;
    private final AtomicLong lastSweepMillis;

    public InMemoryFastCache(long defaultTtlSeconds) {
        this(Clock.systemUTC(), defaultTtlSeconds);
    }

    public InMemoryFastCache(Clock clock, long defaultTtlSeconds) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultTtlSeconds = Math.max(1L, defaultTtlSeconds);
        this.lastSweepMillis = new AtomicLong(clock.millis());
    }

    @Override
    public Optional<Long> get(String key) {
        Entry e = entries.get(key);
        if (e == null) return Optional.empty();
        if (e.expired(clock.millis())) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.value);
    }

    /** A TTL of 0 or less falls back to the configured default TTL. */
    @Override
    public void set(String key, long value, long ttlSeconds) {
        entries.put(key, new Entry(value, expiry(ttlSeconds)));
        sweepIfDue();
    }

    @Override
    public boolean setIfAbsent(String key, long value, long ttlSeconds) {
        long now = clock.millis();
        Entry fresh = new Entry(value, expiry(ttlSeconds));
        Entry stored = entries.compute(key, (k, e) -> e == null || e.expired(now) ? fresh : e);
        sweepIfDue();
        return stored == fresh;
    }

    @Override
    public Optional<Long> increment(String key, long delta, long ttlSeconds) {
        long now = clock.millis();
        long expiresAt = expiry(ttlSeconds);
        Entry updated = entries.compute(key, (k, e) ->
                new Entry(e == null || e.expired(now) ? delta : e.value + delta, expiresAt));
        sweepIfDue();
        return Optional.of(updated.value);
    }

    @Override
    public Optional<Long> getAndSet(String key, long value, long ttlSeconds) {
        Entry previous = entries.put(key, new Entry(value, expiry(ttlSeconds)));
        sweepIfDue();
        if (previous == null || previous.expired(clock.millis())) return Optional.empty();
        return Optional.of(previous.value);
    }

    int size() {
        return entries.size();
    }

    private long expiry(long ttlSeconds) {
        long ttl = ttlSeconds > 0 ? ttlSeconds : defaultTtlSeconds;
        return clock.millis() + ttl * 1000L;
    }

    private void sweepIfDue() {
        long now = clock.millis();
        long last = lastSweepMillis.get();
        if (now - last < SWEEP_INTERVAL_MILLIS || !lastSweepMillis.compareAndSet(last, now)) {
            return;
        }
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (e.getValue().expired(now)) {
                entries.remove(e.getKey(), e.getValue());
            }
        }
    }

    private static final class Entry {
        private final long value;
        private final long expiresAtMillis;

        private Entry(long value, long expiresAtMillis) {
            this.value = value;
            this.expiresAtMillis = expiresAtMillis;
        }

        private boolean expired(long nowMillis) {
            return expiresAtMillis <= nowMillis;
        }
    }
}
