package com.tollgate.cache;

import java.util.Optional;

/**
 * Best-effort key/value cache with per-entry TTL, used only to shave database round trips.
 * <p>
 * Implementations never throw: a transport failure makes reads return empty, {@link #setIfAbsent}
 * return false and {@link #set(String, long, long)} a no-op. Each single-key operation is atomic;
 * there is no ordering or atomicity across keys. TTLs below 1 second are raised to 1.
 */
public interface FastCache {

    /** Current value of the key, or empty when absent, expired, unparsable or unreachable. */
    Optional<Long> get(String key);

    /** Stores the value with the given TTL in seconds. */
    void set(String key, long value, long ttlSeconds);

    /** Stores the value only when the key holds nothing. Returns true when this call stored it. */
    boolean setIfAbsent(String key, long value, long ttlSeconds);

    /**
     * Atomically adds {@code delta} (an absent key counts as 0) and refreshes the TTL.
     *
     * @return the value after the addition, or empty when the cache is unreachable
     */
    Optional<Long> increment(String key, long delta, long ttlSeconds);

    /** Atomically replaces the value and returns the previous one (empty when there was none). */
    Optional<Long> getAndSet(String key, long value, long ttlSeconds);
}
