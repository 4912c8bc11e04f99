package com.tollgate.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed {@link FastCache} on plain string keys holding decimal numbers
 * (GET, SETEX, SET NX EX, INCRBY with EXPIRE, SET EX GET).
 * Transport errors are logged at debug level and swallowed.
 */
public final class RedisFastCache implements FastCache {

    private static final Logger log = LoggerFactory.getLogger(RedisFastCache.class);

    private final JedisPool pool;

    public RedisFastCache(JedisPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public Optional<Long> get(String key) {
        try (var jedis = pool.getResource()) {
            return parse(key, jedis.get(key));
        } catch (JedisException e) {
            log.debug("Fast cache GET failed for key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, long value, long ttlSeconds) {
        try (var jedis = pool.getResource()) {
            jedis.setex(key, ttl(ttlSeconds), Long.toString(value));
        } catch (JedisException e) {
            log.debug("Fast cache SETEX failed for key={}: {}", key, e.getMessage());
        }
    }

    @Override
    public boolean setIfAbsent(String key, long value, long ttlSeconds) {
        try (var jedis = pool.getResource()) {
            return "OK".equals(jedis.set(key, Long.toString(value), SetParams.setParams().nx().ex(ttl(ttlSeconds))));
        } catch (JedisException e) {
            log.debug("Fast cache SET NX failed for key={}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Long> increment(String key, long delta, long ttlSeconds) {
        try (var jedis = pool.getResource()) {
            long value = jedis.incrBy(key, delta);
            jedis.expire(key, ttl(ttlSeconds));
            return Optional.of(value);
        } catch (JedisException e) {
            log.debug("Fast cache INCRBY failed for key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<Long> getAndSet(String key, long value, long ttlSeconds) {
        try (var jedis = pool.getResource()) {
            return parse(key, jedis.setGet(key, Long.toString(value), SetParams.setParams().ex(ttl(ttlSeconds))));
        } catch (JedisException e) {
            log.debug("Fast cache SET GET failed for key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Long> parse(String key, String v) {
        if (v == null || v.isBlank()) return Optional.empty();
        try {
            return Optional.of(Long.parseLong(v.trim()));
        } catch (NumberFormatException e) {
            log.debug("Fast cache value for key={} is not a number; treating as absent", key);
            return Optional.empty();
        }
    }

    private static long ttl(long ttlSeconds) {
        return Math.max(1L, ttlSeconds);
    }
}
