package com.tollgate.executionlog.appender;

import redis.clients.jedis.JedisPool;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/** {@link ExternalLogQueue} on a Redis list: capacity-checked LPUSH and LPUSH+LTRIM as Lua scripts, RPOP. */
public final class RedisLogQueue implements ExternalLogQueue {

    static final String SCRIPT_PUSH_IF_ROOM =
            "if redis.call('LLEN', KEYS[1]) >= tonumber(ARGV[2]) then return -1 end " +
            "return redis.call('LPUSH', KEYS[1], ARGV[1])";
    static final String SCRIPT_PUSH_EVICTING_OLDEST =
            "local n = redis.call('LPUSH', KEYS[1], ARGV[1]) " +
            "local cap = tonumber(ARGV[2]) " +
            "if n > cap then redis.call('LTRIM', KEYS[1], 0, cap - 1) return n - cap end " +
            "return 0";

    private final JedisPool pool;
    private final String key;

    public RedisLogQueue(JedisPool pool, String key) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.key = Objects.requireNonNull(key, "key");
    }

    @Override
    public OptionalLong pushIfRoom(String item, int capacity) {
        long length = eval(SCRIPT_PUSH_IF_ROOM, item, capacity);
        return length < 0 ? OptionalLong.empty() : OptionalLong.of(length);
    }

    @Override
    public long pushEvictingOldest(String item, int capacity) {
        return eval(SCRIPT_PUSH_EVICTING_OLDEST, item, capacity);
    }

    @Override
    public Optional<String> popOldest() {
        try (var jedis = pool.getResource()) {
            return Optional.ofNullable(jedis.rpop(key));
        }
    }

    private long eval(String script, String item, int capacity) {
        try (var jedis = pool.getResource()) {
            Object result = jedis.eval(script, List.of(key), List.of(item, Integer.toString(capacity)));
            return ((Number) result).longValue();
        }
    }

    @Override
    public String toString() {
        return "RedisLogQueue{" + key + "}";
    }
}
