package com.tollgate.cache;

import com.tollgate.config.TollgateConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

/**
 * Creates the shared {@link JedisPool} from {@link TollgateConfig} (TOLLGATE_CACHE_HOST, _PORT, _DB, _PASSWORD).
 */
public final class RedisPools {

    private static final Logger log = LoggerFactory.getLogger(RedisPools.class);

    /** Socket and connect timeout; a slow cache must not stall the request path. */
    static final int TIMEOUT_MILLIS = 1000;

    private RedisPools() {
    }

    public static JedisPool create(TollgateConfig config) {
        return create(config, new JedisPoolConfig());
    }

    public static JedisPool create(TollgateConfig config, JedisPoolConfig poolConfig) {
        if (!config.isExternalCacheConfigured()) {
            throw new IllegalStateException("No cache host configured; set TOLLGATE_CACHE_HOST");
        }
        JedisPool pool = new JedisPool(poolConfig, config.getCacheHost(), config.getCachePort(), TIMEOUT_MILLIS,
                config.getCachePassword(), config.getCacheDb());
        log.info("Redis pool created for {}:{} db={}", config.getCacheHost(), config.getCachePort(), config.getCacheDb());
        return pool;
    }
}
