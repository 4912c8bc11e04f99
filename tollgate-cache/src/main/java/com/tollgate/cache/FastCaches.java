package com.tollgate.cache;

import com.tollgate.config.TollgateConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;

/**
 * Selects the {@link FastCache} implementation once at startup.
 */
public final class FastCaches {

    private static final Logger log = LoggerFactory.getLogger(FastCaches.class);

    private FastCaches() {
    }

    /**
     * Redis-backed cache when a cache host is configured and a pool is given; otherwise the in-process fallback.
     *
     * @param pool shared pool, may be null when no external cache is configured
     */
    public static FastCache fromConfig(TollgateConfig config, JedisPool pool) {
        if (config.isExternalCacheConfigured() && pool != null) {
            log.info("Fast cache: Redis at {}:{}", config.getCacheHost(), config.getCachePort());
            return new RedisFastCache(pool);
        }
        log.info("Fast cache: in-memory fallback (defaultTtlSeconds={})", config.getCacheTtlSeconds());
        return new InMemoryFastCache(config.getCacheTtlSeconds());
    }
}
