package com.tollgate.bootstrap;

import com.tollgate.cache.FastCache;
import com.tollgate.cache.FastCaches;
import com.tollgate.cache.RedisPools;
import com.tollgate.config.AppenderImplementation;
import com.tollgate.config.TollgateConfig;
import com.tollgate.executionlog.LogAppender;
import com.tollgate.executionlog.appender.LogAppenderFactory;
import com.tollgate.executionlog.store.ExecutionLogReader;
import com.tollgate.executionlog.store.JdbcExecutionLogStore;
import com.tollgate.jdbc.ConnectionProvider;
import com.tollgate.jdbc.JdbcConnectionProvider;
import com.tollgate.quota.QuotaLedger;
import com.tollgate.quota.QuotaSettings;
import com.tollgate.quota.store.JdbcQuotaStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;

import java.time.Clock;

/**
 * Builds the {@link TollgateContext} from configuration. Nothing connects to the database here; schema and
 * the appender worker come up in {@link TollgateContext#start()}.
 */
public final class TollgateBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TollgateBootstrap.class);

    private TollgateBootstrap() {
    }

    /** Configuration from TOLLGATE_* environment variables, metrics in a {@link SimpleMeterRegistry}. */
    public static TollgateContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(TollgateConfig.fromEnvironment(), new SimpleMeterRegistry());
    }

    public static TollgateContext initialize(TollgateConfig config, MeterRegistry registry) {
        log.info("Bootstrap: {}", config);
        ConnectionProvider connectionProvider = new JdbcConnectionProvider(config);
        JedisPool pool = config.isExternalCacheConfigured() ? RedisPools.create(config) : null;
        try {
            if (pool == null && config.getAppenderImplementation() == AppenderImplementation.REDIS) {
                throw new IllegalStateException("TOLLGATE_EXECUTION_LOG_APPENDER_IMPLEMENTATION=redis requires TOLLGATE_CACHE_HOST");
            }
            FastCache cache = FastCaches.fromConfig(config, pool);
            QuotaLedger ledger = new QuotaLedger(new JdbcQuotaStore(connectionProvider), cache,
                    QuotaSettings.fromConfig(config), Clock.systemUTC(), registry);
            LogAppender appender = LogAppenderFactory.create(config, new JdbcExecutionLogStore(connectionProvider), pool, registry);
            return new TollgateContext(config, connectionProvider, pool, cache, ledger, appender,
                    new ExecutionLogReader(connectionProvider), registry);
        } catch (RuntimeException e) {
            if (pool != null) {
                pool.close();
            }
            throw e;
        }
    }
}
