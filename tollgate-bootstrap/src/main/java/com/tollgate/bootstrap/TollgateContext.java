package com.tollgate.bootstrap;

import com.tollgate.cache.FastCache;
import com.tollgate.config.TollgateConfig;
import com.tollgate.executionlog.LogAppender;
import com.tollgate.executionlog.store.ExecutionLogReader;
import com.tollgate.jdbc.ConnectionProvider;
import com.tollgate.jdbc.SchemaBootstrapper;
import com.tollgate.quota.QuotaLedger;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Application context built once by {@link TollgateBootstrap}: shared pools, the quota ledger and the
 * execution log appender. Request handlers receive it (or {@link #getExecutionMeter()}) instead of
 * reaching for globals. {@link #start()} and {@link #close()} are called from service startup and shutdown.
 */
public final class TollgateContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TollgateContext.class);

    static final List<String> SCHEMA_RESOURCES = List.of("schema/tollgate-quota.sql", "schema/tollgate-execution-log.sql");
    static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private final TollgateConfig config;
    private final ConnectionProvider connectionProvider;
    private final JedisPool jedisPool;
    private final FastCache fastCache;
    private final QuotaLedger quotaLedger;
    private final LogAppender appender;
    private final ExecutionLogReader executionLogReader;
    private final ExecutionMeter executionMeter;
    private final MeterRegistry meterRegistry;
    private final List<SchemaBootstrapper> schemaBootstrappers;

    TollgateContext(TollgateConfig config, ConnectionProvider connectionProvider, JedisPool jedisPool, FastCache fastCache,
                    QuotaLedger quotaLedger, LogAppender appender, ExecutionLogReader executionLogReader,
                    MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "config");
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.jedisPool = jedisPool;
        this.fastCache = Objects.requireNonNull(fastCache, "fastCache");
        this.quotaLedger = Objects.requireNonNull(quotaLedger, "quotaLedger");
        this.appender = Objects.requireNonNull(appender, "appender");
        this.executionLogReader = Objects.requireNonNull(executionLogReader, "executionLogReader");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.executionMeter = new ExecutionMeter(quotaLedger, appender);
        this.schemaBootstrappers = SCHEMA_RESOURCES.stream().map(SchemaBootstrapper::new).toList();
    }

    /**
     * Applies the schema scripts (unless TOLLGATE_SCHEMA_BOOTSTRAP=false) and starts the appender worker.
     *
     * @throws IllegalStateException if a schema script fails
     */
    public void start() {
        if (config.isSchemaBootstrapEnabled()) {
            for (SchemaBootstrapper bootstrapper : schemaBootstrappers) {
                bootstrapper.ensureSchema(connectionProvider);
            }
        } else {
            log.info("Schema bootstrap disabled; expecting tables to exist");
        }
        appender.start();
        log.info("Tollgate started | appender={} cache={}", config.getAppenderImplementation().id(),
                fastCache.getClass().getSimpleName());
    }

    /** Stops the appender (bounded wait) and closes the Redis pool. Safe to call more than once. */
    @Override
    public void close() {
        try {
            appender.stop(STOP_TIMEOUT);
        } finally {
            if (jedisPool != null && !jedisPool.isClosed()) {
                jedisPool.close();
            }
        }
        log.info("Tollgate stopped | droppedExecutionLogs={}", appender.droppedCount());
    }

    public TollgateConfig getConfig() {
        return config;
    }

    public ConnectionProvider getConnectionProvider() {
        return connectionProvider;
    }

    public FastCache getFastCache() {
        return fastCache;
    }

    public QuotaLedger getQuotaLedger() {
        return quotaLedger;
    }

    public LogAppender getAppender() {
        return appender;
    }

    public ExecutionLogReader getExecutionLogReader() {
        return executionLogReader;
    }

    public ExecutionMeter getExecutionMeter() {
        return executionMeter;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
