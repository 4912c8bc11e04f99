package com.tollgate.executionlog.appender;

import com.tollgate.config.TollgateConfig;
import com.tollgate.executionlog.LogAppender;
import com.tollgate.executionlog.codec.LogEventCodec;
import com.tollgate.executionlog.store.ExecutionLogStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;

import java.time.Duration;

/**
 * Builds the configured {@link LogAppender} variant (TOLLGATE_EXECUTION_LOG_APPENDER_IMPLEMENTATION).
 * Selected once at startup; the returned appender is not started.
 */
public final class LogAppenderFactory {

    private static final Logger log = LoggerFactory.getLogger(LogAppenderFactory.class);

    private LogAppenderFactory() {
    }

    /**
     * @param pool Redis pool; required only for the {@code redis} implementation
     */
    public static LogAppender create(TollgateConfig config, ExecutionLogStore store, JedisPool pool, MeterRegistry registry) {
        Duration flushInterval = Duration.ofMillis(config.getAppenderFlushEveryMs());
        switch (config.getAppenderImplementation()) {
            case REDIS:
                if (pool == null) {
                    throw new IllegalStateException("Redis appender selected but no cache host is configured; set TOLLGATE_CACHE_HOST");
                }
                log.info("Execution log appender: redis list '{}' maxQueue={}", config.getAppenderRedisQueueName(),
                        config.getAppenderMaxQueue());
                return new RedisLogAppender(new RedisLogQueue(pool, config.getAppenderRedisQueueName()), new LogEventCodec(),
                        store, config.getAppenderMaxQueue(), config.getAppenderMaxBatch(), flushInterval,
                        config.getAppenderDropPolicy(), registry);
            case QUEUE:
            default:
                log.info("Execution log appender: in-process queue maxQueue={}", config.getAppenderMaxQueue());
                return new QueueLogAppender(store, config.getAppenderMaxQueue(), config.getAppenderMaxBatch(), flushInterval,
                        config.getAppenderDropPolicy(), registry);
        }
    }
}
