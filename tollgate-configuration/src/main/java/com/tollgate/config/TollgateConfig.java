package com.tollgate.config;

import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for quota enforcement and execution logging.
 * <p>
 * DB: TOLLGATE_DB_HOST, TOLLGATE_DB_PORT, TOLLGATE_DB_NAME, TOLLGATE_DB_USER, TOLLGATE_DB_PASSWORD.
 * Cache: TOLLGATE_CACHE_HOST (unset selects the in-process cache), TOLLGATE_CACHE_PORT, TOLLGATE_CACHE_DB,
 * TOLLGATE_CACHE_PASSWORD, TOLLGATE_CACHE_TTL_SECONDS.
 * <p>
 * The quota time zone is resolved when the config is built, so an invalid identifier fails at startup.
 */
public final class TollgateConfig {

    private static final String ENV_DB_HOST = "TOLLGATE_DB_HOST";
    private static final String ENV_DB_PORT = "TOLLGATE_DB_PORT";
    private static final String ENV_DB_NAME = "TOLLGATE_DB_NAME";
    private static final String ENV_DB_USER = "TOLLGATE_DB_USER";
    private static final String ENV_DB_PASSWORD = "TOLLGATE_DB_PASSWORD";
    private static final String ENV_CACHE_HOST = "TOLLGATE_CACHE_HOST";
    private static final String ENV_CACHE_PORT = "TOLLGATE_CACHE_PORT";
    private static final String ENV_CACHE_DB = "TOLLGATE_CACHE_DB";
    private static final String ENV_CACHE_PASSWORD = "TOLLGATE_CACHE_PASSWORD";
    private static final String ENV_CACHE_TTL_SECONDS = "TOLLGATE_CACHE_TTL_SECONDS";
    private static final String ENV_QUOTA_TIMEZONE = "TOLLGATE_QUOTA_TIMEZONE";
    private static final String ENV_QUOTA_SOFT_WINDOW_FRACTION = "TOLLGATE_QUOTA_SOFT_WINDOW_FRACTION";
    private static final String ENV_QUOTA_SOFT_WINDOW_MIN = "TOLLGATE_QUOTA_SOFT_WINDOW_MIN";
    private static final String ENV_QUOTA_CHECKPOINT_FRACTION = "TOLLGATE_QUOTA_CHECKPOINT_FRACTION";
    private static final String ENV_APPENDER_IMPLEMENTATION = "TOLLGATE_EXECUTION_LOG_APPENDER_IMPLEMENTATION";
    private static final String ENV_APPENDER_MAX_QUEUE = "TOLLGATE_EXECUTION_LOG_APPENDER_MAX_QUEUE";
    private static final String ENV_APPENDER_FLUSH_EVERY_MS = "TOLLGATE_EXECUTION_LOG_APPENDER_FLUSH_EVERY_MS";
    private static final String ENV_APPENDER_MAX_BATCH = "TOLLGATE_EXECUTION_LOG_APPENDER_MAX_BATCH";
    private static final String ENV_APPENDER_DROP_POLICY = "TOLLGATE_EXECUTION_LOG_APPENDER_DROP_POLICY";
    private static final String ENV_APPENDER_REDIS_QUEUE_NAME = "TOLLGATE_EXECUTION_LOG_APPENDER_REDIS_QUEUE_NAME";
    private static final String ENV_SCHEMA_BOOTSTRAP = "TOLLGATE_SCHEMA_BOOTSTRAP";

    private static final String DEFAULT_DB_NAME = "tollgate";
    private static final String DEFAULT_DB_USER = "tollgate";
    private static final int DEFAULT_CACHE_TTL_SECONDS = 60;
    private static final String DEFAULT_QUOTA_TIMEZONE = "Asia/Bangkok";
    private static final double DEFAULT_SOFT_WINDOW_FRACTION = 0.05;
    private static final int DEFAULT_SOFT_WINDOW_MIN = 10;
    private static final double DEFAULT_CHECKPOINT_FRACTION = 0.10;
    private static final int DEFAULT_MAX_QUEUE = 5000;
    private static final int DEFAULT_FLUSH_EVERY_MS = 200;
    private static final int DEFAULT_MAX_BATCH = 500;
    private static final String DEFAULT_REDIS_QUEUE_NAME = "execution_logs";

    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final String cacheHost;
    private final int cachePort;
    private final int cacheDb;
    private final String cachePassword;
    private final int cacheTtlSeconds;
    private final ZoneId quotaZone;
    private final double quotaSoftWindowFraction;
    private final int quotaSoftWindowMinimum;
    private final double quotaCheckpointFraction;
    private final AppenderImplementation appenderImplementation;
    private final int appenderMaxQueue;
    private final int appenderFlushEveryMs;
    private final int appenderMaxBatch;
    private final DropPolicy appenderDropPolicy;
    private final String appenderRedisQueueName;
    private final boolean schemaBootstrapEnabled;

    private TollgateConfig(Builder b) {
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName != null ? b.dbName : DEFAULT_DB_NAME;
        this.dbUser = b.dbUser != null ? b.dbUser : DEFAULT_DB_USER;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.cacheDb = b.cacheDb;
        this.cachePassword = b.cachePassword;
        this.cacheTtlSeconds = b.cacheTtlSeconds > 0 ? b.cacheTtlSeconds : DEFAULT_CACHE_TTL_SECONDS;
        // ZoneId.of throws DateTimeException for unknown ids: fail at startup, not on first charge.
        this.quotaZone = ZoneId.of(b.quotaTimezone);
        this.quotaSoftWindowFraction = requireFraction(b.quotaSoftWindowFraction, "quotaSoftWindowFraction");
        this.quotaSoftWindowMinimum = Math.max(0, b.quotaSoftWindowMinimum);
        this.quotaCheckpointFraction = requireFraction(b.quotaCheckpointFraction, "quotaCheckpointFraction");
        this.appenderImplementation = b.appenderImplementation;
        this.appenderMaxQueue = requirePositive(b.appenderMaxQueue, "appenderMaxQueue");
        this.appenderFlushEveryMs = requirePositive(b.appenderFlushEveryMs, "appenderFlushEveryMs");
        this.appenderMaxBatch = requirePositive(b.appenderMaxBatch, "appenderMaxBatch");
        this.appenderDropPolicy = b.appenderDropPolicy != null
                ? b.appenderDropPolicy
                : appenderImplementation.defaultDropPolicy();
        this.appenderRedisQueueName = b.appenderRedisQueueName;
        this.schemaBootstrapEnabled = b.schemaBootstrapEnabled;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    /** Database name (TOLLGATE_DB_NAME). Default "tollgate". */
    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    /** JDBC URL for the PostgreSQL database holding projects and execution logs. */
    public String getJdbcUrl() {
        return "jdbc:postgresql://" + dbHost + ":" + dbPort + "/" + dbName;
    }

    /** Redis host, or null when no external cache is configured. */
    public String getCacheHost() {
        return cacheHost;
    }

    public boolean isExternalCacheConfigured() {
        return cacheHost != null && !cacheHost.isBlank();
    }

    public int getCachePort() {
        return cachePort;
    }

    public int getCacheDb() {
        return cacheDb;
    }

    public String getCachePassword() {
        return cachePassword;
    }

    /** Fallback TTL for cache entries written without an explicit TTL. Default 60. */
    public int getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    /** Zone whose calendar months bound the monthly quota (TOLLGATE_QUOTA_TIMEZONE). */
    public ZoneId getQuotaZone() {
        return quotaZone;
    }

    public double getQuotaSoftWindowFraction() {
        return quotaSoftWindowFraction;
    }

    public int getQuotaSoftWindowMinimum() {
        return quotaSoftWindowMinimum;
    }

    public double getQuotaCheckpointFraction() {
        return quotaCheckpointFraction;
    }

    public AppenderImplementation getAppenderImplementation() {
        return appenderImplementation;
    }

    /** Buffer capacity of the execution log appender. Default 5000. */
    public int getAppenderMaxQueue() {
        return appenderMaxQueue;
    }

    public int getAppenderFlushEveryMs() {
        return appenderFlushEveryMs;
    }

    public int getAppenderMaxBatch() {
        return appenderMaxBatch;
    }

    /**
     * Drop policy for the appender; when not configured explicitly the implementation's default
     * ({@link DropPolicy#DROP_NEW} for the in-process queue, {@link DropPolicy#DROP_OLDEST} for Redis).
     */
    public DropPolicy getAppenderDropPolicy() {
        return appenderDropPolicy;
    }

    public String getAppenderRedisQueueName() {
        return appenderRedisQueueName;
    }

    /** Whether schema scripts are applied at startup (TOLLGATE_SCHEMA_BOOTSTRAP). Default true. */
    public boolean isSchemaBootstrapEnabled() {
        return schemaBootstrapEnabled;
    }

    public static TollgateConfig fromEnvironment() {
        String dropPolicy = getEnv(ENV_APPENDER_DROP_POLICY, null);
        return builder()
                .dbHost(getEnv(ENV_DB_HOST, "localhost"))
                .dbPort(parseInt(System.getenv(ENV_DB_PORT), 5432))
                .dbName(getEnv(ENV_DB_NAME, DEFAULT_DB_NAME))
                .dbUser(getEnv(ENV_DB_USER, DEFAULT_DB_USER))
                .dbPassword(getEnv(ENV_DB_PASSWORD, ""))
                .cacheHost(getEnv(ENV_CACHE_HOST, null))
                .cachePort(parseInt(System.getenv(ENV_CACHE_PORT), 6379))
                .cacheDb(parseInt(System.getenv(ENV_CACHE_DB), 0))
                .cachePassword(getEnv(ENV_CACHE_PASSWORD, null))
                .cacheTtlSeconds(parseInt(System.getenv(ENV_CACHE_TTL_SECONDS), DEFAULT_CACHE_TTL_SECONDS))
                .quotaTimezone(getEnv(ENV_QUOTA_TIMEZONE, DEFAULT_QUOTA_TIMEZONE))
                .quotaSoftWindowFraction(parseDouble(System.getenv(ENV_QUOTA_SOFT_WINDOW_FRACTION), DEFAULT_SOFT_WINDOW_FRACTION))
                .quotaSoftWindowMinimum(parseInt(System.getenv(ENV_QUOTA_SOFT_WINDOW_MIN), DEFAULT_SOFT_WINDOW_MIN))
                .quotaCheckpointFraction(parseDouble(System.getenv(ENV_QUOTA_CHECKPOINT_FRACTION), DEFAULT_CHECKPOINT_FRACTION))
                .appenderImplementation(AppenderImplementation.fromId(getEnv(ENV_APPENDER_IMPLEMENTATION, "queue")))
                .appenderMaxQueue(parseInt(System.getenv(ENV_APPENDER_MAX_QUEUE), DEFAULT_MAX_QUEUE))
                .appenderFlushEveryMs(parseInt(System.getenv(ENV_APPENDER_FLUSH_EVERY_MS), DEFAULT_FLUSH_EVERY_MS))
                .appenderMaxBatch(parseInt(System.getenv(ENV_APPENDER_MAX_BATCH), DEFAULT_MAX_BATCH))
                .appenderDropPolicy(dropPolicy != null ? DropPolicy.fromId(dropPolicy) : null)
                .appenderRedisQueueName(getEnv(ENV_APPENDER_REDIS_QUEUE_NAME, DEFAULT_REDIS_QUEUE_NAME))
                .schemaBootstrapEnabled(parseBoolean(System.getenv(ENV_SCHEMA_BOOTSTRAP), true))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static double requireFraction(double value, String name) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be within [0, 1]: " + value);
        }
        return value;
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "TollgateConfig{db=%s:%d/%s, cache=%s, quotaZone=%s, appender=%s(maxQueue=%d, flushEveryMs=%d, maxBatch=%d, dropPolicy=%s)}",
                dbHost, dbPort, dbName, isExternalCacheConfigured() ? cacheHost + ":" + cachePort + "/" + cacheDb : "in-memory",
                quotaZone, appenderImplementation.id(), appenderMaxQueue, appenderFlushEveryMs, appenderMaxBatch, appenderDropPolicy.id());
    }

    public static final class Builder {
        private String dbHost = "localhost";
        private int dbPort = 5432;
        private String dbName = DEFAULT_DB_NAME;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";
        private String cacheHost;
        private int cachePort = 6379;
        private int cacheDb;
        private String cachePassword;
        private int cacheTtlSeconds = DEFAULT_CACHE_TTL_SECONDS;
        private String quotaTimezone = DEFAULT_QUOTA_TIMEZONE;
        private double quotaSoftWindowFraction = DEFAULT_SOFT_WINDOW_FRACTION;
        private int quotaSoftWindowMinimum = DEFAULT_SOFT_WINDOW_MIN;
        private double quotaCheckpointFraction = DEFAULT_CHECKPOINT_FRACTION;
        private AppenderImplementation appenderImplementation = AppenderImplementation.QUEUE;
        private int appenderMaxQueue = DEFAULT_MAX_QUEUE;
        private int appenderFlushEveryMs = DEFAULT_FLUSH_EVERY_MS;
        private int appenderMaxBatch = DEFAULT_MAX_BATCH;
        private DropPolicy appenderDropPolicy;
        private String appenderRedisQueueName = DEFAULT_REDIS_QUEUE_NAME;
        private boolean schemaBootstrapEnabled = true;

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder cacheDb(int cacheDb) {
            this.cacheDb = cacheDb;
            return this;
        }

        public Builder cachePassword(String cachePassword) {
            this.cachePassword = cachePassword;
            return this;
        }

        public Builder cacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = cacheTtlSeconds;
            return this;
        }

        public Builder quotaTimezone(String quotaTimezone) {
            this.quotaTimezone = Objects.requireNonNull(quotaTimezone, "quotaTimezone");
            return this;
        }

        public Builder quotaSoftWindowFraction(double quotaSoftWindowFraction) {
            this.quotaSoftWindowFraction = quotaSoftWindowFraction;
            return this;
        }

        public Builder quotaSoftWindowMinimum(int quotaSoftWindowMinimum) {
            this.quotaSoftWindowMinimum = quotaSoftWindowMinimum;
            return this;
        }

        public Builder quotaCheckpointFraction(double quotaCheckpointFraction) {
            this.quotaCheckpointFraction = quotaCheckpointFraction;
            return this;
        }

        public Builder appenderImplementation(AppenderImplementation appenderImplementation) {
            this.appenderImplementation = Objects.requireNonNull(appenderImplementation, "appenderImplementation");
            return this;
        }

        public Builder appenderMaxQueue(int appenderMaxQueue) {
            this.appenderMaxQueue = appenderMaxQueue;
            return this;
        }

        public Builder appenderFlushEveryMs(int appenderFlushEveryMs) {
            this.appenderFlushEveryMs = appenderFlushEveryMs;
            return this;
        }

        public Builder appenderMaxBatch(int appenderMaxBatch) {
            this.appenderMaxBatch = appenderMaxBatch;
            return this;
        }

        /** Null keeps the implementation's default policy. */
        public Builder appenderDropPolicy(DropPolicy appenderDropPolicy) {
            this.appenderDropPolicy = appenderDropPolicy;
            return this;
        }

        public Builder appenderRedisQueueName(String appenderRedisQueueName) {
            this.appenderRedisQueueName = appenderRedisQueueName != null ? appenderRedisQueueName : DEFAULT_REDIS_QUEUE_NAME;
            return this;
        }

        public Builder schemaBootstrapEnabled(boolean schemaBootstrapEnabled) {
            this.schemaBootstrapEnabled = schemaBootstrapEnabled;
            return this;
        }

        public TollgateConfig build() {
            return new TollgateConfig(this);
        }
    }
}
