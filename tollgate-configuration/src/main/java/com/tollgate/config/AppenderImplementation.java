package com.tollgate.config;

import java.util.Locale;

/**
 * Buffer backend for the execution log appender. Chosen once at startup; never re-selected per call.
 */
public enum AppenderImplementation {

    /** In-process bounded queue. */
    QUEUE("queue", DropPolicy.DROP_NEW),
    /** Redis list shared by all process instances. */
    REDIS("redis", DropPolicy.DROP_OLDEST);

    private final String id;
    private final DropPolicy defaultDropPolicy;

    AppenderImplementation(String id, DropPolicy defaultDropPolicy) {
        this.id = id;
        this.defaultDropPolicy = defaultDropPolicy;
    }

    public String id() {
        return id;
    }

    public DropPolicy defaultDropPolicy() {
        return defaultDropPolicy;
    }

    /**
     * Resolves the configured identifier ({@code queue} or {@code redis}, case-insensitive).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static AppenderImplementation fromId(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (AppenderImplementation impl : values()) {
            if (impl.id.equals(normalized)) {
                return impl;
            }
        }
        throw new IllegalArgumentException("Unknown log appender implementation: " + id);
    }
}
