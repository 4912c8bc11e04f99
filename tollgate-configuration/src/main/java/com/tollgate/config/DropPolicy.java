package com.tollgate.config;

import java.util.Locale;

/**
 * What an appender discards when its buffer is at capacity.
 */
public enum DropPolicy {

    /** Reject the incoming event; buffered events are kept. */
    DROP_NEW("drop_new"),
    /** Discard the oldest buffered event to make room for the incoming one. */
    DROP_OLDEST("drop_oldest");

    private final String id;

    DropPolicy(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves {@code drop_new} or {@code drop_oldest}. Legacy variants that only add a suffix
     * (e.g. {@code drop_new_lowprio}) map to the policy they start with.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static DropPolicy fromId(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (normalized.startsWith(DROP_OLDEST.id)) {
            return DROP_OLDEST;
        }
        if (normalized.startsWith(DROP_NEW.id)) {
            return DROP_NEW;
        }
        throw new IllegalArgumentException("Unknown drop policy: " + id);
    }
}
