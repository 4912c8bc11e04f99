package com.tollgate.jdbc;

import org.postgresql.util.PGobject;

import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Single responsibility: SQL value conversion for tollgate columns (UUID, name truncation, JSONB, timestamps).
 */
public final class SqlValues {

    public static final int NAME_MAX_LEN = 255;

    private SqlValues() {}

    /** Truncate to max length for name columns; null/blank returns null. */
    public static String toName(String s, int maxLen) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim();
        return t.length() > maxLen ? t.substring(0, maxLen) : t;
    }

    /** Wrap a JSON string as PG jsonb for a single ? placeholder; null stays SQL NULL. */
    public static PGobject toJsonb(String json) throws SQLException {
        if (json == null) return null;
        PGobject o = new PGobject();
        o.setType("jsonb");
        o.setValue(json);
        return o;
    }

    /** timestamptz parameter bound through {@code setObject}; independent of the JVM default zone. */
    public static OffsetDateTime toOffsetDateTime(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    public static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }

    /** Reads a uuid column that the driver may hand back as {@link UUID} or as text. */
    public static UUID toUuid(Object value) {
        if (value == null) return null;
        if (value instanceof UUID) return (UUID) value;
        return UUID.fromString(value.toString().trim());
    }
}
