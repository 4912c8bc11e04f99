package com.tollgate.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Single responsibility: load and execute one classpath schema script (CREATE ... IF NOT EXISTS statements).
 * Idempotent; safe to call at bootstrap.
 */
public final class SchemaBootstrapper {

    private static final Logger log = LoggerFactory.getLogger(SchemaBootstrapper.class);

    private final String schemaResource;
    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public SchemaBootstrapper(String schemaResource) {
        this.schemaResource = Objects.requireNonNull(schemaResource, "schemaResource");
    }

    /**
     * Creates tables and indexes from the script if they do not exist. Runs at most once per instance.
     *
     * @throws IllegalStateException if a statement fails or the script cannot be read
     */
    public void ensureSchema(ConnectionProvider connectionProvider) {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Schema {} already initialized; skipping", schemaResource);
            return;
        }
        try {
            execute(connectionProvider, splitStatements(loadScript()));
        } catch (RuntimeException e) {
            schemaInitialized.set(false);
            throw e;
        }
    }

    private void execute(ConnectionProvider connectionProvider, List<String> statements) {
        log.info("Schema: executing {} statement(s) from {} via {}", statements.size(), schemaResource, connectionProvider);
        try (Connection c = connectionProvider.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String stmt : statements) {
                index++;
                String preview = stmt.length() > 60 ? stmt.substring(0, 60) + "..." : stmt;
                log.debug("Schema: executing statement {}/{}: {}", index, statements.size(), preview);
                try {
                    st.execute(stmt);
                } catch (SQLException e) {
                    log.error("Schema: statement {}/{} failed. SQL: {} | Error: {} | SQLState: {}", index, statements.size(), preview, e.getMessage(), e.getSQLState(), e);
                    throw new IllegalStateException("Schema execution failed at statement " + index + " of " + schemaResource + ": " + e.getMessage(), e);
                }
            }
            log.info("Schema: all {} statement(s) from {} executed successfully", statements.size(), schemaResource);
        } catch (SQLException e) {
            log.error("Schema: connection failed for {} error={} SQLState={}", schemaResource, e.getMessage(), e.getSQLState(), e);
            throw new IllegalStateException("Schema execution failed: " + e.getMessage(), e);
        }
    }

    /** Splits on ';' and drops blank statements and full-line {@code --} comments. */
    static List<String> splitStatements(String sql) {
        List<String> out = new ArrayList<>();
        String withoutComments = sql.replaceAll("(?m)^\\s*--[^\n]*\n?", "");
        for (String raw : withoutComments.split(";")) {
            String stmt = raw.trim();
            if (!stmt.isEmpty()) out.add(stmt);
        }
        return out;
    }

    String loadScript() {
        try (var in = SchemaBootstrapper.class.getClassLoader().getResourceAsStream(schemaResource)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found on classpath: " + schemaResource);
            }
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines().collect(Collectors.joining("\n"));
        } catch (java.io.IOException e) {
            throw new IllegalStateException("Schema load failed: " + schemaResource + ": " + e.getMessage(), e);
        }
    }
}
