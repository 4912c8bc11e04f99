package com.tollgate.jdbc;

import com.tollgate.config.TollgateConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

/**
 * Single responsibility: provide JDBC connections to the tollgate database (PostgreSQL, UTC sessions).
 */
public final class JdbcConnectionProvider implements ConnectionProvider {

    /** Server-side session zone, sent as a startup option instead of touching the JVM default zone. */
    static final String SESSION_OPTIONS = "-c TimeZone=UTC";

    private final TollgateConfig config;

    public JdbcConnectionProvider(TollgateConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(config.getJdbcUrl(), connectionProperties());
    }

    Properties connectionProperties() {
        Properties props = new Properties();
        if (config.getDbUser() != null) props.setProperty("user", config.getDbUser());
        if (config.getDbPassword() != null) props.setProperty("password", config.getDbPassword());
        props.setProperty("options", SESSION_OPTIONS);
        return props;
    }

    @Override
    public String toString() {
        return "JdbcConnectionProvider{" + config.getDbHost() + ":" + config.getDbPort() + "/" + config.getDbName() + "}";
    }
}
