package com.tollgate.executionlog.store;

import com.tollgate.executionlog.LogEvent;
import com.tollgate.jdbc.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/** {@link ExecutionLogStore} that opens one connection per batch. */
public final class JdbcExecutionLogStore implements ExecutionLogStore {

    private final ConnectionProvider connectionProvider;
    private final ExecutionLogWriter writer;

    public JdbcExecutionLogStore(ConnectionProvider connectionProvider) {
        this(connectionProvider, new ExecutionLogWriter());
    }

    public JdbcExecutionLogStore(ConnectionProvider connectionProvider, ExecutionLogWriter writer) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @Override
    public void saveBatch(List<LogEvent> batch) throws SQLException {
        if (batch.isEmpty()) return;
        try (Connection c = connectionProvider.getConnection()) {
            writer.write(c, batch);
        }
    }
}
