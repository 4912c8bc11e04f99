package com.tollgate.executionlog.store;

import com.tollgate.executionlog.LogEvent;
import com.tollgate.jdbc.SqlValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Single responsibility: write one batch of log events to execution_logs and execution_details in one transaction.
 */
public final class ExecutionLogWriter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLogWriter.class);

    static final String TABLE_LOGS = "execution_logs";
    static final String TABLE_DETAILS = "execution_details";

    static final String SQL_INSERT_LOG = "INSERT INTO " + TABLE_LOGS +
            " (id, function_name, app_name, linked_account_owner_id, app_configuration_id, api_key_name, status," +
            " execution_time, created_at, project_id) VALUES (?,?,?,?,?,?,?,?,?,?) ON CONFLICT (id) DO NOTHING";
    static final String SQL_INSERT_DETAIL = "INSERT INTO " + TABLE_DETAILS +
            " (id, request, response) VALUES (?,?,?) ON CONFLICT (id) DO NOTHING";

    /**
     * Inserts the batch, committing once. Ids already present are skipped, so re-writing a batch never duplicates rows.
     * On failure the transaction is rolled back and the exception rethrown.
     *
     * @return number of execution_logs rows inserted (as far as the driver reports it)
     */
    public int write(Connection c, List<LogEvent> batch) throws SQLException {
        if (batch.isEmpty()) return 0;
        boolean autoCommit = c.getAutoCommit();
        c.setAutoCommit(false);
        try {
            int inserted = insertLogs(c, batch);
            int details = insertDetails(c, batch);
            c.commit();
            log.debug("Execution logs written | {} | batch={} inserted={} details={}", TABLE_LOGS, batch.size(), inserted, details);
            return inserted;
        } catch (SQLException | RuntimeException e) {
            try {
                c.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        } finally {
            c.setAutoCommit(autoCommit);
        }
    }

    private int insertLogs(Connection c, List<LogEvent> batch) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SQL_INSERT_LOG)) {
            for (LogEvent e : batch) {
                ps.setObject(1, e.getId());
                ps.setString(2, SqlValues.toName(e.getFunctionName(), SqlValues.NAME_MAX_LEN));
                ps.setString(3, SqlValues.toName(e.getAppName(), SqlValues.NAME_MAX_LEN));
                ps.setString(4, SqlValues.toName(e.getLinkedAccountOwnerId(), SqlValues.NAME_MAX_LEN));
                ps.setObject(5, e.getAppConfigurationId());
                ps.setString(6, SqlValues.toName(e.getApiKeyName(), SqlValues.NAME_MAX_LEN));
                ps.setString(7, e.getStatus().name());
                ps.setLong(8, e.getExecutionTimeMs());
                ps.setObject(9, SqlValues.toOffsetDateTime(e.getCreatedAt()));
                ps.setObject(10, e.getProjectId());
                ps.addBatch();
            }
            return countInserted(ps.executeBatch());
        }
    }

    private int insertDetails(Connection c, List<LogEvent> batch) throws SQLException {
        int rows = 0;
        try (PreparedStatement ps = c.prepareStatement(SQL_INSERT_DETAIL)) {
            for (LogEvent e : batch) {
                if (!e.hasDetail()) continue;
                ps.setObject(1, e.getId());
                ps.setObject(2, SqlValues.toJsonb(e.getRequest() != null ? e.getRequest().toString() : null));
                ps.setObject(3, SqlValues.toJsonb(e.getResponse() != null ? e.getResponse().toString() : null));
                ps.addBatch();
                rows++;
            }
            if (rows == 0) return 0;
            return countInserted(ps.executeBatch());
        }
    }

    private static int countInserted(int[] results) {
        int n = 0;
        for (int r : results) {
            if (r > 0 || r == Statement.SUCCESS_NO_INFO) n++;
        }
        return n;
    }
}
