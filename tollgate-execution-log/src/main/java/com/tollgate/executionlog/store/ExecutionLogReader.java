package com.tollgate.executionlog.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.executionlog.ExecutionStatus;
import com.tollgate.jdbc.ConnectionProvider;
import com.tollgate.jdbc.SqlValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side of execution logs: filtered listing, counts, single lookups and aggregate statistics.
 */
public final class ExecutionLogReader {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLogReader.class);

    static final String COLUMNS = "id, function_name, app_name, project_id, status, execution_time, created_at, " +
            "linked_account_owner_id, app_configuration_id, api_key_name";
    static final String SQL_FIND_BY_ID = "SELECT " + COLUMNS + " FROM " + ExecutionLogWriter.TABLE_LOGS +
            " WHERE id = ? AND project_id = ?";
    static final String SQL_FIND_DETAIL = "SELECT id, request, response FROM " + ExecutionLogWriter.TABLE_DETAILS + " WHERE id = ?";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ConnectionProvider connectionProvider;

    public ExecutionLogReader(ConnectionProvider connectionProvider) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    }

    /** Matching logs, newest first. */
    public List<ExecutionLogRecord> list(ExecutionLogQuery query) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM " + ExecutionLogWriter.TABLE_LOGS + " " + query.whereClause() +
                " ORDER BY created_at DESC LIMIT ? OFFSET ?";
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int next = bind(ps, query.parameters());
            ps.setInt(next, query.getLimit());
            ps.setInt(next + 1, query.getOffset());
            List<ExecutionLogRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(toRecord(rs));
                }
            }
            log.debug("Execution logs listed | project={} rows={} limit={} offset={}", query.getProjectId(), out.size(),
                    query.getLimit(), query.getOffset());
            return out;
        }
    }

    /** Number of matching logs; limit and offset are ignored. */
    public long count(ExecutionLogQuery query) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + ExecutionLogWriter.TABLE_LOGS + " " + query.whereClause();
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, query.parameters());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    /** The log with this id, only if it belongs to the project. */
    public Optional<ExecutionLogRecord> findById(UUID projectId, UUID logId) throws SQLException {
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(SQL_FIND_BY_ID)) {
            ps.setObject(1, logId);
            ps.setObject(2, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toRecord(rs)) : Optional.empty();
            }
        }
    }

    public Optional<ExecutionDetail> findDetail(UUID logId) throws SQLException {
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(SQL_FIND_DETAIL)) {
            ps.setObject(1, logId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new ExecutionDetail(SqlValues.toUuid(rs.getObject(1)),
                        parseJson(rs.getString(2)), parseJson(rs.getString(3))));
            }
        }
    }

    /** Aggregates over matching logs; limit and offset are ignored. */
    public ExecutionLogStatistics statistics(ExecutionLogQuery query) throws SQLException {
        String sql = "SELECT COUNT(*), " +
                "COALESCE(SUM(CASE WHEN status = '" + ExecutionStatus.SUCCESS.name() + "' THEN 1 ELSE 0 END), 0), " +
                "COALESCE(SUM(CASE WHEN status = '" + ExecutionStatus.FAILED.name() + "' THEN 1 ELSE 0 END), 0), " +
                "COALESCE(AVG(CAST(execution_time AS NUMERIC)), 0), " +
                "COALESCE(MIN(execution_time), 0), COALESCE(MAX(execution_time), 0) " +
                "FROM " + ExecutionLogWriter.TABLE_LOGS + " " + query.whereClause();
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, query.parameters());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next() || rs.getLong(1) == 0L) {
                    return ExecutionLogStatistics.empty();
                }
                return new ExecutionLogStatistics(rs.getLong(1), rs.getLong(2), rs.getLong(3),
                        rs.getDouble(4), rs.getLong(5), rs.getLong(6));
            }
        }
    }

    private static int bind(PreparedStatement ps, List<Object> params) throws SQLException {
        int i = 1;
        for (Object p : params) {
            ps.setObject(i++, p);
        }
        return i;
    }

    private static ExecutionLogRecord toRecord(ResultSet rs) throws SQLException {
        return new ExecutionLogRecord(
                SqlValues.toUuid(rs.getObject(1)),
                rs.getString(2),
                rs.getString(3),
                SqlValues.toUuid(rs.getObject(4)),
                ExecutionStatus.valueOf(rs.getString(5)),
                rs.getLong(6),
                SqlValues.toInstant(rs.getObject(7, OffsetDateTime.class)),
                rs.getString(8),
                SqlValues.toUuid(rs.getObject(9)),
                rs.getString(10));
    }

    private static JsonNode parseJson(String json) throws SQLException {
        if (json == null) return null;
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SQLException("Stored payload is not valid JSON", e);
        }
    }
}
