package com.tollgate.executionlog.store;

import com.tollgate.jdbc.SqlValues;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Filter and page over one project's execution logs. Unset filters do not constrain the result;
 * the time range is inclusive on both ends.
 */
public final class ExecutionLogQuery {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    private final UUID projectId;
    private final Instant startTime;
    private final Instant endTime;
    private final String appName;
    private final String functionName;
    private final UUID appConfigurationId;
    private final String linkedAccountOwnerId;
    private final String apiKeyName;
    private final int limit;
    private final int offset;

    private ExecutionLogQuery(Builder b) {
        this.projectId = Objects.requireNonNull(b.projectId, "projectId");
        this.startTime = b.startTime;
        this.endTime = b.endTime;
        this.appName = blankToNull(b.appName);
        this.functionName = blankToNull(b.functionName);
        this.appConfigurationId = b.appConfigurationId;
        this.linkedAccountOwnerId = blankToNull(b.linkedAccountOwnerId);
        this.apiKeyName = blankToNull(b.apiKeyName);
        if (b.limit < 1 || b.limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", got " + b.limit);
        }
        if (b.offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got " + b.offset);
        }
        this.limit = b.limit;
        this.offset = b.offset;
    }

    public static Builder forProject(UUID projectId) {
        return new Builder().projectId(projectId);
    }

    public UUID getProjectId() {
        return projectId;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    /** {@code WHERE ...} clause over execution_logs, with one {@code ?} per entry of {@link #parameters()}. */
    String whereClause() {
        StringBuilder sb = new StringBuilder("WHERE project_id = ?");
        if (startTime != null) sb.append(" AND created_at >= ?");
        if (endTime != null) sb.append(" AND created_at <= ?");
        if (appName != null) sb.append(" AND app_name = ?");
        if (functionName != null) sb.append(" AND function_name = ?");
        if (appConfigurationId != null) sb.append(" AND app_configuration_id = ?");
        if (linkedAccountOwnerId != null) sb.append(" AND linked_account_owner_id = ?");
        if (apiKeyName != null) sb.append(" AND api_key_name = ?");
        return sb.toString();
    }

    List<Object> parameters() {
        List<Object> params = new ArrayList<>();
        params.add(projectId);
        if (startTime != null) params.add(SqlValues.toOffsetDateTime(startTime));
        if (endTime != null) params.add(SqlValues.toOffsetDateTime(endTime));
        if (appName != null) params.add(appName);
        if (functionName != null) params.add(functionName);
        if (appConfigurationId != null) params.add(appConfigurationId);
        if (linkedAccountOwnerId != null) params.add(linkedAccountOwnerId);
        if (apiKeyName != null) params.add(apiKeyName);
        return Collections.unmodifiableList(params);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    public static final class Builder {
        private UUID projectId;
        private Instant startTime;
        private Instant endTime;
        private String appName;
        private String functionName;
        private UUID appConfigurationId;
        private String linkedAccountOwnerId;
        private String apiKeyName;
        private int limit = DEFAULT_LIMIT;
        private int offset;

        private Builder() {
        }

        public Builder projectId(UUID projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder appName(String appName) {
            this.appName = appName;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder appConfigurationId(UUID appConfigurationId) {
            this.appConfigurationId = appConfigurationId;
            return this;
        }

        public Builder linkedAccountOwnerId(String linkedAccountOwnerId) {
            this.linkedAccountOwnerId = linkedAccountOwnerId;
            return this;
        }

        public Builder apiKeyName(String apiKeyName) {
            this.apiKeyName = apiKeyName;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public ExecutionLogQuery build() {
            return new ExecutionLogQuery(this);
        }
    }
}
