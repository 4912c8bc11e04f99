package com.tollgate.executionlog;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one function execution. Request and response payloads are optional and,
 * when either is present, are persisted as a separate detail row keyed by the same id. A JSON {@code null}
 * payload counts as absent.
 */
public final class LogEvent {

    private final UUID id;
    private final String functionName;
    private final String appName;
    private final UUID projectId;
    private final ExecutionStatus status;
    private final long executionTimeMs;
    private final Instant createdAt;
    private final String linkedAccountOwnerId;
    private final UUID appConfigurationId;
    private final String apiKeyName;
    private final JsonNode request;
    private final JsonNode response;

    private LogEvent(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID();
        this.functionName = requireText(b.functionName, "functionName");
        this.appName = requireText(b.appName, "appName");
        this.projectId = Objects.requireNonNull(b.projectId, "projectId");
        this.status = Objects.requireNonNull(b.status, "status");
        if (b.executionTimeMs < 0) {
            throw new IllegalArgumentException("executionTimeMs must be >= 0, got " + b.executionTimeMs);
        }
        this.executionTimeMs = b.executionTimeMs;
        this.createdAt = b.createdAt != null ? b.createdAt : Instant.now();
        this.linkedAccountOwnerId = b.linkedAccountOwnerId;
        this.appConfigurationId = b.appConfigurationId;
        this.apiKeyName = b.apiKeyName;
        this.request = b.request;
        this.response = b.response;
    }

    public static Builder builder() {
        return new Builder();
    }

    public UUID getId() {
        return id;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getAppName() {
        return appName;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    /** Wall time of the invocation in milliseconds. */
    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getLinkedAccountOwnerId() {
        return linkedAccountOwnerId;
    }

    public UUID getAppConfigurationId() {
        return appConfigurationId;
    }

    public String getApiKeyName() {
        return apiKeyName;
    }

    public JsonNode getRequest() {
        return request;
    }

    public JsonNode getResponse() {
        return response;
    }

    /** True when a detail row must accompany the log row. */
    public boolean hasDetail() {
        return request != null || response != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogEvent)) return false;
        LogEvent other = (LogEvent) o;
        return executionTimeMs == other.executionTimeMs
                && id.equals(other.id)
                && functionName.equals(other.functionName)
                && appName.equals(other.appName)
                && projectId.equals(other.projectId)
                && status == other.status
                && createdAt.equals(other.createdAt)
                && Objects.equals(linkedAccountOwnerId, other.linkedAccountOwnerId)
                && Objects.equals(appConfigurationId, other.appConfigurationId)
                && Objects.equals(apiKeyName, other.apiKeyName)
                && Objects.equals(request, other.request)
                && Objects.equals(response, other.response);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "LogEvent{id=" + id + ", function=" + functionName + ", app=" + appName + ", project=" + projectId
                + ", status=" + status + ", executionTimeMs=" + executionTimeMs + ", createdAt=" + createdAt + "}";
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    public static final class Builder {
        private UUID id;
        private String functionName;
        private String appName;
        private UUID projectId;
        private ExecutionStatus status;
        private long executionTimeMs;
        private Instant createdAt;
        private String linkedAccountOwnerId;
        private UUID appConfigurationId;
        private String apiKeyName;
        private JsonNode request;
        private JsonNode response;

        private Builder() {
        }

        /** Defaults to a random UUID. */
        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder appName(String appName) {
            this.appName = appName;
            return this;
        }

        public Builder projectId(UUID projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder executionTimeMs(long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        /** Defaults to the build time. */
        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder linkedAccountOwnerId(String linkedAccountOwnerId) {
            this.linkedAccountOwnerId = linkedAccountOwnerId;
            return this;
        }

        public Builder appConfigurationId(UUID appConfigurationId) {
            this.appConfigurationId = appConfigurationId;
            return this;
        }

        public Builder apiKeyName(String apiKeyName) {
            this.apiKeyName = apiKeyName;
            return this;
        }

        public Builder request(JsonNode request) {
            this.request = payloadOrNull(request);
            return this;
        }

        public Builder response(JsonNode response) {
            this.response = payloadOrNull(response);
            return this;
        }

        public LogEvent build() {
            return new LogEvent(this);
        }

        private static JsonNode payloadOrNull(JsonNode payload) {
            return payload == null || payload.isNull() || payload.isMissingNode() ? null : payload;
        }
    }
}
