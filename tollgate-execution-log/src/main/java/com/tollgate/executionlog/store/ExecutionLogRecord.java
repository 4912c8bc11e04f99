package com.tollgate.executionlog.store;

import com.tollgate.executionlog.ExecutionStatus;

import java.time.Instant;
import java.util.UUID;

/** One execution_logs row, without its payloads. */
public record ExecutionLogRecord(
        UUID id,
        String functionName,
        String appName,
        UUID projectId,
        ExecutionStatus status,
        long executionTimeMs,
        Instant createdAt,
        String linkedAccountOwnerId,
        UUID appConfigurationId,
        String apiKeyName
) {
}
