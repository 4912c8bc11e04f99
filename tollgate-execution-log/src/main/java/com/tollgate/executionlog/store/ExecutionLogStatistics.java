package com.tollgate.executionlog.store;

/** Aggregates over the logs matching a query; all zero when nothing matches. */
public record ExecutionLogStatistics(
        long totalCount,
        long successCount,
        long failureCount,
        double averageExecutionTimeMs,
        long minExecutionTimeMs,
        long maxExecutionTimeMs
) {

    public static ExecutionLogStatistics empty() {
        return new ExecutionLogStatistics(0, 0, 0, 0.0, 0, 0);
    }
}
