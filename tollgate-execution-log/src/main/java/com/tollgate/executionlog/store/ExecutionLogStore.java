package com.tollgate.executionlog.store;

import com.tollgate.executionlog.LogEvent;

import java.sql.SQLException;
import java.util.List;

/**
 * Durable destination of drained log batches. A failed batch is reported to the caller, which decides
 * whether to retry or discard it.
 */
@FunctionalInterface
public interface ExecutionLogStore {

    void saveBatch(List<LogEvent> batch) throws SQLException;
}
