package com.tollgate.executionlog;

/** Outcome of one function invocation. */
public enum ExecutionStatus {
    SUCCESS,
    FAILED
}
