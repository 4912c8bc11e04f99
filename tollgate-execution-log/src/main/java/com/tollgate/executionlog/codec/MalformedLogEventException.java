package com.tollgate.executionlog.codec;

/** A queued item could not be decoded into a log event. */
public final class MalformedLogEventException extends IllegalArgumentException {

    public MalformedLogEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
