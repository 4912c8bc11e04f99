package com.tollgate.quota;

/**
 * Database failure while reading or charging quota. Always propagated to the caller.
 */
public class QuotaStoreException extends RuntimeException {

    public QuotaStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
