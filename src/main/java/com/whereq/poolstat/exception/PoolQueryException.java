package com.whereq.poolstat.exception;

/**
 * Exception thrown when a source rejects a query or answers with something unusable; retrying won't help
 */
public class PoolQueryException extends RuntimeException {
    public PoolQueryException(String message) {
        super(message);
    }

    public PoolQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
