package com.whereq.poolstat.exception;

/**
 * Exception thrown when a source can't be reached or drops the connection; the query may succeed if retried
 */
public class TransientQueryException extends RuntimeException {
    public TransientQueryException(String message) {
        super(message);
    }

    public TransientQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
