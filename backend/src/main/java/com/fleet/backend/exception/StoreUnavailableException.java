package com.fleet.backend.exception;

/**
 * The reading store could not be reached or rejected the operation.
 * Callers may retry; a failed fetch must never be read as an empty window.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
