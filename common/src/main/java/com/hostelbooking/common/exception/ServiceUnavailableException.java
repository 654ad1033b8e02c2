package com.hostelbooking.common.exception;

/**
 * A required store (ledger lock, idempotency table) could not be reached.
 * The caller may retry the same request later. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
