package com.hostelbooking.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Base type for recoverable domain failures.
 * The error code is stable and meant for clients; the message is for humans.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message) {
        super(message);
        this.errorCode = "BUSINESS_ERROR";
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Structured data a client needs to recover (empty by default).
     */
    public Map<String, Object> getDetails() {
        return Collections.emptyMap();
    }
}
