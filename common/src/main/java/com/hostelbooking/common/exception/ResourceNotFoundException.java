package com.hostelbooking.common.exception;

/**
 * Thrown when a room, ledger entry, hold or feed does not exist.
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String message) {
        super(message, "RESOURCE_NOT_FOUND");
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        this(resourceType, identifier, "RESOURCE_NOT_FOUND");
    }

    protected ResourceNotFoundException(String resourceType, Object identifier, String errorCode) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), errorCode);
    }
}
