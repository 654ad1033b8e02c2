package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.BusinessException;

public class InvalidRangeException extends BusinessException {
    public InvalidRangeException(String message) {
        super(message, "INVALID_RANGE");
    }
}
