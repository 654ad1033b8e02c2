package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.BusinessException;

import java.time.LocalDateTime;

public class HoldExpiredException extends BusinessException {
    public HoldExpiredException(Long holdId, LocalDateTime expiresAt) {
        super(String.format("Hold %d expired at %s; start the checkout again", holdId, expiresAt), "HOLD_EXPIRED");
    }
}
