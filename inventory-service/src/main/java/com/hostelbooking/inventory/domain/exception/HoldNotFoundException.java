package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.ResourceNotFoundException;

public class HoldNotFoundException extends ResourceNotFoundException {
    public HoldNotFoundException(Long holdId) {
        super("Ledger entry", holdId, "HOLD_NOT_FOUND");
    }
}
