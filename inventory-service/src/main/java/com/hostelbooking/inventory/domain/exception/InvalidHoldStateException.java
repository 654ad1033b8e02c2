package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.BusinessException;
import com.hostelbooking.inventory.domain.model.LedgerStatus;

public class InvalidHoldStateException extends BusinessException {
    public InvalidHoldStateException(Long entryId, LedgerStatus current, LedgerStatus target) {
        super(String.format("Ledger entry %d cannot move from %s to %s", entryId, current, target),
                "INVALID_HOLD_STATE");
    }
}
