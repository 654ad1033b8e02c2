package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.ServiceUnavailableException;

/**
 * The room lock could not be acquired in time. The request may be retried.
 */
public class LedgerLockException extends ServiceUnavailableException {
    public LedgerLockException(String roomId) {
        super("Unable to acquire ledger lock for room " + roomId + ". Please try again.");
    }

    public LedgerLockException(String roomId, Throwable cause) {
        super("Interrupted while waiting for ledger lock on room " + roomId, cause);
    }
}
