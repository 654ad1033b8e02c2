package com.hostelbooking.inventory.domain.strategy;

import java.util.function.Supplier;

/**
 * Serializes ledger mutations per room.
 * <p>
 * The critical section runs in its own transaction, and the lock is held until that transaction
 * has committed, so the next claimant of the room always reads the previous claimant's write.
 */
public interface LedgerLockStrategy {

    <T> T executeLocked(String roomId, Supplier<T> criticalSection);

    String getStrategyType();
}
