package com.hostelbooking.inventory.domain.strategy;

import com.hostelbooking.inventory.domain.exception.LedgerLockException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair {@link ReentrantLock} per room, in process memory.
 * Correct only when a single service instance writes to the ledger.
 */
@Slf4j
@Component("local")
public class LocalLockStrategy implements LedgerLockStrategy {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final TransactionOperations transactionOperations;

    @Value("${inventory.ledger.lock-wait-seconds:5}")
    private long waitSeconds = 5;

    public LocalLockStrategy(TransactionOperations transactionOperations) {
        this.transactionOperations = transactionOperations;
    }

    @Override
    public <T> T executeLocked(String roomId, Supplier<T> criticalSection) {
        ReentrantLock lock = locks.computeIfAbsent(roomId, id -> new ReentrantLock(true));
        try {
            if (!lock.tryLock(waitSeconds, TimeUnit.SECONDS)) {
                throw new LedgerLockException(roomId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerLockException(roomId, e);
        }
        try {
            log.debug("Acquired local lock for room {}", roomId);
            return transactionOperations.execute(status -> criticalSection.get());
        } finally {
            lock.unlock();
            log.debug("Released local lock for room {}", roomId);
        }
    }

    @Override
    public String getStrategyType() {
        return "LOCAL_LOCK";
    }
}
