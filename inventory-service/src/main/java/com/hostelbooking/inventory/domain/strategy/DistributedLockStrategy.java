package com.hostelbooking.inventory.domain.strategy;

import com.hostelbooking.common.util.Constants;
import com.hostelbooking.inventory.domain.exception.LedgerLockException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Per-room Redis lock (Redisson) shared by every service instance.
 * <p>
 * Lock key: {@code lock:room:{roomId}}. The whole room is locked rather than (room, date) so that
 * two overlapping but different stays cannot interleave.
 */
@Slf4j
@Component("distributed")
public class DistributedLockStrategy implements LedgerLockStrategy {

    private final RedissonClient redissonClient;
    private final TransactionOperations transactionOperations;

    @Value("${inventory.ledger.lock-wait-seconds:5}")
    private long waitSeconds = 5;

    @Value("${inventory.ledger.lock-lease-seconds:30}")
    private long leaseSeconds = 30;

    public DistributedLockStrategy(RedissonClient redissonClient, TransactionOperations transactionOperations) {
        this.redissonClient = redissonClient;
        this.transactionOperations = transactionOperations;
    }

    @Override
    public <T> T executeLocked(String roomId, Supplier<T> criticalSection) {
        String lockKey = Constants.LOCK_PREFIX + roomId;
        RLock lock = redissonClient.getLock(lockKey);
        try {
            boolean acquired = lock.tryLock(waitSeconds, leaseSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new LedgerLockException(roomId);
            }
            log.debug("Acquired distributed lock: {}", lockKey);
            return transactionOperations.execute(status -> criticalSection.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerLockException(roomId, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }
}
