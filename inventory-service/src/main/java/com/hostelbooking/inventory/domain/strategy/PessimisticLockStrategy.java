package com.hostelbooking.inventory.domain.strategy;

import com.hostelbooking.common.exception.ResourceNotFoundException;
import com.hostelbooking.inventory.domain.repository.RoomRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.function.Supplier;

/**
 * Row lock on the room (SELECT FOR UPDATE) taken at the start of the transaction.
 * Concurrent writers for the same room queue in the database until commit.
 */
@Slf4j
@Component("pessimistic")
public class PessimisticLockStrategy implements LedgerLockStrategy {

    private final RoomRepository roomRepository;
    private final TransactionOperations transactionOperations;

    public PessimisticLockStrategy(RoomRepository roomRepository, TransactionOperations transactionOperations) {
        this.roomRepository = roomRepository;
        this.transactionOperations = transactionOperations;
    }

    @Override
    public <T> T executeLocked(String roomId, Supplier<T> criticalSection) {
        return transactionOperations.execute(status -> {
            roomRepository.findByIdWithLock(roomId)
                    .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
            log.debug("Acquired row lock for room {}", roomId);
            return criticalSection.get();
        });
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
