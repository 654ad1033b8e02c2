package com.hostelbooking.inventory.domain.ledger;

import com.hostelbooking.common.exception.ResourceNotFoundException;
import com.hostelbooking.inventory.domain.availability.AvailabilityCacheEvictor;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import com.hostelbooking.inventory.domain.strategy.RoomLockManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Cancels confirmed entries on behalf of refunds, staff and unblocking. The entry stays in the
 * ledger as CANCELLED and its beds become free.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerCancellationService {

    private final InventoryLedger ledger;
    private final RoomLockManager lockManager;
    private final AvailabilityCacheEvictor cacheEvictor;
    private final Clock clock;

    public LedgerEntry cancelEntry(Long entryId) {
        LedgerEntry current = findEntry(entryId);
        LedgerEntry cancelled = lockManager.executeLocked(current.getRoomId(), () -> {
            LedgerEntry entry = findEntry(entryId);
            entry.transitionTo(LedgerStatus.CANCELLED, LocalDateTime.now(clock));
            return ledger.save(entry);
        });
        cacheEvictor.evictAll();
        log.info("Cancelled ledger entry {} on room {} beds {} for {}",
                entryId, cancelled.getRoomId(), cancelled.sortedBeds(), cancelled.interval());
        return cancelled;
    }

    public LedgerEntry findEntry(Long entryId) {
        return ledger.findById(entryId)
                .orElseThrow(() -> new ResourceNotFoundException("Ledger entry", entryId));
    }
}
