package com.hostelbooking.inventory.domain.ledger;

import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.StayInterval;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of ledger entries. The single source of truth for bed occupancy.
 * <p>
 * Callers that read-then-write must do so inside
 * {@link com.hostelbooking.inventory.domain.strategy.RoomLockManager#executeLocked}.
 */
public interface InventoryLedger {

    LedgerEntry save(LedgerEntry entry);

    Optional<LedgerEntry> findById(Long id);

    /**
     * HOLD and CONFIRMED entries of a room overlapping the interval. Expiry of holds is not
     * filtered here; use {@link LedgerEntry#isActiveAt}.
     */
    List<LedgerEntry> findLiveOverlapping(String roomId, StayInterval interval);

    /**
     * Same as {@link #findLiveOverlapping(String, StayInterval)} across all rooms.
     */
    List<LedgerEntry> findLiveOverlapping(StayInterval interval);

    /**
     * The CONFIRMED imported entry of a room carrying the given external booking id.
     */
    Optional<LedgerEntry> findImported(String roomId, String platform, String externalId);

    /**
     * CONFIRMED entries imported by a feed that check out after {@code from}.
     */
    List<LedgerEntry> findImportedByFeed(Long feedId, LocalDate from);

    List<LedgerEntry> findHoldsExpiredAt(LocalDateTime now);

    /**
     * CONFIRMED entries of a room that check out after {@code from}, ordered by check-in.
     */
    List<LedgerEntry> findConfirmedFrom(String roomId, LocalDate from);
}
