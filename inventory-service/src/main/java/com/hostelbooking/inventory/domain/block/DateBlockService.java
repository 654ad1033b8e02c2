package com.hostelbooking.inventory.domain.block;

import com.hostelbooking.common.exception.ResourceNotFoundException;
import com.hostelbooking.inventory.domain.availability.AvailabilityCacheEvictor;
import com.hostelbooking.inventory.domain.availability.AvailabilityCalculator;
import com.hostelbooking.inventory.domain.exception.HoldConflictException;
import com.hostelbooking.inventory.domain.exception.InvalidRangeException;
import com.hostelbooking.inventory.domain.ledger.InventoryLedger;
import com.hostelbooking.inventory.domain.ledger.LedgerCancellationService;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerOrigin;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import com.hostelbooking.inventory.domain.model.Room;
import com.hostelbooking.inventory.domain.model.StayInterval;
import com.hostelbooking.inventory.domain.room.RoomCatalog;
import com.hostelbooking.inventory.domain.strategy.RoomLockManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Staff blocks (maintenance, owner use). A block is a direct CONFIRMED entry with a reason, so it
 * takes part in availability, export and conflict resolution like any booking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DateBlockService {

    private static final String DEFAULT_REASON = "Blocked";

    private final InventoryLedger ledger;
    private final RoomCatalog roomCatalog;
    private final AvailabilityCalculator availabilityCalculator;
    private final RoomLockManager lockManager;
    private final AvailabilityCacheEvictor cacheEvictor;
    private final LedgerCancellationService cancellationService;
    private final Clock clock;

    /**
     * @param bedIndices beds to block; null or empty blocks the whole room
     */
    public LedgerEntry blockDates(String roomId, LocalDate checkIn, LocalDate checkOut,
                                  List<Integer> bedIndices, String reason) {
        Room room = roomCatalog.get(roomId);
        StayInterval interval = availabilityCalculator.validate(checkIn, checkOut);
        Set<Integer> beds = resolveBeds(room, bedIndices);
        String blockReason = reason == null || reason.isBlank() ? DEFAULT_REASON : reason.trim();

        LedgerEntry block = lockManager.executeLocked(roomId, () -> {
            LocalDateTime now = LocalDateTime.now(clock);
            Set<Integer> occupied = availabilityCalculator.occupiedBeds(
                    ledger.findLiveOverlapping(roomId, interval), now);
            List<Integer> taken = beds.stream().filter(occupied::contains).toList();
            if (!taken.isEmpty()) {
                throw new HoldConflictException(roomId, taken);
            }
            return ledger.save(LedgerEntry.builder()
                    .roomId(roomId)
                    .beds(beds)
                    .checkIn(interval.checkIn())
                    .checkOut(interval.checkOut())
                    .origin(LedgerOrigin.DIRECT)
                    .status(LedgerStatus.CONFIRMED)
                    .blockReason(blockReason)
                    .guestLabel(blockReason)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        });
        cacheEvictor.evictAll();
        log.info("Blocked room {} beds {} for {}: {}", roomId, block.sortedBeds(), interval, blockReason);
        return block;
    }

    public LedgerEntry unblock(Long blockId) {
        LedgerEntry entry = cancellationService.findEntry(blockId);
        if (!entry.isBlock() || entry.getOrigin() != LedgerOrigin.DIRECT) {
            throw new ResourceNotFoundException("Block", blockId);
        }
        return cancellationService.cancelEntry(blockId);
    }

    private Set<Integer> resolveBeds(Room room, List<Integer> bedIndices) {
        if (bedIndices == null || bedIndices.isEmpty()) {
            return IntStream.rangeClosed(1, room.getCapacity()).boxed()
                    .collect(Collectors.toCollection(TreeSet::new));
        }
        Set<Integer> beds = new TreeSet<>();
        for (Integer bed : bedIndices) {
            if (bed == null || !room.hasBed(bed)) {
                throw new InvalidRangeException(String.format(
                        "Bed %s does not exist in room %s (1..%d)", bed, room.getId(), room.getCapacity()));
            }
            beds.add(bed);
        }
        return beds;
    }
}
