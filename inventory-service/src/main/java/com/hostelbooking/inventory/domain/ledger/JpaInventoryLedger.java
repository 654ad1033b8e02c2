package com.hostelbooking.inventory.domain.ledger;

import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerOrigin;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import com.hostelbooking.inventory.domain.model.StayInterval;
import com.hostelbooking.inventory.domain.repository.LedgerEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaInventoryLedger implements InventoryLedger {

    private final LedgerEntryRepository repository;

    @Override
    public LedgerEntry save(LedgerEntry entry) {
        return repository.save(entry);
    }

    @Override
    public Optional<LedgerEntry> findById(Long id) {
        return repository.findById(id);
    }

    @Override
    public List<LedgerEntry> findLiveOverlapping(String roomId, StayInterval interval) {
        return repository.findOverlapping(roomId, LedgerStatus.ACTIVE, interval.checkIn(), interval.checkOut());
    }

    @Override
    public List<LedgerEntry> findLiveOverlapping(StayInterval interval) {
        return repository.findOverlappingAllRooms(LedgerStatus.ACTIVE, interval.checkIn(), interval.checkOut());
    }

    @Override
    public Optional<LedgerEntry> findImported(String roomId, String platform, String externalId) {
        return repository.findFirstByRoomIdAndOriginAndExternalPlatformAndExternalIdAndStatusOrderByIdDesc(
                roomId, LedgerOrigin.PLATFORM_IMPORT, platform, externalId, LedgerStatus.CONFIRMED);
    }

    @Override
    public List<LedgerEntry> findImportedByFeed(Long feedId, LocalDate from) {
        return repository.findByFeedIdAndOriginAndStatusAndCheckOutAfterOrderById(
                feedId, LedgerOrigin.PLATFORM_IMPORT, LedgerStatus.CONFIRMED, from);
    }

    @Override
    public List<LedgerEntry> findHoldsExpiredAt(LocalDateTime now) {
        return repository.findByStatusAndExpiresAtLessThanEqualOrderByExpiresAt(LedgerStatus.HOLD, now);
    }

    @Override
    public List<LedgerEntry> findConfirmedFrom(String roomId, LocalDate from) {
        return repository.findByRoomIdAndStatusAndCheckOutAfterOrderByCheckIn(roomId, LedgerStatus.CONFIRMED, from);
    }
}
