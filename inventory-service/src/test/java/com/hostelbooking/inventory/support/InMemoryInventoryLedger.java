package com.hostelbooking.inventory.support;

import com.hostelbooking.inventory.domain.ledger.InventoryLedger;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerOrigin;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import com.hostelbooking.inventory.domain.model.StayInterval;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Ledger kept in a map, with the same query semantics as the JPA adapter.
 */
public class InMemoryInventoryLedger implements InventoryLedger {

    private final Map<Long, LedgerEntry> entries = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized LedgerEntry save(LedgerEntry entry) {
        if (entry.getId() == null) {
            entry.setId(sequence.incrementAndGet());
        }
        entries.put(entry.getId(), entry);
        return entry;
    }

    @Override
    public synchronized Optional<LedgerEntry> findById(Long id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public List<LedgerEntry> findLiveOverlapping(String roomId, StayInterval interval) {
        return select(entry -> entry.getRoomId().equals(roomId)
                && LedgerStatus.ACTIVE.contains(entry.getStatus())
                && entry.interval().overlaps(interval));
    }

    @Override
    public List<LedgerEntry> findLiveOverlapping(StayInterval interval) {
        return select(entry -> LedgerStatus.ACTIVE.contains(entry.getStatus())
                && entry.interval().overlaps(interval));
    }

    @Override
    public synchronized Optional<LedgerEntry> findImported(String roomId, String platform, String externalId) {
        return entries.values().stream()
                .filter(entry -> entry.getRoomId().equals(roomId))
                .filter(entry -> entry.getStatus() == LedgerStatus.CONFIRMED)
                .filter(entry -> entry.matchesExternal(platform, externalId))
                .max(Comparator.comparing(LedgerEntry::getId));
    }

    @Override
    public List<LedgerEntry> findImportedByFeed(Long feedId, LocalDate from) {
        return select(entry -> Objects.equals(entry.getFeedId(), feedId)
                && entry.getOrigin() == LedgerOrigin.PLATFORM_IMPORT
                && entry.getStatus() == LedgerStatus.CONFIRMED
                && entry.getCheckOut().isAfter(from));
    }

    @Override
    public List<LedgerEntry> findHoldsExpiredAt(LocalDateTime now) {
        return select(entry -> entry.getStatus() == LedgerStatus.HOLD
                && entry.getExpiresAt() != null
                && !entry.getExpiresAt().isAfter(now));
    }

    @Override
    public List<LedgerEntry> findConfirmedFrom(String roomId, LocalDate from) {
        List<LedgerEntry> confirmed = new ArrayList<>(select(entry -> entry.getRoomId().equals(roomId)
                && entry.getStatus() == LedgerStatus.CONFIRMED
                && entry.getCheckOut().isAfter(from)));
        confirmed.sort(Comparator.comparing(LedgerEntry::getCheckIn).thenComparing(LedgerEntry::getId));
        return confirmed;
    }

    public synchronized List<LedgerEntry> all() {
        return new ArrayList<>(entries.values());
    }

    public List<LedgerEntry> withStatus(LedgerStatus status) {
        return select(entry -> entry.getStatus() == status);
    }

    private synchronized List<LedgerEntry> select(Predicate<LedgerEntry> filter) {
        return entries.values().stream().filter(filter).toList();
    }
}
