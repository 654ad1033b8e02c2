package com.hostelbooking.inventory.domain.hold;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hostelbooking.common.exception.ServiceUnavailableException;
import com.hostelbooking.common.util.Constants;
import com.hostelbooking.inventory.domain.availability.AvailabilityCacheEvictor;
import com.hostelbooking.inventory.domain.availability.AvailabilityCalculator;
import com.hostelbooking.inventory.domain.availability.AvailabilityProperties;
import com.hostelbooking.inventory.domain.availability.SwingRoomPolicy;
import com.hostelbooking.inventory.domain.exception.HoldConflictException;
import com.hostelbooking.inventory.domain.exception.HoldExpiredException;
import com.hostelbooking.inventory.domain.exception.HoldNotFoundException;
import com.hostelbooking.inventory.domain.exception.InsufficientAvailabilityException;
import com.hostelbooking.inventory.domain.exception.InvalidRangeException;
import com.hostelbooking.inventory.domain.ledger.InventoryLedger;
import com.hostelbooking.inventory.domain.model.HoldIdempotency;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerOrigin;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import com.hostelbooking.inventory.domain.model.PaymentStatus;
import com.hostelbooking.inventory.domain.model.PricingSnapshot;
import com.hostelbooking.inventory.domain.model.Room;
import com.hostelbooking.inventory.domain.model.StayCategory;
import com.hostelbooking.inventory.domain.model.StayInterval;
import com.hostelbooking.inventory.domain.repository.HoldIdempotencyRepository;
import com.hostelbooking.inventory.domain.room.RoomCatalog;
import com.hostelbooking.inventory.domain.strategy.RoomLockManager;
import com.hostelbooking.inventory.events.LedgerEventPublisher;
import com.hostelbooking.inventory.pricing.PriceBreakdown;
import com.hostelbooking.inventory.pricing.PricingEngine;
import com.hostelbooking.inventory.pricing.RoomBeds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Hold lifecycle: create, confirm, release and expire.
 * <pre>
 * HOLD -> CONFIRMED | RELEASED | EXPIRED
 * </pre>
 * Every transition re-reads the entry under the room lock, so a confirm racing the expiry sweep
 * sees exactly one winner. A hold whose expiry has passed cannot be confirmed or released even if
 * the sweep has not reached it yet; it is marked EXPIRED on the spot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoldService {

    private static final String IDEMPOTENCY_UNAVAILABLE_MSG =
            "Idempotency check temporarily unavailable. Retry with same key later.";
    private static final Duration REDIS_IDEMPOTENCY_TTL = Duration.ofHours(24);

    private final InventoryLedger ledger;
    private final RoomCatalog roomCatalog;
    private final AvailabilityCalculator availabilityCalculator;
    private final AvailabilityProperties availabilityProperties;
    private final SwingRoomPolicy swingRoomPolicy;
    private final PricingEngine pricingEngine;
    private final RoomLockManager lockManager;
    private final AvailabilityCacheEvictor cacheEvictor;
    private final HoldIdempotencyRepository idempotencyRepository;
    private final LedgerEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${inventory.hold.ttl-minutes:15}")
    private int holdTtlMinutes = 15;

    @Value("${inventory.hold.idempotency-redis-cache:true}")
    private boolean idempotencyRedisCacheEnabled = true;

    /**
     * Re-validates the requested beds and records a HOLD in one critical section per room.
     * Losing a race for a bed yields {@link HoldConflictException} naming the lost beds.
     * The idempotency key is checked again under the lock and its receipt is insert-only, so a
     * replayed key never produces a second hold.
     */
    public HoldReceipt createHold(CreateHoldCommand command) {
        String key = command.idempotencyKey();
        boolean idempotent = key != null && !key.isBlank();
        if (idempotent) {
            Optional<HoldReceipt> cached = getCachedReceipt(key);
            if (cached.isPresent()) {
                log.info("Returning stored hold {} for idempotency key {}", cached.get().holdId(), key);
                return cached.get();
            }
        }

        Room room = roomCatalog.get(command.roomId());
        StayInterval interval = availabilityCalculator.validate(command.checkIn(), command.checkOut());
        Set<Integer> beds = validateBeds(room, command.bedIndices());
        StayCategory category = StayCategory.orDefault(command.category());
        PriceBreakdown price = pricingEngine.quote(
                interval, List.of(new RoomBeds(room, beds.size())), command.partyBeds());

        HoldOutcome outcome;
        try {
            outcome = lockManager.executeLocked(room.getId(), () -> {
                if (idempotent) {
                    Optional<HoldReceipt> stored = findStoredReceipt(key);
                    if (stored.isPresent()) {
                        return new HoldOutcome(stored.get(), true);
                    }
                }
                return new HoldOutcome(recordHold(room, interval, beds, category, price, command), false);
            });
        } catch (DataIntegrityViolationException e) {
            if (!idempotent) {
                throw e;
            }
            HoldReceipt stored = findStoredReceipt(key).orElseThrow(() -> e);
            log.warn("Idempotency key {} stored concurrently; hold rolled back, returning hold {}",
                    key, stored.holdId());
            return stored;
        }

        HoldReceipt receipt = outcome.receipt();
        if (outcome.replayed()) {
            log.info("Returning stored hold {} for idempotency key {}", receipt.holdId(), key);
            return receipt;
        }
        cacheEvictor.evictAll();
        if (idempotent) {
            warmRedisCache(key, receipt);
        }
        log.info("Created hold {} on room {} beds {} for {} (expires {})",
                receipt.holdId(), receipt.roomId(), receipt.beds(), interval, receipt.expiresAt());
        return receipt;
    }

    private HoldReceipt recordHold(Room room, StayInterval interval, Set<Integer> beds, StayCategory category,
                                   PriceBreakdown price, CreateHoldCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<LedgerEntry> entries = ledger.findLiveOverlapping(room.getId(), interval);
        if (!swingRoomPolicy.isEligible(room, category, interval, entries, now)) {
            throw new InsufficientAvailabilityException(room.getId(), beds.size(), 0);
        }
        Set<Integer> occupied = availabilityCalculator.occupiedBeds(entries, now);
        List<Integer> lost = beds.stream().filter(occupied::contains).toList();
        if (!lost.isEmpty()) {
            throw new HoldConflictException(room.getId(), lost);
        }
        int free = room.getCapacity() - occupied.size();
        int buffer = availabilityProperties.bufferFor(room.getId());
        if (free - beds.size() < buffer) {
            throw new InsufficientAvailabilityException(room.getId(), beds.size(), Math.max(0, free - buffer));
        }

        LedgerEntry hold = ledger.save(LedgerEntry.builder()
                .roomId(room.getId())
                .beds(new HashSet<>(beds))
                .checkIn(interval.checkIn())
                .checkOut(interval.checkOut())
                .origin(LedgerOrigin.HOLD)
                .status(LedgerStatus.HOLD)
                .stayCategory(category)
                .guestLabel(command.guestLabel())
                .guestCount(beds.size())
                .expiresAt(now.plusMinutes(holdTtlMinutes))
                .pricing(PricingSnapshot.from(price))
                .createdAt(now)
                .updatedAt(now)
                .build());

        HoldReceipt created = new HoldReceipt(
                hold.getId(),
                hold.getRoomId(),
                hold.sortedBeds(),
                hold.getCheckIn(),
                hold.getCheckOut(),
                hold.getExpiresAt(),
                price.total(),
                price.depositAmount());
        String key = command.idempotencyKey();
        if (key != null && !key.isBlank()) {
            saveIdempotencyToDb(key, created, now);
        }
        return created;
    }

    /**
     * Payment succeeded: HOLD becomes CONFIRMED.
     */
    public LedgerEntry confirmHold(Long holdId) {
        return confirm(holdId, entry -> { });
    }

    /**
     * Checkout abandoned: HOLD becomes RELEASED. Releasing an already released hold is a no-op.
     */
    public LedgerEntry releaseHold(Long holdId) {
        LedgerEntry current = findHold(holdId);
        Transition transition = lockManager.executeLocked(current.getRoomId(), () -> {
            LocalDateTime now = LocalDateTime.now(clock);
            LedgerEntry entry = findHold(holdId);
            if (entry.getStatus() == LedgerStatus.RELEASED) {
                return new Transition(entry, false, false);
            }
            if (entry.getStatus() == LedgerStatus.EXPIRED) {
                return new Transition(entry, true, false);
            }
            if (expireIfDue(entry, now)) {
                return new Transition(entry, true, true);
            }
            entry.transitionTo(LedgerStatus.RELEASED, now);
            return new Transition(ledger.save(entry), false, true);
        });
        LedgerEntry entry = finish(transition);
        log.info("Released hold {} on room {} beds {}", holdId, entry.getRoomId(), entry.sortedBeds());
        return entry;
    }

    /**
     * Outcome reported by the payment collaborator. Success confirms the hold and reconciles the
     * paid amount against the frozen quote; failure releases it.
     */
    public LedgerEntry applyPaymentResult(Long holdId, boolean success, BigDecimal paidAmount) {
        if (!success) {
            log.info("Payment failed for hold {}, releasing", holdId);
            return releaseHold(holdId);
        }
        return confirm(holdId, entry -> recordPayment(entry, paidAmount));
    }

    /**
     * Marks every overdue hold EXPIRED. Each hold is re-checked under its room lock, so running
     * the sweep twice, or concurrently with itself, changes nothing the second time.
     *
     * @return number of holds this run expired
     */
    public int expireOverdueHolds() {
        LocalDateTime cutoff = LocalDateTime.now(clock);
        List<LedgerEntry> candidates = ledger.findHoldsExpiredAt(cutoff);
        if (candidates.isEmpty()) {
            return 0;
        }
        List<Long> expired = new ArrayList<>();
        for (LedgerEntry candidate : candidates) {
            try {
                boolean changed = lockManager.executeLocked(candidate.getRoomId(), () -> {
                    LedgerEntry entry = ledger.findById(candidate.getId()).orElse(null);
                    return entry != null && expireIfDue(entry, LocalDateTime.now(clock));
                });
                if (changed) {
                    expired.add(candidate.getId());
                }
            } catch (RuntimeException e) {
                log.warn("Could not expire hold {}; next sweep will retry", candidate.getId(), e);
            }
        }
        if (!expired.isEmpty()) {
            cacheEvictor.evictAll();
            log.info("Expired {} hold(s): {}", expired.size(), expired);
        }
        return expired.size();
    }

    private LedgerEntry confirm(Long holdId, Consumer<LedgerEntry> onConfirm) {
        LedgerEntry current = findHold(holdId);
        Transition transition = lockManager.executeLocked(current.getRoomId(), () -> {
            LocalDateTime now = LocalDateTime.now(clock);
            LedgerEntry entry = findHold(holdId);
            if (entry.getStatus() == LedgerStatus.EXPIRED) {
                return new Transition(entry, true, false);
            }
            if (expireIfDue(entry, now)) {
                return new Transition(entry, true, true);
            }
            entry.transitionTo(LedgerStatus.CONFIRMED, now);
            onConfirm.accept(entry);
            return new Transition(ledger.save(entry), false, true);
        });
        LedgerEntry entry = finish(transition);
        log.info("Confirmed hold {} on room {} beds {} for {}",
                holdId, entry.getRoomId(), entry.sortedBeds(), entry.interval());
        eventPublisher.publishEntryConfirmed(entry);
        return entry;
    }

    /**
     * Evicts the cache for a changed entry and raises {@link HoldExpiredException} once the
     * EXPIRED mark is committed.
     */
    private LedgerEntry finish(Transition transition) {
        if (transition.changed()) {
            cacheEvictor.evictAll();
        }
        LedgerEntry entry = transition.entry();
        if (transition.expired()) {
            log.warn("Hold {} used after expiry at {}", entry.getId(), entry.getExpiresAt());
            throw new HoldExpiredException(entry.getId(), entry.getExpiresAt());
        }
        return entry;
    }

    private boolean expireIfDue(LedgerEntry entry, LocalDateTime now) {
        if (!entry.isHoldExpiredAt(now)) {
            return false;
        }
        entry.transitionTo(LedgerStatus.EXPIRED, now);
        ledger.save(entry);
        return true;
    }

    private void recordPayment(LedgerEntry entry, BigDecimal paidAmount) {
        if (paidAmount == null || entry.getPricing() == null) {
            return;
        }
        PricingSnapshot pricing = entry.getPricing();
        PaymentStatus status;
        if (paidAmount.compareTo(pricing.getTotal()) >= 0) {
            status = PaymentStatus.PAID_IN_FULL;
        } else if (paidAmount.compareTo(pricing.getDepositAmount()) >= 0) {
            status = PaymentStatus.DEPOSIT_PAID;
        } else {
            status = PaymentStatus.UNDERPAID;
            log.warn("Hold {} paid {} below deposit {}", entry.getId(), paidAmount, pricing.getDepositAmount());
        }
        entry.setPaidAmount(paidAmount);
        entry.setPaymentStatus(status);
    }

    private LedgerEntry findHold(Long holdId) {
        return ledger.findById(holdId)
                .filter(entry -> entry.getOrigin() == LedgerOrigin.HOLD)
                .orElseThrow(() -> new HoldNotFoundException(holdId));
    }

    private Set<Integer> validateBeds(Room room, List<Integer> bedIndices) {
        if (bedIndices == null || bedIndices.isEmpty()) {
            throw new InvalidRangeException("At least one bed must be selected");
        }
        Set<Integer> beds = new LinkedHashSet<>();
        for (Integer bed : bedIndices) {
            if (bed == null || !room.hasBed(bed)) {
                throw new InvalidRangeException(String.format(
                        "Bed %s does not exist in room %s (1..%d)", bed, room.getId(), room.getCapacity()));
            }
            if (!beds.add(bed)) {
                throw new InvalidRangeException("Bed " + bed + " selected twice");
            }
        }
        return beds;
    }

    /**
     * Read: Redis first if enabled; on miss or error fall back to the DB, the source of truth.
     */
    private Optional<HoldReceipt> getCachedReceipt(String idempotencyKey) {
        if (idempotencyRedisCacheEnabled && stringRedisTemplate != null) {
            try {
                String json = stringRedisTemplate.opsForValue().get(Constants.IDEMPOTENCY_HOLD_PREFIX + idempotencyKey);
                if (json != null) {
                    log.debug("Idempotency hit from Redis for key: {}", idempotencyKey);
                    return Optional.of(objectMapper.readValue(json, HoldReceipt.class));
                }
            } catch (Exception e) {
                log.debug("Redis idempotency read missed or failed, falling back to DB: {}", e.getMessage());
            }
        }
        return findStoredReceipt(idempotencyKey);
    }

    private Optional<HoldReceipt> findStoredReceipt(String idempotencyKey) {
        try {
            return idempotencyRepository.findById(idempotencyKey)
                    .map(row -> {
                        try {
                            return objectMapper.readValue(row.getResponseJson(), HoldReceipt.class);
                        } catch (JsonProcessingException e) {
                            log.warn("Failed to deserialize stored receipt for key: {}", idempotencyKey, e);
                            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
                        }
                    });
        } catch (DataAccessException e) {
            log.warn("Idempotency store (DB) unavailable for key: {}", idempotencyKey, e);
            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
        }
    }

    /**
     * Written in the same transaction as the hold: if it fails, the hold is rolled back too.
     * Flushed at once so a duplicate key fails here rather than at commit.
     */
    private void saveIdempotencyToDb(String idempotencyKey, HoldReceipt receipt, LocalDateTime now) {
        try {
            idempotencyRepository.saveAndFlush(new HoldIdempotency(
                    idempotencyKey, objectMapper.writeValueAsString(receipt), now));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize receipt for idempotency key: {}", idempotencyKey, e);
            throw new IllegalStateException("Idempotency save failed", e);
        }
    }

    /**
     * Best-effort: failure to warm Redis does not affect the hold.
     */
    private void warmRedisCache(String idempotencyKey, HoldReceipt receipt) {
        if (!idempotencyRedisCacheEnabled || stringRedisTemplate == null) {
            return;
        }
        try {
            stringRedisTemplate.opsForValue().set(Constants.IDEMPOTENCY_HOLD_PREFIX + idempotencyKey,
                    objectMapper.writeValueAsString(receipt), REDIS_IDEMPOTENCY_TTL);
            log.debug("Warmed Redis idempotency cache for key: {}", idempotencyKey);
        } catch (Exception e) {
            log.warn("Failed to warm Redis idempotency cache for key: {} (non-fatal)", idempotencyKey, e);
        }
    }

    private record HoldOutcome(HoldReceipt receipt, boolean replayed) {
    }

    private record Transition(LedgerEntry entry, boolean expired, boolean changed) {
    }
}
