package com.hostelbooking.inventory.domain.hold;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hostelbooking.inventory.domain.availability.AvailabilityCacheEvictor;
import com.hostelbooking.inventory.domain.availability.AvailabilityCalculator;
import com.hostelbooking.inventory.domain.availability.AvailabilityProperties;
import com.hostelbooking.inventory.domain.availability.SwingRoomPolicy;
import com.hostelbooking.inventory.domain.exception.HoldConflictException;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import com.hostelbooking.inventory.domain.repository.HoldIdempotencyRepository;
import com.hostelbooking.inventory.domain.room.RoomCatalog;
import com.hostelbooking.inventory.domain.strategy.LocalLockStrategy;
import com.hostelbooking.inventory.domain.strategy.RoomLockManager;
import com.hostelbooking.inventory.events.LedgerEventPublisher;
import com.hostelbooking.inventory.pricing.PricingEngine;
import com.hostelbooking.inventory.pricing.PricingProperties;
import com.hostelbooking.inventory.pricing.SeasonCalendar;
import com.hostelbooking.inventory.support.InMemoryInventoryLedger;
import com.hostelbooking.inventory.support.MutableClock;
import com.hostelbooking.inventory.support.TestRooms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.hostelbooking.inventory.support.TestRooms.MIXTO_7;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Many checkouts racing for the same beds through the local lock strategy.
 */
class HoldConcurrencyTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 5, 4, 10, 0);
    private static final LocalDate CHECK_IN = LocalDate.of(2026, 5, 20);

    private InMemoryInventoryLedger ledger;
    private HoldService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at(NOW);
        ledger = new InMemoryInventoryLedger();
        RoomCatalog catalog = TestRooms.hostel();
        SwingRoomPolicy swingRoomPolicy = new SwingRoomPolicy();
        AvailabilityProperties availabilityProperties = AvailabilityProperties.defaults();
        PricingProperties pricingProperties = new PricingProperties(List.of(), 7);
        service = new HoldService(
                ledger,
                catalog,
                new AvailabilityCalculator(ledger, catalog, swingRoomPolicy, availabilityProperties, clock),
                availabilityProperties,
                swingRoomPolicy,
                new PricingEngine(new SeasonCalendar(pricingProperties), pricingProperties),
                new RoomLockManager(Map.of("local", new LocalLockStrategy(TransactionOperations.withoutTransaction()))),
                new AvailabilityCacheEvictor(),
                mock(HoldIdempotencyRepository.class),
                mock(LedgerEventPublisher.class),
                new ObjectMapper().findAndRegisterModules(),
                clock);
    }

    @Test
    @DisplayName("16 concurrent holds on the same bed: exactly one wins, the rest get HOLD_CONFLICT")
    void sameBed_exactlyOneWinner() throws Exception {
        List<Callable<HoldReceipt>> attempts = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            attempts.add(() -> service.createHold(new CreateHoldCommand(MIXTO_7.getId(), List.of(3),
                    CHECK_IN, CHECK_IN.plusDays(2), null, null, "Guest", null)));
        }

        List<Outcome> outcomes = race(attempts);

        assertThat(outcomes).filteredOn(Outcome::succeeded).hasSize(1);
        assertThat(outcomes).filteredOn(outcome -> !outcome.succeeded())
                .allSatisfy(outcome -> assertThat(outcome.error()).isInstanceOf(HoldConflictException.class));
        assertThat(ledger.withStatus(LedgerStatus.HOLD)).hasSize(1);
    }

    @Test
    @DisplayName("Overlapping stays on shifting bed pairs never double-book a bed-night")
    void overlappingStays_noDoubleBooking() throws Exception {
        List<Callable<HoldReceipt>> attempts = new ArrayList<>();
        for (int i = 0; i < 24; i++) {
            int firstBed = 1 + i % 5;
            LocalDate checkIn = CHECK_IN.plusDays(i % 3);
            attempts.add(() -> service.createHold(new CreateHoldCommand(MIXTO_7.getId(),
                    List.of(firstBed, firstBed + 1), checkIn, checkIn.plusDays(2), null, null, "Guest", null)));
        }

        List<Outcome> outcomes = race(attempts);

        assertThat(outcomes).filteredOn(Outcome::succeeded).isNotEmpty();
        List<LedgerEntry> holds = ledger.withStatus(LedgerStatus.HOLD);
        for (int a = 0; a < holds.size(); a++) {
            for (int b = a + 1; b < holds.size(); b++) {
                LedgerEntry first = holds.get(a);
                LedgerEntry second = holds.get(b);
                if (first.interval().overlaps(second.interval())) {
                    assertThat(first.getBeds()).doesNotContainAnyElementsOf(second.getBeds());
                }
            }
        }
    }

    private List<Outcome> race(List<Callable<HoldReceipt>> attempts) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(attempts.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (Callable<HoldReceipt> attempt : attempts) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        return new Outcome(attempt.call(), null);
                    } catch (RuntimeException e) {
                        return new Outcome(null, e);
                    }
                }));
            }
            start.countDown();
            List<Outcome> outcomes = new ArrayList<>();
            for (Future<Outcome> future : futures) {
                outcomes.add(future.get(30, TimeUnit.SECONDS));
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private record Outcome(HoldReceipt receipt, RuntimeException error) {
        boolean succeeded() {
            return error == null;
        }
    }
}
