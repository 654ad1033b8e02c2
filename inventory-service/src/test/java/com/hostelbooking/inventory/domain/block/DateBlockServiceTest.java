package com.hostelbooking.inventory.domain.block;

import com.hostelbooking.common.exception.ResourceNotFoundException;
import com.hostelbooking.inventory.domain.availability.AvailabilityCacheEvictor;
import com.hostelbooking.inventory.domain.availability.AvailabilityCalculator;
import com.hostelbooking.inventory.domain.availability.AvailabilityProperties;
import com.hostelbooking.inventory.domain.availability.AvailabilityQuery;
import com.hostelbooking.inventory.domain.availability.SwingRoomPolicy;
import com.hostelbooking.inventory.domain.exception.HoldConflictException;
import com.hostelbooking.inventory.domain.exception.InvalidRangeException;
import com.hostelbooking.inventory.domain.ledger.LedgerCancellationService;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerOrigin;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import com.hostelbooking.inventory.domain.model.StayCategory;
import com.hostelbooking.inventory.domain.model.StayInterval;
import com.hostelbooking.inventory.domain.room.RoomCatalog;
import com.hostelbooking.inventory.domain.strategy.LocalLockStrategy;
import com.hostelbooking.inventory.domain.strategy.RoomLockManager;
import com.hostelbooking.inventory.support.InMemoryInventoryLedger;
import com.hostelbooking.inventory.support.MutableClock;
import com.hostelbooking.inventory.support.TestRooms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.hostelbooking.inventory.support.TestRooms.MIXTO_7;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DateBlockServiceTest {

    private static final LocalDate CHECK_IN = LocalDate.of(2026, 6, 1);
    private static final LocalDate CHECK_OUT = LocalDate.of(2026, 6, 4);

    private InMemoryInventoryLedger ledger;
    private AvailabilityCalculator calculator;
    private AvailabilityCacheEvictor cacheEvictor;
    private DateBlockService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at(LocalDateTime.of(2026, 5, 4, 10, 0));
        ledger = new InMemoryInventoryLedger();
        RoomCatalog catalog = TestRooms.hostel();
        calculator = new AvailabilityCalculator(ledger, catalog, new SwingRoomPolicy(),
                AvailabilityProperties.defaults(), clock);
        RoomLockManager lockManager = new RoomLockManager(
                Map.of("local", new LocalLockStrategy(TransactionOperations.withoutTransaction())));
        cacheEvictor = mock(AvailabilityCacheEvictor.class);
        service = new DateBlockService(ledger, catalog, calculator, lockManager, cacheEvictor,
                new LedgerCancellationService(ledger, lockManager, cacheEvictor, clock), clock);
    }

    private int freeInMixto7() {
        return calculator.forRoom(MIXTO_7, StayInterval.of(CHECK_IN, CHECK_OUT), StayCategory.MIXED, 1)
                .availableBeds();
    }

    @Test
    @DisplayName("Blocking without bed indices takes the whole room out of availability")
    void blockDates_wholeRoom() {
        LedgerEntry block = service.blockDates(MIXTO_7.getId(), CHECK_IN, CHECK_OUT, null, "  Painting  ");

        assertThat(block.getOrigin()).isEqualTo(LedgerOrigin.DIRECT);
        assertThat(block.getStatus()).isEqualTo(LedgerStatus.CONFIRMED);
        assertThat(block.isBlock()).isTrue();
        assertThat(block.getBlockReason()).isEqualTo("Painting");
        assertThat(block.sortedBeds()).containsExactly(1, 2, 3, 4, 5, 6, 7);
        assertThat(freeInMixto7()).isZero();
        verify(cacheEvictor).evictAll();
    }

    @Test
    @DisplayName("Blocking single beds leaves the rest sellable; blank reason gets a default")
    void blockDates_someBeds() {
        LedgerEntry block = service.blockDates(MIXTO_7.getId(), CHECK_IN, CHECK_OUT, List.of(7, 6), " ");

        assertThat(block.sortedBeds()).containsExactly(6, 7);
        assertThat(block.getBlockReason()).isEqualTo("Blocked");
        assertThat(freeInMixto7()).isEqualTo(5);
    }

    @Test
    @DisplayName("Blocking an occupied bed or a bed outside the room is refused")
    void blockDates_refused() {
        ledger.save(TestRooms.confirmedDirect(MIXTO_7, CHECK_IN.plusDays(1), CHECK_OUT, 3));

        assertThatThrownBy(() -> service.blockDates(MIXTO_7.getId(), CHECK_IN, CHECK_OUT, List.of(2, 3), null))
                .isInstanceOf(HoldConflictException.class)
                .extracting("conflictingBeds")
                .isEqualTo(List.of(3));
        assertThatThrownBy(() -> service.blockDates(MIXTO_7.getId(), CHECK_IN, CHECK_OUT, List.of(8), null))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("1..7");
        assertThat(ledger.all()).hasSize(1);
        verify(cacheEvictor, never()).evictAll();
    }

    @Test
    @DisplayName("Unblocking cancels the block and frees its beds; bookings cannot be unblocked")
    void unblock() {
        LedgerEntry block = service.blockDates(MIXTO_7.getId(), CHECK_IN, CHECK_OUT, null, "Owner use");
        LedgerEntry booking = ledger.save(TestRooms.confirmedDirect(TestRooms.MIXTO_12A, CHECK_IN, CHECK_OUT, 1));

        LedgerEntry cancelled = service.unblock(block.getId());

        assertThat(cancelled.getStatus()).isEqualTo(LedgerStatus.CANCELLED);
        assertThat(freeInMixto7()).isEqualTo(7);
        verify(cacheEvictor, times(2)).evictAll();
        assertThatThrownBy(() -> service.unblock(booking.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(calculator.calculate(new AvailabilityQuery(CHECK_IN, CHECK_OUT, 1, StayCategory.MIXED)).available())
                .isTrue();
    }
}
