package com.hostelbooking.inventory.sync;

import com.hostelbooking.inventory.calendar.ParsedStay;
import com.hostelbooking.inventory.calendar.StayStatus;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.StayInterval;
import com.hostelbooking.inventory.support.TestRooms;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.hostelbooking.inventory.support.TestRooms.MIXTO_7;
import static org.assertj.core.api.Assertions.assertThat;

class ConflictResolverTest {

    private static final LocalDate CHECK_IN = LocalDate.of(2026, 5, 20);
    private static final LocalDate CHECK_OUT = LocalDate.of(2026, 5, 23);

    private final ConflictResolver resolver = new ConflictResolver();

    private static ParsedStay stay(String externalId, StayStatus status, Integer guests) {
        return new ParsedStay(externalId, "Guest", StayInterval.of(CHECK_IN, CHECK_OUT), "airbnb", status, guests, null);
    }

    private static LedgerEntry withId(LedgerEntry entry, long id) {
        entry.setId(id);
        return entry;
    }

    @Test
    @DisplayName("New stay claims guestCount beds, lowest free index first")
    void newStay_claimsLowestFreeBeds() {
        LedgerEntry direct = withId(TestRooms.confirmedDirect(MIXTO_7, CHECK_IN, CHECK_OUT, 1, 3), 1L);

        Resolution resolution = resolver.resolve(MIXTO_7, stay("a1", StayStatus.CONFIRMED, 3),
                Optional.empty(), List.of(direct), Set.of("a1"));

        assertThat(resolution.action()).isEqualTo(Resolution.Action.CREATE);
        assertThat(resolution.beds()).containsExactly(2, 4, 5);
    }

    @Test
    @DisplayName("Guest count defaults to one bed and is capped at capacity")
    void claimSize_defaultsAndCap() {
        assertThat(resolver.resolve(MIXTO_7, stay("a1", StayStatus.CONFIRMED, null),
                Optional.empty(), List.of(), Set.of()).beds()).containsExactly(1);
        assertThat(resolver.resolve(MIXTO_7, stay("a2", StayStatus.CONFIRMED, 40),
                Optional.empty(), List.of(), Set.of()).beds()).hasSize(7);
    }

    @Test
    @DisplayName("Import that does not fit next to a direct booking is an external conflict; nothing is evicted")
    void overlapWithDirect_isConflict() {
        LedgerEntry direct = withId(TestRooms.confirmedDirect(MIXTO_7, CHECK_IN, CHECK_OUT, 1, 2, 3, 4, 5, 6), 9L);

        Resolution resolution = resolver.resolve(MIXTO_7, stay("a1", StayStatus.CONFIRMED, 2),
                Optional.empty(), List.of(direct), Set.of("a1"));

        assertThat(resolution.action()).isEqualTo(Resolution.Action.CONFLICT);
        assertThat(resolution.directConflict()).isTrue();
        assertThat(resolution.conflictingEntryIds()).containsExactly(9L);
        assertThat(resolution.beds()).isEmpty();
        assertThat(direct.getBeds()).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    @DisplayName("Two platforms selling the same beds is a conflict without a direct booking")
    void overlapBetweenPlatforms_isConflict() {
        LedgerEntry other = withId(TestRooms.imported(MIXTO_7, "booking.com", "bk-1", 2L, CHECK_IN, CHECK_OUT,
                1, 2, 3, 4, 5, 6, 7), 4L);

        Resolution resolution = resolver.resolve(MIXTO_7, stay("a1", StayStatus.CONFIRMED, 1),
                Optional.empty(), List.of(other), Set.of("a1"));

        assertThat(resolution.action()).isEqualTo(Resolution.Action.CONFLICT);
        assertThat(resolution.directConflict()).isFalse();
    }

    @Test
    @DisplayName("Blocked interval that cannot take the whole room is skipped")
    void blockOverOccupancy_isSkipped() {
        LedgerEntry direct = withId(TestRooms.confirmedDirect(MIXTO_7, CHECK_IN, CHECK_OUT, 1), 1L);

        Resolution resolution = resolver.resolve(MIXTO_7, stay("blk", StayStatus.BLOCKED, null),
                Optional.empty(), List.of(direct), Set.of("blk"));

        assertThat(resolution.action()).isEqualTo(Resolution.Action.SKIP);
        assertThat(resolver.resolve(MIXTO_7, stay("blk", StayStatus.BLOCKED, null),
                Optional.empty(), List.of(), Set.of("blk")).beds()).hasSize(7);
    }

    @Test
    @DisplayName("Cancelled stay cancels its import, or is skipped when never imported")
    void cancelledStay() {
        LedgerEntry existing = withId(TestRooms.imported(MIXTO_7, "airbnb", "a1", 1L, CHECK_IN, CHECK_OUT, 1), 3L);

        Resolution cancel = resolver.resolve(MIXTO_7, stay("a1", StayStatus.CANCELLED, null),
                Optional.of(existing), List.of(existing), Set.of("a1"));
        Resolution skip = resolver.resolve(MIXTO_7, stay("a2", StayStatus.CANCELLED, null),
                Optional.empty(), List.of(), Set.of("a2"));

        assertThat(cancel.action()).isEqualTo(Resolution.Action.CANCEL);
        assertThat(cancel.target()).isSameAs(existing);
        assertThat(skip.action()).isEqualTo(Resolution.Action.SKIP);
    }

    @Test
    @DisplayName("Known external id: unchanged when identical, updated in place when the dates moved")
    void existingImport_unchangedOrUpdated() {
        LedgerEntry existing = withId(TestRooms.imported(MIXTO_7, "airbnb", "a1", 1L, CHECK_IN, CHECK_OUT, 4), 3L);

        Resolution same = resolver.resolve(MIXTO_7, stay("a1", StayStatus.CONFIRMED, 1),
                Optional.of(existing), List.of(existing), Set.of("a1"));
        assertThat(same.action()).isEqualTo(Resolution.Action.UNCHANGED);

        ParsedStay moved = new ParsedStay("a1", "Guest", StayInterval.of(CHECK_IN.plusDays(1), CHECK_OUT.plusDays(1)),
                "airbnb", StayStatus.CONFIRMED, 1, null);
        Resolution update = resolver.resolve(MIXTO_7, moved, Optional.of(existing), List.of(existing), Set.of("a1"));
        assertThat(update.action()).isEqualTo(Resolution.Action.UPDATE);
        assertThat(update.target()).isSameAs(existing);
        assertThat(update.beds()).containsExactly(4);
    }

    @Test
    @DisplayName("A same-platform booking re-issued under a new id replaces the vanished one")
    void reissuedBooking_updatesVanishedImport() {
        LedgerEntry old = withId(TestRooms.imported(MIXTO_7, "airbnb", "old-id", 1L, CHECK_IN, CHECK_OUT, 1, 2), 5L);

        Resolution resolution = resolver.resolve(MIXTO_7, stay("new-id", StayStatus.CONFIRMED, 2),
                Optional.empty(), List.of(old), Set.of("new-id"));

        assertThat(resolution.action()).isEqualTo(Resolution.Action.UPDATE);
        assertThat(resolution.target()).isSameAs(old);
        assertThat(resolution.beds()).containsExactly(1, 2);
    }
}
