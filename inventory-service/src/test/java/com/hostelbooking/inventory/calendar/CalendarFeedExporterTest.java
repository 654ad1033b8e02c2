package com.hostelbooking.inventory.calendar;

import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import com.hostelbooking.inventory.support.InMemoryInventoryLedger;
import com.hostelbooking.inventory.support.MutableClock;
import com.hostelbooking.inventory.support.TestRooms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static com.hostelbooking.inventory.support.TestRooms.MIXTO_7;
import static org.assertj.core.api.Assertions.assertThat;

class CalendarFeedExporterTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 5, 4, 10, 0);
    private static final String LONG_REASON =
            "Maintenance: replacing all mattresses, repainting the walls and fixing the lockers in São Paulo";

    private InMemoryInventoryLedger ledger;
    private CalendarFeedExporter exporter;
    private CalendarFeedParser parser;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at(NOW);
        ledger = new InMemoryInventoryLedger();
        exporter = new CalendarFeedExporter(ledger, TestRooms.hostel(), CalendarProperties.defaults(), clock);
        parser = new CalendarFeedParser(new FeedHeuristics(), CalendarProperties.defaults(), clock);
    }

    @Test
    @DisplayName("Export lists confirmed entries only, as all-day events with stable UIDs")
    void export_confirmedOnly() {
        LedgerEntry booking = ledger.save(TestRooms.confirmedDirect(MIXTO_7,
                LocalDate.of(2026, 5, 20), LocalDate.of(2026, 5, 23), 1, 2));
        ledger.save(TestRooms.hold(MIXTO_7, LocalDate.of(2026, 5, 20), LocalDate.of(2026, 5, 23),
                NOW.plusMinutes(10), 3));
        LedgerEntry cancelled = TestRooms.confirmedDirect(MIXTO_7, LocalDate.of(2026, 6, 1), LocalDate.of(2026, 6, 2), 4);
        cancelled.setStatus(LedgerStatus.CANCELLED);
        ledger.save(cancelled);
        ledger.save(TestRooms.confirmedDirect(MIXTO_7, LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 3), 5));

        String ics = exporter.exportRoom(MIXTO_7.getId());

        assertThat(ics).startsWith("BEGIN:VCALENDAR\r\nVERSION:2.0\r\n");
        assertThat(ics).endsWith("END:VCALENDAR\r\n");
        assertThat(ics).contains("METHOD:PUBLISH", "X-WR-TIMEZONE:America/Sao_Paulo");
        assertThat(ics.split("BEGIN:VEVENT", -1)).hasSize(2);
        assertThat(ics).contains("UID:entry-" + booking.getId() + "@hostelbooking.local");
        assertThat(ics).contains("DTSTART;VALUE=DATE:20260520", "DTEND;VALUE=DATE:20260523");
        assertThat(ics).contains("SUMMARY:Reserved - Mixto 7");
    }

    @Test
    @DisplayName("Exported document parses back to the same stays, blocks included")
    void export_thenParse_roundTrips() {
        ledger.save(TestRooms.confirmedDirect(MIXTO_7, LocalDate.of(2026, 5, 20), LocalDate.of(2026, 5, 23), 1, 2));
        LedgerEntry block = TestRooms.confirmedDirect(MIXTO_7, LocalDate.of(2026, 7, 1), LocalDate.of(2026, 7, 4),
                1, 2, 3, 4, 5, 6, 7);
        block.setBlockReason(LONG_REASON);
        ledger.save(block);

        ParseResult parsed = parser.parse(exporter.exportRoom(MIXTO_7.getId()), null);

        assertThat(parsed.totalEvents()).isEqualTo(2);
        assertThat(parsed.skippedEvents()).isZero();
        ParsedStay booking = parsed.stays().get(0);
        assertThat(booking.interval().checkIn()).isEqualTo(LocalDate.of(2026, 5, 20));
        assertThat(booking.interval().checkOut()).isEqualTo(LocalDate.of(2026, 5, 23));
        assertThat(booking.status()).isEqualTo(StayStatus.CONFIRMED);
        assertThat(booking.guestCount()).isEqualTo(2);

        ParsedStay blocked = parsed.stays().get(1);
        assertThat(blocked.status()).isEqualTo(StayStatus.BLOCKED);
        assertThat(blocked.description()).contains(LONG_REASON);
        assertThat(parsed.blockedEvents()).isEqualTo(1);
    }

    @Test
    @DisplayName("Content lines are folded at 75 octets without splitting characters")
    void export_foldsLongLines() {
        LedgerEntry block = TestRooms.confirmedDirect(MIXTO_7, LocalDate.of(2026, 7, 1), LocalDate.of(2026, 7, 4), 1);
        block.setBlockReason(LONG_REASON + " " + LONG_REASON);
        ledger.save(block);

        String ics = exporter.exportRoom(MIXTO_7.getId());

        List<String> physicalLines = Arrays.asList(ics.split("\r\n"));
        assertThat(physicalLines).allSatisfy(line ->
                assertThat(line.getBytes(StandardCharsets.UTF_8).length).isLessThanOrEqualTo(75));
        assertThat(physicalLines).anySatisfy(line -> assertThat(line).startsWith(" "));
    }

    @Test
    @DisplayName("Folding and unfolding are inverse for multi-byte text")
    void foldUnfold_multiByte() {
        String line = "DESCRIPTION:" + "ção".repeat(40);

        String folded = ICalendarFormat.fold(line);

        assertThat(folded.split("\r\n")).allSatisfy(physical ->
                assertThat(physical.getBytes(StandardCharsets.UTF_8).length).isLessThanOrEqualTo(75));
        assertThat(ICalendarFormat.unfold(folded)).containsExactly(line);
    }
}
