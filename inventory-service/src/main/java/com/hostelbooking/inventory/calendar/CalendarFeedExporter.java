package com.hostelbooking.inventory.calendar;

import com.hostelbooking.inventory.domain.ledger.InventoryLedger;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.Room;
import com.hostelbooking.inventory.domain.room.RoomCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Publishes a room's confirmed occupancy as an iCalendar document for the platforms to import.
 * One all-day VEVENT per confirmed entry; holds are transient and not exported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalendarFeedExporter {

    private final InventoryLedger ledger;
    private final RoomCatalog roomCatalog;
    private final CalendarProperties properties;
    private final Clock clock;

    public String exportRoom(String roomId) {
        Room room = roomCatalog.get(roomId);
        LocalDate from = LocalDate.now(clock).minusDays(properties.exportPastDays());
        List<LedgerEntry> entries = ledger.findConfirmedFrom(roomId, from);
        String stamp = clock.instant().atOffset(ZoneOffset.UTC).format(ICalendarFormat.UTC_DATE_TIME);

        StringBuilder out = new StringBuilder();
        line(out, "BEGIN:VCALENDAR");
        line(out, "VERSION:2.0");
        line(out, "PRODID:" + properties.productId());
        line(out, "CALSCALE:GREGORIAN");
        line(out, "METHOD:PUBLISH");
        line(out, "X-WR-CALNAME:" + ICalendarFormat.escapeText(properties.calendarName() + " - " + room.getName()));
        line(out, "X-WR-TIMEZONE:" + clock.getZone().getId());
        for (LedgerEntry entry : entries) {
            line(out, "BEGIN:VEVENT");
            line(out, "UID:entry-" + entry.getId() + "@" + properties.uidDomain());
            line(out, "DTSTAMP:" + stamp);
            line(out, "DTSTART;VALUE=DATE:" + ICalendarFormat.formatDate(entry.getCheckIn()));
            line(out, "DTEND;VALUE=DATE:" + ICalendarFormat.formatDate(entry.getCheckOut()));
            line(out, "SUMMARY:" + ICalendarFormat.escapeText(summary(entry, room)));
            line(out, "DESCRIPTION:" + ICalendarFormat.escapeText(description(entry)));
            line(out, "STATUS:CONFIRMED");
            line(out, "TRANSP:OPAQUE");
            line(out, "END:VEVENT");
        }
        line(out, "END:VCALENDAR");
        log.debug("Exported {} event(s) for room {}", entries.size(), roomId);
        return out.toString();
    }

    private static String summary(LedgerEntry entry, Room room) {
        return (entry.isBlock() ? "Blocked - " : "Reserved - ") + room.getName();
    }

    private static String description(LedgerEntry entry) {
        String beds = entry.sortedBeds().stream().map(String::valueOf).collect(Collectors.joining(", "));
        StringBuilder text = new StringBuilder("Beds: ").append(beds);
        if (entry.isBlock()) {
            text.append("\nReason: ").append(entry.getBlockReason());
        } else {
            text.append("\nGuests: ").append(entry.getBeds().size());
        }
        return text.toString();
    }

    private static void line(StringBuilder out, String contentLine) {
        out.append(ICalendarFormat.fold(contentLine)).append(ICalendarFormat.CRLF);
    }
}
