package com.hostelbooking.inventory.calendar;

import com.hostelbooking.inventory.domain.exception.FeedParseException;
import com.hostelbooking.inventory.domain.exception.InvalidRangeException;
import com.hostelbooking.inventory.domain.model.StayInterval;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns an iCalendar document from a platform into {@link ParsedStay} candidates.
 * <p>
 * Only VEVENT components are read. DTSTART/DTEND may be DATE or DATE-TIME values; date-times in UTC
 * are moved to the hostel time zone before the date is taken. Events without usable dates are
 * counted as skipped, never fatal. A document that does not start with {@code BEGIN:VCALENDAR} is
 * rejected as a whole.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalendarFeedParser {

    private static final DateTimeFormatter LOCAL_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    private static final String UNKNOWN_PLATFORM = "unknown";
    private static final String DEFAULT_GUEST_LABEL = "Guest";

    private final FeedHeuristics heuristics;
    private final CalendarProperties properties;
    private final Clock clock;

    public ParseResult parse(String document, String platformHint) {
        if (document == null || document.isBlank()) {
            throw new FeedParseException("Calendar document is empty");
        }
        String text = document.charAt(0) == '\uFEFF' ? document.substring(1) : document;
        List<String> lines = ICalendarFormat.unfold(text.strip());
        if (lines.isEmpty() || !lines.get(0).trim().equalsIgnoreCase("BEGIN:VCALENDAR")) {
            throw new FeedParseException("Missing BEGIN:VCALENDAR header");
        }

        List<ParsedStay> stays = new ArrayList<>();
        int total = 0;
        int skipped = 0;
        int blocked = 0;
        Map<String, String> event = null;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.equalsIgnoreCase("BEGIN:VEVENT")) {
                event = new HashMap<>();
                total++;
            } else if (trimmed.equalsIgnoreCase("END:VEVENT")) {
                if (event != null) {
                    Optional<ParsedStay> stay = toStay(event, platformHint);
                    if (stay.isPresent()) {
                        stays.add(stay.get());
                        if (stay.get().status() == StayStatus.BLOCKED) {
                            blocked++;
                        }
                    } else {
                        skipped++;
                    }
                }
                event = null;
            } else if (event != null) {
                readProperty(event, line);
            }
        }
        log.debug("Parsed calendar: {} event(s), {} stay(s), {} skipped", total, stays.size(), skipped);
        return new ParseResult(List.copyOf(stays), total, skipped, blocked);
    }

    /**
     * Keeps the first occurrence of each property. Keys are upper-case names; parameters go under
     * {@code NAME;PARAMS}.
     */
    private void readProperty(Map<String, String> event, String line) {
        int colon = valueSeparator(line);
        if (colon <= 0) {
            return;
        }
        String head = line.substring(0, colon);
        String value = line.substring(colon + 1);
        int semicolon = head.indexOf(';');
        String name = (semicolon < 0 ? head : head.substring(0, semicolon)).trim().toUpperCase(Locale.ROOT);
        event.putIfAbsent(name, value);
        if (semicolon >= 0) {
            event.putIfAbsent(name + ";PARAMS", head.substring(semicolon + 1).toUpperCase(Locale.ROOT));
        }
    }

    /**
     * First colon outside a quoted parameter value.
     */
    private int valueSeparator(String line) {
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == ':' && !quoted) {
                return i;
            }
        }
        return -1;
    }

    private Optional<ParsedStay> toStay(Map<String, String> event, String platformHint) {
        LocalDate start = parseDate(event.get("DTSTART"));
        if (start == null) {
            log.debug("Skipping event {} without a readable DTSTART", event.get("UID"));
            return Optional.empty();
        }
        LocalDate end = parseDate(event.get("DTEND"));
        if (end == null) {
            end = start.plusDays(1);
        }
        StayInterval interval;
        try {
            interval = StayInterval.of(start, end);
        } catch (InvalidRangeException e) {
            log.debug("Skipping event {}: {}", event.get("UID"), e.getMessage());
            return Optional.empty();
        }

        String summary = clean(ICalendarFormat.unescapeText(event.get("SUMMARY")));
        String description = truncate(clean(ICalendarFormat.unescapeText(event.get("DESCRIPTION"))));
        String uid = clean(event.get("UID"));
        String searchable = String.join(" ",
                nullToEmpty(summary), nullToEmpty(description), nullToEmpty(uid), nullToEmpty(event.get("URL")));

        String platform = platformHint != null && !platformHint.isBlank()
                ? platformHint.trim().toLowerCase(Locale.ROOT)
                : heuristics.inferPlatform(searchable).orElse(UNKNOWN_PLATFORM);
        StayStatus status = heuristics.inferStatus(event.get("STATUS"),
                String.join(" ", nullToEmpty(summary), nullToEmpty(description)));
        Integer guestCount = heuristics.extractGuestCount(String.join(" ", nullToEmpty(summary), nullToEmpty(description)));
        String externalId = uid != null ? uid : syntheticId(interval, summary);

        return Optional.of(new ParsedStay(
                externalId,
                summary != null ? summary : DEFAULT_GUEST_LABEL,
                interval,
                platform,
                status,
                guestCount,
                description));
    }

    /**
     * Accepts {@code yyyyMMdd}, {@code yyyyMMddTHHmmss} (floating) and {@code yyyyMMddTHHmmssZ} (UTC).
     */
    private LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        try {
            if (v.length() == 8) {
                return LocalDate.parse(v, ICalendarFormat.DATE);
            }
            if (v.endsWith("Z") || v.endsWith("z")) {
                return LocalDateTime.parse(v.substring(0, v.length() - 1), LOCAL_DATE_TIME)
                        .atOffset(ZoneOffset.UTC)
                        .atZoneSameInstant(clock.getZone())
                        .toLocalDate();
            }
            return LocalDateTime.parse(v, LOCAL_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private String truncate(String description) {
        if (description == null || description.length() <= properties.maxDescriptionLength()) {
            return description;
        }
        return description.substring(0, properties.maxDescriptionLength());
    }

    private static String syntheticId(StayInterval interval, String summary) {
        return "generated-" + ICalendarFormat.formatDate(interval.checkIn()) + "-"
                + ICalendarFormat.formatDate(interval.checkOut()) + "-"
                + Integer.toHexString(nullToEmpty(summary).hashCode());
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
