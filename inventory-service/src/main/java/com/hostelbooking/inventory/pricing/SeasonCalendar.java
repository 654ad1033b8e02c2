package com.hostelbooking.inventory.pricing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps a night to its season. Carnival windows override the month table:
 * December to March high, June to September low, everything else shoulder.
 */
@Slf4j
@Component
public class SeasonCalendar {

    private final List<CarnivalPeriod> carnivalPeriods;

    public SeasonCalendar(PricingProperties properties) {
        List<CarnivalPeriod> periods = new ArrayList<>();
        for (String raw : properties.carnivalPeriods()) {
            periods.add(CarnivalPeriod.parse(raw));
        }
        this.carnivalPeriods = Collections.unmodifiableList(periods);
        log.info("Loaded {} carnival period(s)", carnivalPeriods.size());
    }

    public Season seasonOf(LocalDate night) {
        for (CarnivalPeriod period : carnivalPeriods) {
            if (period.contains(night)) {
                return Season.CARNIVAL;
            }
        }
        return switch (night.getMonth()) {
            case DECEMBER, JANUARY, FEBRUARY, MARCH -> Season.HIGH;
            case JUNE, JULY, AUGUST, SEPTEMBER -> Season.LOW;
            default -> Season.SHOULDER;
        };
    }

    record CarnivalPeriod(LocalDate start, LocalDate end) {

        static CarnivalPeriod parse(String raw) {
            String[] parts = raw.split("/");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Carnival period must be start/end, got: " + raw);
            }
            LocalDate start = LocalDate.parse(parts[0].trim());
            LocalDate end = LocalDate.parse(parts[1].trim());
            if (end.isBefore(start)) {
                throw new IllegalArgumentException("Carnival period ends before it starts: " + raw);
            }
            return new CarnivalPeriod(start, end);
        }

        boolean contains(LocalDate date) {
            return !date.isBefore(start) && !date.isAfter(end);
        }
    }
}
