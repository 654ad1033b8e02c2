package com.hostelbooking.inventory.domain.model;

import com.hostelbooking.inventory.domain.exception.InvalidRangeException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Half-open date range {@code [checkIn, checkOut)}; one element per night.
 */
public record StayInterval(LocalDate checkIn, LocalDate checkOut) {

    public StayInterval {
        if (checkIn == null || checkOut == null) {
            throw new InvalidRangeException("Check-in and check-out dates are required");
        }
        if (!checkOut.isAfter(checkIn)) {
            throw new InvalidRangeException(
                    String.format("Check-out %s must be after check-in %s", checkOut, checkIn));
        }
    }

    public static StayInterval of(LocalDate checkIn, LocalDate checkOut) {
        return new StayInterval(checkIn, checkOut);
    }

    public int nights() {
        return (int) ChronoUnit.DAYS.between(checkIn, checkOut);
    }

    public boolean overlaps(StayInterval other) {
        return checkIn.isBefore(other.checkOut) && other.checkIn.isBefore(checkOut);
    }

    public boolean coversNight(LocalDate date) {
        return !date.isBefore(checkIn) && date.isBefore(checkOut);
    }

    public StayInterval shiftDays(long days) {
        return new StayInterval(checkIn.plusDays(days), checkOut.plusDays(days));
    }

    /**
     * Nights of the stay, check-out day excluded.
     */
    public List<LocalDate> nightsList() {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate current = checkIn;
        while (current.isBefore(checkOut)) {
            dates.add(current);
            current = current.plusDays(1);
        }
        return dates;
    }

    @Override
    public String toString() {
        return "[" + checkIn + ", " + checkOut + ")";
    }
}
