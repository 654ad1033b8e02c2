package com.hostelbooking.inventory.domain.availability;

import java.time.LocalDate;

public record AlternativeDates(LocalDate checkIn, LocalDate checkOut, int shiftDays, int availableBeds) {
}
