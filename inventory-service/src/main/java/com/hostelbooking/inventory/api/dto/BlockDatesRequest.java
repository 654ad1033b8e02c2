package com.hostelbooking.inventory.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

/**
 * @param bedIndices Optional. Omit to block the whole room.
 */
public record BlockDatesRequest(
        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkIn,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOut,

        List<Integer> bedIndices,

        @Size(max = 255)
        String reason
) {
}
