package com.hostelbooking.inventory.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;
import java.util.List;

public record PricingQuoteRequest(
        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkIn,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOut,

        @NotEmpty(message = "At least one room is required")
        List<@Valid RoomRequest> rooms
) {

    public record RoomRequest(
            @NotBlank(message = "Room ID cannot be blank")
            String roomId,

            @NotNull(message = "Beds requested cannot be null")
            @Positive(message = "Beds requested must be positive")
            Integer bedsRequested
    ) {
    }
}
