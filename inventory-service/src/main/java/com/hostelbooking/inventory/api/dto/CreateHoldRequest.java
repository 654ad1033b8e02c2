package com.hostelbooking.inventory.api.dto;

import com.hostelbooking.inventory.domain.hold.CreateHoldCommand;
import com.hostelbooking.inventory.domain.model.StayCategory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

/**
 * @param partyBeds      Optional. Beds of the whole party when it is split over several holds (drives the group discount).
 * @param idempotencyKey Optional. Same key returns the first hold instead of creating another.
 */
public record CreateHoldRequest(
        @NotBlank(message = "Room ID cannot be blank")
        String roomId,

        @NotEmpty(message = "At least one bed index is required")
        List<@NotNull @Positive Integer> bedIndices,

        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkIn,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOut,

        StayCategory category,

        @Positive(message = "Party beds must be positive")
        Integer partyBeds,

        @Size(max = 255)
        String guestLabel,

        @Size(max = 255)
        String idempotencyKey
) {

    public CreateHoldCommand toCommand() {
        return new CreateHoldCommand(roomId, bedIndices, checkIn, checkOut, category, partyBeds, guestLabel,
                idempotencyKey);
    }
}
