package com.hostelbooking.inventory.domain.hold;

import com.hostelbooking.inventory.domain.model.StayCategory;

import java.time.LocalDate;
import java.util.List;

/**
 * @param partyBeds      beds of the whole party when it is split over several holds; null for this hold only
 * @param idempotencyKey replays of the same key return the first receipt
 */
public record CreateHoldCommand(
        String roomId,
        List<Integer> bedIndices,
        LocalDate checkIn,
        LocalDate checkOut,
        StayCategory category,
        Integer partyBeds,
        String guestLabel,
        String idempotencyKey
) {
}
