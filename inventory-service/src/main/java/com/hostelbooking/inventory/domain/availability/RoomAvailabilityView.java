package com.hostelbooking.inventory.domain.availability;

import com.hostelbooking.inventory.domain.model.RoomCategory;

import java.util.List;

/**
 * Free beds of one room for an interval.
 *
 * @param availableBeds free beds minus the safety buffer, never negative; zero when not eligible
 * @param offeredBeds   lowest free indices, at most the number of beds needed
 */
public record RoomAvailabilityView(
        String roomId,
        String roomName,
        RoomCategory roomCategory,
        int capacity,
        boolean eligible,
        int freeBeds,
        int safetyBuffer,
        int availableBeds,
        List<Integer> offeredBeds
) {
}
