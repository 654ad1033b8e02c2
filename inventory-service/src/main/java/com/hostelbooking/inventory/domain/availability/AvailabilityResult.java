package com.hostelbooking.inventory.domain.availability;

import com.hostelbooking.inventory.domain.model.StayCategory;

import java.time.LocalDate;
import java.util.List;

/**
 * @param splitAcrossRooms true when no single eligible room fits the party but the rooms together do
 */
public record AvailabilityResult(
        LocalDate checkIn,
        LocalDate checkOut,
        int bedsNeeded,
        StayCategory category,
        boolean available,
        int availableBeds,
        boolean splitAcrossRooms,
        List<RoomAvailabilityView> perRoom,
        List<AlternativeDates> alternativeDates
) {
}
