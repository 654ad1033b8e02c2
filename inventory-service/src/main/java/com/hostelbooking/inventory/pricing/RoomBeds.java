package com.hostelbooking.inventory.pricing;

import com.hostelbooking.inventory.domain.model.Room;

/**
 * Beds requested in one room.
 */
public record RoomBeds(Room room, int beds) {
}
