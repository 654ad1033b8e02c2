package com.hostelbooking.inventory.domain.model;

/**
 * How a dormitory may be sold.
 */
public enum RoomCategory {
    /** Any party may book. */
    MIXED,
    /** Female-only beds. */
    DESIGNATED,
    /** Female-only by default; opens to mixed parties close to the stay date when no female-only booking exists. */
    SWING
}
