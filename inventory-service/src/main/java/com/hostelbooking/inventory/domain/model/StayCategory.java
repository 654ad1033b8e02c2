package com.hostelbooking.inventory.domain.model;

/**
 * Room eligibility requested by a party.
 */
public enum StayCategory {
    MIXED,
    FEMALE_ONLY;

    public static StayCategory orDefault(StayCategory category) {
        return category == null ? MIXED : category;
    }
}
