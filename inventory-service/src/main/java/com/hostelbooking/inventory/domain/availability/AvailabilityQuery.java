package com.hostelbooking.inventory.domain.availability;

import com.hostelbooking.inventory.domain.model.StayCategory;

import java.time.LocalDate;

public record AvailabilityQuery(LocalDate checkIn, LocalDate checkOut, int bedsNeeded, StayCategory category) {

    public AvailabilityQuery {
        category = StayCategory.orDefault(category);
    }

    public String cacheKey() {
        return checkIn + ":" + checkOut + ":" + bedsNeeded + ":" + category;
    }
}
