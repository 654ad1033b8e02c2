package com.hostelbooking.inventory.pricing;

import java.math.BigDecimal;

/**
 * Rate seasons. When a stay crosses seasons the highest multiplier governs, together with its
 * minimum-nights floor.
 */
public enum Season {
    CARNIVAL(new BigDecimal("2.0"), 5),
    HIGH(new BigDecimal("1.5"), 1),
    SHOULDER(new BigDecimal("1.0"), 1),
    LOW(new BigDecimal("0.8"), 1);

    private final BigDecimal multiplier;
    private final int minimumNights;

    Season(BigDecimal multiplier, int minimumNights) {
        this.multiplier = multiplier;
        this.minimumNights = minimumNights;
    }

    public BigDecimal getMultiplier() {
        return multiplier;
    }

    public int getMinimumNights() {
        return minimumNights;
    }
}
