package com.hostelbooking.inventory.pricing;

import java.math.BigDecimal;

/**
 * Discount by total beds of the party, checked from the largest tier down.
 */
public enum GroupDiscountTier {
    LARGE_GROUP(26, new BigDecimal("0.20")),
    MEDIUM_GROUP(16, new BigDecimal("0.15")),
    SMALL_GROUP(7, new BigDecimal("0.10")),
    NONE(0, BigDecimal.ZERO);

    private final int minimumBeds;
    private final BigDecimal rate;

    GroupDiscountTier(int minimumBeds, BigDecimal rate) {
        this.minimumBeds = minimumBeds;
        this.rate = rate;
    }

    public BigDecimal getRate() {
        return rate;
    }

    public static GroupDiscountTier forBeds(int beds) {
        for (GroupDiscountTier tier : values()) {
            if (beds >= tier.minimumBeds) {
                return tier;
            }
        }
        return NONE;
    }
}
