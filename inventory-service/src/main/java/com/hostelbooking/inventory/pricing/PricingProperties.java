package com.hostelbooking.inventory.pricing;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * @param carnivalPeriods inclusive ranges written {@code yyyy-MM-dd/yyyy-MM-dd}
 * @param remainingDueDaysBeforeCheckIn days before check-in the balance is due
 */
@ConfigurationProperties(prefix = "inventory.pricing")
public record PricingProperties(List<String> carnivalPeriods, Integer remainingDueDaysBeforeCheckIn) {

    public PricingProperties {
        carnivalPeriods = carnivalPeriods == null ? List.of() : List.copyOf(carnivalPeriods);
        if (remainingDueDaysBeforeCheckIn == null) {
            remainingDueDaysBeforeCheckIn = 7;
        }
    }
}
