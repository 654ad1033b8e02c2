package com.hostelbooking.inventory.domain.model;

import com.hostelbooking.inventory.pricing.PriceBreakdown;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Quote frozen on the ledger entry when it is created. Later changes to rates, tiers or seasons
 * never touch a stored snapshot.
 */
@Embeddable
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingSnapshot {

    @Column(name = "priced_beds")
    private Integer pricedBeds;

    @Column(name = "subtotal", precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "discount_rate", precision = 5, scale = 4)
    private BigDecimal discountRate;

    @Column(name = "discount_amount", precision = 12, scale = 2)
    private BigDecimal discountAmount;

    @Column(name = "season", length = 20)
    private String season;

    @Column(name = "season_multiplier", precision = 5, scale = 2)
    private BigDecimal seasonMultiplier;

    @Column(name = "seasonal_adjustment", precision = 12, scale = 2)
    private BigDecimal seasonalAdjustment;

    @Column(name = "total", precision = 12, scale = 2)
    private BigDecimal total;

    @Column(name = "deposit_rate", precision = 5, scale = 4)
    private BigDecimal depositRate;

    @Column(name = "deposit_amount", precision = 12, scale = 2)
    private BigDecimal depositAmount;

    @Column(name = "remaining_amount", precision = 12, scale = 2)
    private BigDecimal remainingAmount;

    @Column(name = "remaining_due_date")
    private LocalDate remainingDueDate;

    public static PricingSnapshot from(PriceBreakdown breakdown) {
        return PricingSnapshot.builder()
                .pricedBeds(breakdown.totalBeds())
                .subtotal(breakdown.subtotal())
                .discountRate(breakdown.discountRate())
                .discountAmount(breakdown.discountAmount())
                .season(breakdown.season().name())
                .seasonMultiplier(breakdown.seasonMultiplier())
                .seasonalAdjustment(breakdown.seasonalAdjustment())
                .total(breakdown.total())
                .depositRate(breakdown.depositRate())
                .depositAmount(breakdown.depositAmount())
                .remainingAmount(breakdown.remainingAmount())
                .remainingDueDate(breakdown.remainingDueDate())
                .build();
    }
}
