package com.hostelbooking.inventory.pricing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Every intermediate amount of a quote. All money values have scale 2.
 *
 * @param totalBeds beds priced by this quote
 * @param partyBeds beds of the whole party, which decides the discount tier and deposit rate
 */
public record PriceBreakdown(
        LocalDate checkIn,
        LocalDate checkOut,
        int nights,
        int totalBeds,
        int partyBeds,
        List<RoomLine> rooms,
        BigDecimal subtotal,
        BigDecimal discountRate,
        BigDecimal discountAmount,
        Season season,
        BigDecimal seasonMultiplier,
        BigDecimal seasonalAdjustment,
        BigDecimal total,
        BigDecimal depositRate,
        BigDecimal depositAmount,
        BigDecimal remainingAmount,
        LocalDate remainingDueDate
) {

    public record RoomLine(String roomId, String roomName, int beds, BigDecimal basePricePerBed, BigDecimal amount) {
    }
}
