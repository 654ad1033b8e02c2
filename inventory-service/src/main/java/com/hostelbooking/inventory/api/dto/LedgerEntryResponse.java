package com.hostelbooking.inventory.api.dto;

import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.PricingSnapshot;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record LedgerEntryResponse(
        Long id,
        String roomId,
        List<Integer> beds,
        LocalDate checkIn,
        LocalDate checkOut,
        String origin,
        String status,
        String category,
        String externalPlatform,
        String externalId,
        String blockReason,
        LocalDateTime expiresAt,
        PricingView pricing,
        BigDecimal paidAmount,
        String paymentStatus,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return new LedgerEntryResponse(
                entry.getId(),
                entry.getRoomId(),
                entry.sortedBeds(),
                entry.getCheckIn(),
                entry.getCheckOut(),
                entry.getOrigin().name(),
                entry.getStatus().name(),
                entry.getStayCategory() == null ? null : entry.getStayCategory().name(),
                entry.getExternalPlatform(),
                entry.getExternalId(),
                entry.getBlockReason(),
                entry.getExpiresAt(),
                PricingView.from(entry.getPricing()),
                entry.getPaidAmount(),
                entry.getPaymentStatus() == null ? null : entry.getPaymentStatus().name(),
                entry.getCreatedAt(),
                entry.getUpdatedAt());
    }

    /**
     * The quote frozen when the entry was created.
     */
    public record PricingView(
            BigDecimal subtotal,
            BigDecimal discountRate,
            BigDecimal discountAmount,
            String season,
            BigDecimal seasonMultiplier,
            BigDecimal seasonalAdjustment,
            BigDecimal total,
            BigDecimal depositRate,
            BigDecimal depositAmount,
            BigDecimal remainingAmount,
            LocalDate remainingDueDate
    ) {

        static PricingView from(PricingSnapshot snapshot) {
            if (snapshot == null || snapshot.getTotal() == null) {
                return null;
            }
            return new PricingView(
                    snapshot.getSubtotal(),
                    snapshot.getDiscountRate(),
                    snapshot.getDiscountAmount(),
                    snapshot.getSeason(),
                    snapshot.getSeasonMultiplier(),
                    snapshot.getSeasonalAdjustment(),
                    snapshot.getTotal(),
                    snapshot.getDepositRate(),
                    snapshot.getDepositAmount(),
                    snapshot.getRemainingAmount(),
                    snapshot.getRemainingDueDate());
        }
    }
}
