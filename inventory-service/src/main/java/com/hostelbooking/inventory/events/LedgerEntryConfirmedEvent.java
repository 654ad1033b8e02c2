package com.hostelbooking.inventory.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Published when a hold is confirmed. Consumed by guest notifications.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntryConfirmedEvent {
    private Long entryId;
    private String roomId;
    private List<Integer> beds;
    private LocalDate checkIn;
    private LocalDate checkOut;
    private BigDecimal total;
    private BigDecimal paidAmount;
    private String paymentStatus;
    private Instant timestamp;
}
