package com.hostelbooking.inventory.domain.hold;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record HoldReceipt(
        Long holdId,
        String roomId,
        List<Integer> beds,
        LocalDate checkIn,
        LocalDate checkOut,
        LocalDateTime expiresAt,
        BigDecimal total,
        BigDecimal depositAmount
) {
}
