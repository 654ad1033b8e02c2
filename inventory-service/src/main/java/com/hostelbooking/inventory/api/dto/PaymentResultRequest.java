package com.hostelbooking.inventory.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Signal from the payment collaborator.
 */
public record PaymentResultRequest(
        @NotNull(message = "Success flag cannot be null")
        Boolean success,

        @PositiveOrZero(message = "Paid amount cannot be negative")
        BigDecimal paidAmount
) {
}
