package com.hostelbooking.inventory.domain.model;

/**
 * Reconciliation of the amount reported by the payment collaborator against the frozen quote.
 */
public enum PaymentStatus {
    PAID_IN_FULL,
    DEPOSIT_PAID,
    UNDERPAID
}
