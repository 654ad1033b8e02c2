package com.hostelbooking.inventory.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a ledger entry.
 * <pre>
 * HOLD -> CONFIRMED | RELEASED | EXPIRED
 * CONFIRMED -> CANCELLED
 * </pre>
 * RELEASED, EXPIRED and CANCELLED are terminal and are kept for audit only.
 */
public enum LedgerStatus {
    HOLD,
    CONFIRMED,
    RELEASED,
    EXPIRED,
    CANCELLED;

    public static final Set<LedgerStatus> ACTIVE = Collections.unmodifiableSet(EnumSet.of(HOLD, CONFIRMED));

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean canTransitionTo(LedgerStatus target) {
        return switch (this) {
            case HOLD -> target == CONFIRMED || target == RELEASED || target == EXPIRED;
            case CONFIRMED -> target == CANCELLED;
            case RELEASED, EXPIRED, CANCELLED -> false;
        };
    }
}
