package com.hostelbooking.inventory.domain.model;

public enum LedgerOrigin {
    /** Created by staff on the property (manual blocks). */
    DIRECT,
    /** Created through the guest checkout hold flow. */
    HOLD,
    /** Imported from an external platform calendar. */
    PLATFORM_IMPORT;

    /**
     * Direct-origin entries belong to the hostel itself and are never displaced by an import.
     */
    public boolean isDirect() {
        return this != PLATFORM_IMPORT;
    }
}
