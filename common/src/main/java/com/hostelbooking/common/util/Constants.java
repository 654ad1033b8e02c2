package com.hostelbooking.common.util;

/**
 * Key prefixes and cache names shared by the hostel services.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:room:";
    public static final String IDEMPOTENCY_HOLD_PREFIX = "idempotency:hold:";
    public static final String AVAILABILITY_CACHE = "availability";

    public static final String TOPIC_ENTRY_CONFIRMED = "ledger-entry-confirmed";
    public static final String TOPIC_EXTERNAL_CONFLICT = "external-booking-conflict";
}
