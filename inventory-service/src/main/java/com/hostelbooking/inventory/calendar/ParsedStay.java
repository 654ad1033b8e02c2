package com.hostelbooking.inventory.calendar;

import com.hostelbooking.inventory.domain.model.StayInterval;

/**
 * One event of an external calendar, normalized. A candidate only; it does not touch the ledger.
 *
 * @param guestCount beds the stay claims when the feed says so, otherwise null
 */
public record ParsedStay(
        String externalId,
        String guestLabel,
        StayInterval interval,
        String platform,
        StayStatus status,
        Integer guestCount,
        String description
) {
}
