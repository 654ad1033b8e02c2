package com.hostelbooking.inventory.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Published when an imported booking would double-book a direct booking.
 * Staff resolve these by hand with the platform.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExternalBookingConflictEvent {
    private Long feedId;
    private String roomId;
    private String platform;
    private String externalId;
    private String guestLabel;
    private LocalDate checkIn;
    private LocalDate checkOut;
    private List<Long> conflictingEntryIds;
    private Instant timestamp;
}
