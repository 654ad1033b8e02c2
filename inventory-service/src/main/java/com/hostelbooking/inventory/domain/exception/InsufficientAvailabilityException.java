package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.BusinessException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fewer beds are free than requested, after the safety buffer.
 */
public class InsufficientAvailabilityException extends BusinessException {
    private final String roomId;
    private final int requested;
    private final int available;

    public InsufficientAvailabilityException(String roomId, int requested, int available) {
        super(String.format("Room %s has %d bed(s) available, %d requested", roomId, available, requested),
                "INSUFFICIENT_AVAILABILITY");
        this.roomId = roomId;
        this.requested = requested;
        this.available = available;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("roomId", roomId);
        details.put("requested", requested);
        details.put("available", available);
        return details;
    }
}
