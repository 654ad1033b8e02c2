package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.BusinessException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requested beds were taken between the availability read and the commit.
 * Callers are expected to re-run availability and offer the remaining beds.
 */
public class HoldConflictException extends BusinessException {
    private final String roomId;
    private final List<Integer> conflictingBeds;

    public HoldConflictException(String roomId, Collection<Integer> conflictingBeds) {
        super(String.format("Bed(s) %s in room %s are no longer free", conflictingBeds, roomId), "HOLD_CONFLICT");
        this.roomId = roomId;
        this.conflictingBeds = conflictingBeds.stream().sorted().toList();
    }

    public List<Integer> getConflictingBeds() {
        return conflictingBeds;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("roomId", roomId);
        details.put("conflictingBeds", conflictingBeds);
        return details;
    }
}
