package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.BusinessException;

import java.util.Map;

public class MinimumStayException extends BusinessException {
    private final String season;
    private final int minimumNights;
    private final int requestedNights;

    public MinimumStayException(String season, int minimumNights, int requestedNights) {
        super(String.format("%s requires a minimum stay of %d nights, %d requested",
                season, minimumNights, requestedNights), "MINIMUM_NIGHTS_NOT_MET");
        this.season = season;
        this.minimumNights = minimumNights;
        this.requestedNights = requestedNights;
    }

    public int getMinimumNights() {
        return minimumNights;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("season", season, "minimumNights", minimumNights, "requestedNights", requestedNights);
    }
}
