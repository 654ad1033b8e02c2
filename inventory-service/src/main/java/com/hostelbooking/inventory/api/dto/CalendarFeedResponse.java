package com.hostelbooking.inventory.api.dto;

import com.hostelbooking.inventory.domain.model.CalendarFeed;

import java.time.LocalDateTime;

public record CalendarFeedResponse(
        Long id,
        String roomId,
        String url,
        String platform,
        boolean active,
        LocalDateTime lastSyncAt,
        String lastSyncStatus,
        String lastSyncError
) {

    public static CalendarFeedResponse from(CalendarFeed feed) {
        return new CalendarFeedResponse(
                feed.getId(),
                feed.getRoomId(),
                feed.getUrl(),
                feed.getPlatform(),
                feed.isActive(),
                feed.getLastSyncAt(),
                feed.getLastSyncStatus().name(),
                feed.getLastSyncError());
    }
}
