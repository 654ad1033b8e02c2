package com.hostelbooking.inventory.api.controller;

import com.hostelbooking.common.dto.ApiResponse;
import com.hostelbooking.inventory.api.dto.CalendarFeedResponse;
import com.hostelbooking.inventory.api.dto.RegisterFeedRequest;
import com.hostelbooking.inventory.calendar.CalendarFeedExporter;
import com.hostelbooking.inventory.sync.BatchSyncReport;
import com.hostelbooking.inventory.sync.FeedSyncReport;
import com.hostelbooking.inventory.sync.SynchronizationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * Calendar exchange with the booking platforms: export per room, feed registration and sync.
 */
@RestController
@RequestMapping("/api/v1/calendar")
@RequiredArgsConstructor
public class CalendarController {

    private static final MediaType TEXT_CALENDAR = new MediaType("text", "calendar", StandardCharsets.UTF_8);

    private final CalendarFeedExporter exporter;
    private final SynchronizationService synchronizationService;

    @GetMapping("/rooms/{roomId}.ics")
    public ResponseEntity<String> exportRoom(@PathVariable String roomId) {
        return ResponseEntity.ok()
                .contentType(TEXT_CALENDAR)
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + roomId + ".ics\"")
                .body(exporter.exportRoom(roomId));
    }

    @PostMapping("/feeds")
    public ResponseEntity<ApiResponse<CalendarFeedResponse>> registerFeed(@Valid @RequestBody RegisterFeedRequest request) {
        CalendarFeedResponse feed = CalendarFeedResponse.from(
                synchronizationService.registerFeed(request.roomId(), request.url(), request.platform()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Feed registered", feed));
    }

    /**
     * Syncs every active feed, or only those of one room.
     */
    @PostMapping("/feeds/sync")
    public ResponseEntity<ApiResponse<BatchSyncReport>> syncFeeds(@RequestParam(required = false) String roomId) {
        BatchSyncReport report = roomId == null
                ? synchronizationService.syncAll()
                : synchronizationService.syncRoom(roomId);
        return ResponseEntity.ok(ApiResponse.ok(report));
    }

    @PostMapping("/feeds/{feedId}/sync")
    public ResponseEntity<ApiResponse<FeedSyncReport>> syncFeed(@PathVariable Long feedId) {
        return ResponseEntity.ok(ApiResponse.ok(synchronizationService.syncFeed(feedId)));
    }

    /**
     * Imports a calendar document posted as the request body, for platforms that cannot be polled.
     */
    @PostMapping(value = "/feeds/{feedId}/import", consumes = {"text/calendar", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<ApiResponse<FeedSyncReport>> importDocument(
            @PathVariable Long feedId, @RequestBody String document) {
        return ResponseEntity.ok(ApiResponse.ok(synchronizationService.importDocument(feedId, document)));
    }
}
