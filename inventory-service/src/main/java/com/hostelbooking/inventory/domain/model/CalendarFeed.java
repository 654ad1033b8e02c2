package com.hostelbooking.inventory.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * An external platform calendar imported into one room.
 */
@Entity
@Table(name = "calendar_feeds", indexes = {
        @Index(name = "idx_calendar_feeds_room", columnList = "room_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarFeed {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false, length = 64)
    private String roomId;

    @Column(name = "url", nullable = false, length = 2048)
    private String url;

    /** Known platform; null means infer it from the feed contents. */
    @Column(name = "platform", length = 40)
    private String platform;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "last_sync_at")
    private LocalDateTime lastSyncAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_sync_status", nullable = false, length = 20)
    @Builder.Default
    private SyncStatus lastSyncStatus = SyncStatus.NEVER;

    @Column(name = "last_sync_error", length = 1000)
    private String lastSyncError;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public void recordSync(LocalDateTime at, SyncStatus status, String error) {
        this.lastSyncAt = at;
        this.lastSyncStatus = status;
        this.lastSyncError = error == null || error.length() <= 1000 ? error : error.substring(0, 1000);
    }
}
