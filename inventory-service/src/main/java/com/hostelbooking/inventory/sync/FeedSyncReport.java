package com.hostelbooking.inventory.sync;

import com.hostelbooking.inventory.domain.model.SyncStatus;

import java.util.List;

/**
 * Outcome of one feed. {@code removed} counts imports that disappeared from the feed and were cancelled.
 */
public record FeedSyncReport(
        Long feedId,
        String roomId,
        SyncStatus status,
        int imported,
        int updated,
        int unchanged,
        int skipped,
        int conflicts,
        int blocked,
        int cancelled,
        int removed,
        List<SyncIssue> issues,
        String error
) {

    /**
     * A stay that was not applied, and why.
     */
    public record SyncIssue(String externalId, String outcome, String message) {
    }
}
