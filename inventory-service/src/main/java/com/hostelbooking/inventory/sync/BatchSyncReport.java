package com.hostelbooking.inventory.sync;

import com.hostelbooking.inventory.domain.model.SyncStatus;

import java.util.List;

public record BatchSyncReport(
        int feedsProcessed,
        int feedsFailed,
        int imported,
        int updated,
        int skipped,
        int conflicts,
        int blocked,
        List<FeedSyncReport> feeds
) {

    public static BatchSyncReport of(List<FeedSyncReport> feeds) {
        return new BatchSyncReport(
                feeds.size(),
                (int) feeds.stream().filter(feed -> feed.status() == SyncStatus.FAILED).count(),
                feeds.stream().mapToInt(FeedSyncReport::imported).sum(),
                feeds.stream().mapToInt(FeedSyncReport::updated).sum(),
                feeds.stream().mapToInt(FeedSyncReport::skipped).sum(),
                feeds.stream().mapToInt(FeedSyncReport::conflicts).sum(),
                feeds.stream().mapToInt(FeedSyncReport::blocked).sum(),
                List.copyOf(feeds));
    }
}
