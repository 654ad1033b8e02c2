package com.hostelbooking.inventory.sync;

import com.hostelbooking.common.exception.ResourceNotFoundException;
import com.hostelbooking.inventory.calendar.CalendarFeedFetcher;
import com.hostelbooking.inventory.calendar.CalendarFeedParser;
import com.hostelbooking.inventory.calendar.FeedUrlValidator;
import com.hostelbooking.inventory.calendar.ParseResult;
import com.hostelbooking.inventory.calendar.ParsedStay;
import com.hostelbooking.inventory.calendar.StayStatus;
import com.hostelbooking.inventory.domain.availability.AvailabilityCacheEvictor;
import com.hostelbooking.inventory.domain.ledger.InventoryLedger;
import com.hostelbooking.inventory.domain.model.CalendarFeed;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerOrigin;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import com.hostelbooking.inventory.domain.model.Room;
import com.hostelbooking.inventory.domain.model.SyncStatus;
import com.hostelbooking.inventory.domain.repository.CalendarFeedRepository;
import com.hostelbooking.inventory.domain.room.RoomCatalog;
import com.hostelbooking.inventory.domain.strategy.RoomLockManager;
import com.hostelbooking.inventory.events.LedgerEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pulls platform calendars into the ledger.
 * <p>
 * Per feed: fetch (no lock held) then parse, then apply each stay under the room lock through the
 * {@link ConflictResolver}. A failing stay is recorded and the loop goes on; a failing feed is
 * recorded on the feed and the batch goes on. Nothing escapes {@link #syncAll()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SynchronizationService {

    private final CalendarFeedRepository feedRepository;
    private final CalendarFeedFetcher fetcher;
    private final FeedUrlValidator urlValidator;
    private final CalendarFeedParser parser;
    private final ConflictResolver conflictResolver;
    private final InventoryLedger ledger;
    private final RoomCatalog roomCatalog;
    private final RoomLockManager lockManager;
    private final AvailabilityCacheEvictor cacheEvictor;
    private final LedgerEventPublisher eventPublisher;
    private final Clock clock;

    public CalendarFeed registerFeed(String roomId, String url, String platform) {
        roomCatalog.get(roomId);
        urlValidator.validate(url);
        CalendarFeed feed = feedRepository.save(CalendarFeed.builder()
                .roomId(roomId)
                .url(url.trim())
                .platform(platform == null || platform.isBlank() ? null : platform.trim().toLowerCase(Locale.ROOT))
                .active(true)
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.info("Registered calendar feed {} for room {} ({})", feed.getId(), roomId, feed.getPlatform());
        return feed;
    }

    public BatchSyncReport syncAll() {
        return syncFeeds(feedRepository.findByActiveTrueOrderById());
    }

    public BatchSyncReport syncRoom(String roomId) {
        roomCatalog.get(roomId);
        return syncFeeds(feedRepository.findByRoomIdAndActiveTrueOrderById(roomId));
    }

    public FeedSyncReport syncFeed(Long feedId) {
        return sync(findFeed(feedId), null);
    }

    /**
     * Applies a calendar document supplied by the caller instead of fetching the feed address.
     */
    public FeedSyncReport importDocument(Long feedId, String document) {
        return sync(findFeed(feedId), document);
    }

    private BatchSyncReport syncFeeds(List<CalendarFeed> feeds) {
        List<FeedSyncReport> reports = new ArrayList<>();
        for (CalendarFeed feed : feeds) {
            reports.add(sync(feed, null));
        }
        BatchSyncReport batch = BatchSyncReport.of(reports);
        log.info("Calendar sync finished: {} feed(s), {} failed, imported={} updated={} skipped={} conflicts={}",
                batch.feedsProcessed(), batch.feedsFailed(), batch.imported(), batch.updated(),
                batch.skipped(), batch.conflicts());
        return batch;
    }

    private FeedSyncReport sync(CalendarFeed feed, String suppliedDocument) {
        Tally tally = new Tally();
        String error = null;
        SyncStatus status;
        try {
            String document = suppliedDocument;
            if (document == null) {
                URI url = urlValidator.validate(feed.getUrl());
                document = fetcher.fetch(url);
            }
            ParseResult parsed = parser.parse(document, feed.getPlatform());
            tally.skipped += parsed.skippedEvents();
            Room room = roomCatalog.get(feed.getRoomId());
            Set<String> feedIds = parsed.stays().stream().map(ParsedStay::externalId).collect(Collectors.toSet());

            for (ParsedStay stay : parsed.stays()) {
                try {
                    apply(feed, room, stay, feedIds, tally);
                } catch (RuntimeException e) {
                    log.warn("Feed {}: stay {} could not be applied", feed.getId(), stay.externalId(), e);
                    tally.skipped++;
                    tally.errors++;
                    tally.issues.add(new FeedSyncReport.SyncIssue(stay.externalId(), "ERROR", e.getMessage()));
                }
            }
            if (parsed.totalEvents() > 0) {
                removeVanished(feed, room, feedIds, tally);
            }
            status = tally.errors == 0 ? SyncStatus.SUCCESS : SyncStatus.PARTIAL;
        } catch (RuntimeException e) {
            log.warn("Calendar feed {} for room {} failed: {}", feed.getId(), feed.getRoomId(), e.getMessage());
            status = SyncStatus.FAILED;
            error = e.getMessage();
        }

        if (tally.changed) {
            cacheEvictor.evictAll();
        }
        recordSync(feed, status, error);
        log.info("Feed {} room {}: {} imported={} updated={} unchanged={} skipped={} conflicts={} blocked={} cancelled={} removed={}",
                feed.getId(), feed.getRoomId(), status, tally.imported, tally.updated, tally.unchanged,
                tally.skipped, tally.conflicts, tally.blocked, tally.cancelled, tally.removed);
        return new FeedSyncReport(feed.getId(), feed.getRoomId(), status, tally.imported, tally.updated,
                tally.unchanged, tally.skipped, tally.conflicts, tally.blocked, tally.cancelled, tally.removed,
                List.copyOf(tally.issues), error);
    }

    private void apply(CalendarFeed feed, Room room, ParsedStay stay, Set<String> feedIds, Tally tally) {
        Resolution resolution = lockManager.executeLocked(room.getId(), () -> {
            LocalDateTime now = LocalDateTime.now(clock);
            List<LedgerEntry> active = ledger.findLiveOverlapping(room.getId(), stay.interval()).stream()
                    .filter(entry -> entry.isActiveAt(now))
                    .toList();
            Resolution decided = conflictResolver.resolve(room, stay,
                    ledger.findImported(room.getId(), stay.platform(), stay.externalId()), active, feedIds);
            write(feed, room, stay, decided, now);
            return decided;
        });

        switch (resolution.action()) {
            case CREATE -> {
                tally.changed = true;
                if (stay.status() == StayStatus.BLOCKED) {
                    tally.blocked++;
                } else {
                    tally.imported++;
                }
            }
            case UPDATE -> {
                tally.changed = true;
                tally.updated++;
            }
            case UNCHANGED -> tally.unchanged++;
            case CANCEL -> {
                tally.changed = true;
                tally.cancelled++;
            }
            case SKIP -> {
                tally.skipped++;
                tally.issues.add(new FeedSyncReport.SyncIssue(stay.externalId(), "SKIPPED", resolution.reason()));
            }
            case CONFLICT -> {
                tally.conflicts++;
                tally.issues.add(new FeedSyncReport.SyncIssue(stay.externalId(), "CONFLICT", resolution.reason()));
                log.warn("External conflict: {} stay {} on room {} {} overlaps entries {} ({})",
                        stay.platform(), stay.externalId(), room.getId(), stay.interval(),
                        resolution.conflictingEntryIds(), resolution.directConflict() ? "direct booking" : "imports");
                eventPublisher.publishExternalConflict(feed.getId(), room.getId(), stay,
                        resolution.conflictingEntryIds());
            }
        }
    }

    /**
     * Writes the resolver's decision. Runs inside the room lock.
     */
    private void write(CalendarFeed feed, Room room, ParsedStay stay, Resolution resolution, LocalDateTime now) {
        boolean block = stay.status() == StayStatus.BLOCKED;
        switch (resolution.action()) {
            case CREATE -> ledger.save(LedgerEntry.builder()
                    .roomId(room.getId())
                    .beds(new HashSet<>(resolution.beds()))
                    .checkIn(stay.interval().checkIn())
                    .checkOut(stay.interval().checkOut())
                    .origin(LedgerOrigin.PLATFORM_IMPORT)
                    .status(LedgerStatus.CONFIRMED)
                    .externalPlatform(stay.platform())
                    .externalId(stay.externalId())
                    .feedId(feed.getId())
                    .guestLabel(stay.guestLabel())
                    .guestCount(block ? null : resolution.beds().size())
                    .blockReason(block ? stay.guestLabel() : null)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            case UPDATE -> {
                LedgerEntry target = resolution.target();
                target.getBeds().clear();
                target.getBeds().addAll(resolution.beds());
                target.setCheckIn(stay.interval().checkIn());
                target.setCheckOut(stay.interval().checkOut());
                target.setExternalId(stay.externalId());
                target.setFeedId(feed.getId());
                target.setGuestLabel(stay.guestLabel());
                target.setGuestCount(block ? null : resolution.beds().size());
                target.setBlockReason(block ? stay.guestLabel() : null);
                target.setUpdatedAt(now);
                ledger.save(target);
            }
            case CANCEL -> {
                LedgerEntry target = resolution.target();
                target.transitionTo(LedgerStatus.CANCELLED, now);
                ledger.save(target);
            }
            case UNCHANGED, SKIP, CONFLICT -> {
                // nothing to write
            }
        }
    }

    /**
     * Cancels future imports of this feed whose external id is no longer listed.
     */
    private void removeVanished(CalendarFeed feed, Room room, Set<String> feedIds, Tally tally) {
        LocalDate today = LocalDate.now(clock);
        List<LedgerEntry> vanished = ledger.findImportedByFeed(feed.getId(), today).stream()
                .filter(entry -> !feedIds.contains(entry.getExternalId()))
                .toList();
        for (LedgerEntry candidate : vanished) {
            try {
                boolean cancelled = lockManager.executeLocked(room.getId(), () -> {
                    LedgerEntry entry = ledger.findById(candidate.getId()).orElse(null);
                    if (entry == null || entry.getStatus() != LedgerStatus.CONFIRMED) {
                        return false;
                    }
                    entry.transitionTo(LedgerStatus.CANCELLED, LocalDateTime.now(clock));
                    ledger.save(entry);
                    return true;
                });
                if (cancelled) {
                    tally.changed = true;
                    tally.removed++;
                    log.info("Feed {}: {} stay {} no longer listed, cancelled entry {}",
                            feed.getId(), candidate.getExternalPlatform(), candidate.getExternalId(), candidate.getId());
                }
            } catch (RuntimeException e) {
                log.warn("Feed {}: could not cancel vanished entry {}", feed.getId(), candidate.getId(), e);
                tally.errors++;
            }
        }
    }

    private void recordSync(CalendarFeed feed, SyncStatus status, String error) {
        try {
            feed.recordSync(LocalDateTime.now(clock), status, error);
            feedRepository.save(feed);
        } catch (RuntimeException e) {
            log.error("Could not record sync status of feed {}", feed.getId(), e);
        }
    }

    private CalendarFeed findFeed(Long feedId) {
        return feedRepository.findById(feedId)
                .orElseThrow(() -> new ResourceNotFoundException("Calendar feed", feedId));
    }

    private static final class Tally {
        private int imported;
        private int updated;
        private int unchanged;
        private int skipped;
        private int conflicts;
        private int blocked;
        private int cancelled;
        private int removed;
        private int errors;
        private boolean changed;
        private final List<FeedSyncReport.SyncIssue> issues = new ArrayList<>();
    }
}
