package com.hostelbooking.inventory.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pulls every active feed on a fixed delay.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "inventory.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CalendarSyncJob {

    private final SynchronizationService synchronizationService;

    @Scheduled(fixedDelayString = "${inventory.sync.interval-ms:900000}",
            initialDelayString = "${inventory.sync.initial-delay-ms:60000}")
    public void run() {
        try {
            BatchSyncReport report = synchronizationService.syncAll();
            if (report.conflicts() > 0) {
                log.warn("Scheduled calendar sync reported {} external conflict(s)", report.conflicts());
            }
        } catch (RuntimeException e) {
            log.error("Scheduled calendar sync failed", e);
        }
    }
}
