package com.hostelbooking.inventory.domain.hold;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically moves overdue holds to EXPIRED. Availability already ignores them, so the sweep
 * only settles their status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HoldExpiryJob {

    private final HoldService holdService;

    @Scheduled(fixedDelayString = "${inventory.hold.expiry-job-interval-ms:60000}")
    public void run() {
        try {
            int expired = holdService.expireOverdueHolds();
            if (expired > 0) {
                log.info("Hold expiry sweep expired {} hold(s)", expired);
            }
        } catch (RuntimeException e) {
            log.error("Hold expiry sweep failed", e);
        }
    }
}
