package com.hostelbooking.inventory.events;

import com.hostelbooking.common.util.Constants;
import com.hostelbooking.inventory.calendar.ParsedStay;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.PricingSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for ledger events.
 * <p>
 * Publishing happens after the ledger write has committed and is best-effort: a broker failure is
 * logged and never undoes or fails the write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public void publishEntryConfirmed(LedgerEntry entry) {
        PricingSnapshot pricing = entry.getPricing();
        LedgerEntryConfirmedEvent event = LedgerEntryConfirmedEvent.builder()
                .entryId(entry.getId())
                .roomId(entry.getRoomId())
                .beds(entry.sortedBeds())
                .checkIn(entry.getCheckIn())
                .checkOut(entry.getCheckOut())
                .total(pricing == null ? null : pricing.getTotal())
                .paidAmount(entry.getPaidAmount())
                .paymentStatus(entry.getPaymentStatus() == null ? null : entry.getPaymentStatus().name())
                .timestamp(clock.instant())
                .build();

        publishEvent(Constants.TOPIC_ENTRY_CONFIRMED, String.valueOf(entry.getId()), event);
    }

    public void publishExternalConflict(Long feedId, String roomId, ParsedStay stay, List<Long> conflictingEntryIds) {
        ExternalBookingConflictEvent event = ExternalBookingConflictEvent.builder()
                .feedId(feedId)
                .roomId(roomId)
                .platform(stay.platform())
                .externalId(stay.externalId())
                .guestLabel(stay.guestLabel())
                .checkIn(stay.interval().checkIn())
                .checkOut(stay.interval().checkOut())
                .conflictingEntryIds(conflictingEntryIds)
                .timestamp(clock.instant())
                .build();

        publishEvent(Constants.TOPIC_EXTERNAL_CONFLICT, roomId + ":" + stay.externalId(), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.info("Event published to topic {}: offset={}",
                            topic, result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event to topic {}", topic, ex);
                }
            });
        } catch (RuntimeException e) {
            log.error("Kafka send to topic {} rejected", topic, e);
        }
    }
}
