package com.hostelbooking.inventory.domain.model;

import com.hostelbooking.inventory.domain.exception.InvalidHoldStateException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One claim on a set of beds of a room for a stay interval.
 * Entries are never deleted; terminal statuses stay in the table for audit.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
        @Index(name = "idx_ledger_room_dates", columnList = "room_id, check_in, check_out"),
        @Index(name = "idx_ledger_status_expires", columnList = "status, expires_at"),
        @Index(name = "idx_ledger_external", columnList = "external_platform, external_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false, length = 64)
    private String roomId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ledger_entry_beds", joinColumns = @JoinColumn(name = "entry_id"))
    @Column(name = "bed_index", nullable = false)
    @Builder.Default
    private Set<Integer> beds = new HashSet<>();

    @Column(name = "check_in", nullable = false)
    private LocalDate checkIn;

    @Column(name = "check_out", nullable = false)
    private LocalDate checkOut;

    @Enumerated(EnumType.STRING)
    @Column(name = "origin", nullable = false, length = 20)
    private LedgerOrigin origin;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private LedgerStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "stay_category", nullable = false, length = 20)
    @Builder.Default
    private StayCategory stayCategory = StayCategory.MIXED;

    @Column(name = "external_platform", length = 40)
    private String externalPlatform;

    @Column(name = "external_id", length = 255)
    private String externalId;

    @Column(name = "feed_id")
    private Long feedId;

    @Column(name = "guest_label", length = 255)
    private String guestLabel;

    @Column(name = "guest_count")
    private Integer guestCount;

    @Column(name = "block_reason", length = 255)
    private String blockReason;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Embedded
    private PricingSnapshot pricing;

    @Column(name = "paid_amount", precision = 12, scale = 2)
    private BigDecimal paidAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", length = 20)
    private PaymentStatus paymentStatus;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public StayInterval interval() {
        return new StayInterval(checkIn, checkOut);
    }

    public List<Integer> sortedBeds() {
        return beds.stream().sorted().toList();
    }

    /**
     * An entry occupies its beds while CONFIRMED, or while HOLD and not yet past its expiry.
     * Expired holds stop counting immediately, before the sweep marks them.
     */
    public boolean isActiveAt(LocalDateTime now) {
        if (status == LedgerStatus.CONFIRMED) {
            return true;
        }
        return status == LedgerStatus.HOLD && expiresAt != null && expiresAt.isAfter(now);
    }

    public boolean isHoldExpiredAt(LocalDateTime now) {
        return status == LedgerStatus.HOLD && expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isDirect() {
        return origin.isDirect();
    }

    public boolean isBlock() {
        return blockReason != null;
    }

    public boolean matchesExternal(String platform, String externalBookingId) {
        return origin == LedgerOrigin.PLATFORM_IMPORT
                && Objects.equals(externalPlatform, platform)
                && Objects.equals(externalId, externalBookingId);
    }

    /**
     * Moves the entry along the lifecycle. Backward or sideways moves are refused.
     */
    public void transitionTo(LedgerStatus target, LocalDateTime now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidHoldStateException(id, status, target);
        }
        this.status = target;
        this.updatedAt = now;
    }
}
