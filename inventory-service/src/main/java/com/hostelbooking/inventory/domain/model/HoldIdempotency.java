package com.hostelbooking.inventory.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Stored receipt for an idempotency key. Rows are insert-only: saving a key that already exists
 * fails on the primary key instead of merging over the first receipt.
 */
@Entity
@Table(name = "hold_idempotency")
@Getter
@Setter
@NoArgsConstructor
public class HoldIdempotency implements Persistable<String> {

    @Id
    @Column(name = "idempotency_key", length = 255)
    private String idempotencyKey;

    @Column(name = "response_json", nullable = false, columnDefinition = "TEXT")
    private String responseJson;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean fresh = true;

    public HoldIdempotency(String idempotencyKey, String responseJson, LocalDateTime createdAt) {
        this.idempotencyKey = idempotencyKey;
        this.responseJson = responseJson;
        this.createdAt = createdAt;
    }

    @Override
    public String getId() {
        return idempotencyKey;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        this.fresh = false;
    }
}
