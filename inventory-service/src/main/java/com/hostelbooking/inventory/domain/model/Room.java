package com.hostelbooking.inventory.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Dormitory reference data. Seeded by migration and read-only at runtime.
 * Beds are the slots {@code 1..capacity}; they have no row of their own.
 */
@Entity
@Table(name = "rooms")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Room {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "capacity", nullable = false)
    private Integer capacity;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private RoomCategory category;

    @Column(name = "base_price_per_bed", nullable = false, precision = 10, scale = 2)
    private BigDecimal basePricePerBed;

    /** Swing rooms only: hours before a stay date at which the room may open to mixed parties. */
    @Column(name = "conversion_lead_hours")
    private Integer conversionLeadHours;

    public boolean hasBed(int bedIndex) {
        return bedIndex >= 1 && bedIndex <= capacity;
    }

    public boolean isSwing() {
        return category == RoomCategory.SWING;
    }
}
