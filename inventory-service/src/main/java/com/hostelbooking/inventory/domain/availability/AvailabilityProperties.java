package com.hostelbooking.inventory.domain.availability;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * @param pastGraceDays          how many days in the past a check-in may still lie
 * @param safetyBuffer           beds per room id that are never reported as free
 * @param alternativeSearchDays  how far (in days, both directions) to shift a stay looking for room
 * @param maxAlternatives        alternatives returned at most
 */
@ConfigurationProperties(prefix = "inventory.availability")
public record AvailabilityProperties(
        Integer pastGraceDays,
        Map<String, Integer> safetyBuffer,
        Integer alternativeSearchDays,
        Integer maxAlternatives
) {

    public AvailabilityProperties {
        pastGraceDays = pastGraceDays == null ? 0 : pastGraceDays;
        safetyBuffer = safetyBuffer == null ? Map.of() : Map.copyOf(safetyBuffer);
        alternativeSearchDays = alternativeSearchDays == null ? 7 : alternativeSearchDays;
        maxAlternatives = maxAlternatives == null ? 3 : maxAlternatives;
    }

    public static AvailabilityProperties defaults() {
        return new AvailabilityProperties(null, null, null, null);
    }

    public int bufferFor(String roomId) {
        return Math.max(0, safetyBuffer.getOrDefault(roomId, 0));
    }
}
