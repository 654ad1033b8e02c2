package com.hostelbooking.inventory.calendar;

import java.util.List;

/**
 * @param skippedEvents events dropped because their dates were missing or invalid
 */
public record ParseResult(List<ParsedStay> stays, int totalEvents, int skippedEvents, int blockedEvents) {
}
