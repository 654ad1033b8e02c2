package com.hostelbooking.inventory.calendar;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param maxDescriptionLength characters of an imported event description that are kept
 * @param exportPastDays       how many days back the export still lists finished stays
 */
@ConfigurationProperties(prefix = "inventory.calendar")
public record CalendarProperties(
        Integer maxDescriptionLength,
        String productId,
        String calendarName,
        String uidDomain,
        Integer exportPastDays
) {

    public CalendarProperties {
        maxDescriptionLength = maxDescriptionLength == null ? 1000 : maxDescriptionLength;
        productId = productId == null ? "-//Hostel Booking//Inventory Service//EN" : productId;
        calendarName = calendarName == null ? "Hostel Booking" : calendarName;
        uidDomain = uidDomain == null ? "hostelbooking.local" : uidDomain;
        exportPastDays = exportPastDays == null ? 30 : exportPastDays;
    }

    public static CalendarProperties defaults() {
        return new CalendarProperties(null, null, null, null, null);
    }
}
