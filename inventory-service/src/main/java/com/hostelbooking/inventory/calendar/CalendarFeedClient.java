package com.hostelbooking.inventory.calendar;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;

import java.net.URI;

/**
 * Downloads platform calendars. The feed address is passed per call; the configured url is only a
 * placeholder target. Timeouts and redirects are set under
 * {@code spring.cloud.openfeign.client.config.calendar-feed}.
 */
@FeignClient(name = "calendar-feed", url = "${inventory.calendar.fetch-placeholder-url:https://calendar-feed.invalid}")
public interface CalendarFeedClient {

    @GetMapping
    String fetch(URI feedUrl);
}
