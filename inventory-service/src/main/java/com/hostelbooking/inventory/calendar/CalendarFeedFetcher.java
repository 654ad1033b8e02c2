package com.hostelbooking.inventory.calendar;

import com.hostelbooking.inventory.domain.exception.FeedFetchException;
import feign.FeignException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;

/**
 * Fetches a validated feed address. Never called while a room lock is held.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalendarFeedFetcher {

    private final CalendarFeedClient client;

    @Retry(name = "calendar-feed")
    public String fetch(URI feedUrl) {
        log.debug("Fetching calendar feed {}", feedUrl);
        String body;
        try {
            body = client.fetch(feedUrl);
        } catch (FeignException e) {
            throw new FeedFetchException(
                    String.format("Fetching %s failed with HTTP %d", feedUrl, e.status()), e);
        }
        if (body == null || body.isBlank()) {
            throw new FeedFetchException("Feed " + feedUrl + " returned an empty body");
        }
        return body;
    }
}
