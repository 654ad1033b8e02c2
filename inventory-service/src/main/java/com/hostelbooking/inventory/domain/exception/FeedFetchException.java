package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.BusinessException;

public class FeedFetchException extends BusinessException {
    public FeedFetchException(String message) {
        super(message, "FEED_FETCH_ERROR");
    }

    public FeedFetchException(String message, Throwable cause) {
        super(message, cause, "FEED_FETCH_ERROR");
    }
}
