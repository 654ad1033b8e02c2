package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.BusinessException;

public class FeedParseException extends BusinessException {
    public FeedParseException(String message) {
        super(message, "FEED_PARSE_ERROR");
    }
}
