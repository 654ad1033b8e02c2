package com.hostelbooking.inventory.domain.exception;

import com.hostelbooking.common.exception.BusinessException;

/**
 * Feed address is not plain HTTP(S) or points into a private network.
 */
public class UnsafeFeedUrlException extends BusinessException {
    public UnsafeFeedUrlException(String url, String reason) {
        super(String.format("Refusing feed URL %s: %s", url, reason), "UNSAFE_FEED_URL");
    }
}
