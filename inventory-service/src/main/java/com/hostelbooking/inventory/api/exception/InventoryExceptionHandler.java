package com.hostelbooking.inventory.api.exception;

import com.hostelbooking.common.dto.ApiResponse;
import com.hostelbooking.common.exception.BusinessException;
import com.hostelbooking.inventory.domain.exception.FeedFetchException;
import com.hostelbooking.inventory.domain.exception.FeedParseException;
import com.hostelbooking.inventory.domain.exception.HoldConflictException;
import com.hostelbooking.inventory.domain.exception.HoldExpiredException;
import com.hostelbooking.inventory.domain.exception.InsufficientAvailabilityException;
import com.hostelbooking.inventory.domain.exception.InvalidHoldStateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Inventory failures that are not plain 400s. Everything else falls through to the shared handler.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class InventoryExceptionHandler {

    @ExceptionHandler({HoldConflictException.class, InsufficientAvailabilityException.class,
            InvalidHoldStateException.class})
    public ResponseEntity<ApiResponse<?>> handleConflict(BusinessException ex) {
        log.info("Inventory conflict [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(HoldExpiredException.class)
    public ResponseEntity<ApiResponse<?>> handleExpired(HoldExpiredException ex) {
        log.info("Stale hold: {}", ex.getMessage());
        return respond(HttpStatus.GONE, ex);
    }

    @ExceptionHandler(FeedParseException.class)
    public ResponseEntity<ApiResponse<?>> handleFeedParse(FeedParseException ex) {
        log.warn("Rejected calendar document: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(FeedFetchException.class)
    public ResponseEntity<ApiResponse<?>> handleFeedFetch(FeedFetchException ex) {
        log.warn("Calendar fetch failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<?>> handleConcurrentUpdate(ObjectOptimisticLockingFailureException ex) {
        log.warn("Concurrent ledger update: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.failure("Entry was changed concurrently. Reload and retry.", "CONCURRENT_MODIFICATION"));
    }

    private ResponseEntity<ApiResponse<?>> respond(HttpStatus status, BusinessException ex) {
        return ResponseEntity.status(status)
                .body(ApiResponse.failure(ex.getMessage(), ex.getErrorCode(), ex.getDetails()));
    }
}
