package com.hostelbooking.inventory.api.controller;

import com.hostelbooking.common.dto.ApiResponse;
import com.hostelbooking.inventory.api.dto.BlockDatesRequest;
import com.hostelbooking.inventory.api.dto.LedgerEntryResponse;
import com.hostelbooking.inventory.domain.block.DateBlockService;
import com.hostelbooking.inventory.domain.ledger.LedgerCancellationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Staff operations on confirmed entries: cancellation and date blocks.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerCancellationService cancellationService;
    private final DateBlockService dateBlockService;

    @GetMapping("/ledger/{entryId}")
    public ResponseEntity<ApiResponse<LedgerEntryResponse>> getEntry(@PathVariable Long entryId) {
        return ResponseEntity.ok(ApiResponse.ok(LedgerEntryResponse.from(cancellationService.findEntry(entryId))));
    }

    @PostMapping("/ledger/{entryId}/cancel")
    public ResponseEntity<ApiResponse<LedgerEntryResponse>> cancelEntry(@PathVariable Long entryId) {
        return ResponseEntity.ok(ApiResponse.ok("Entry cancelled",
                LedgerEntryResponse.from(cancellationService.cancelEntry(entryId))));
    }

    @PostMapping("/rooms/{roomId}/blocks")
    public ResponseEntity<ApiResponse<LedgerEntryResponse>> blockDates(
            @PathVariable String roomId, @Valid @RequestBody BlockDatesRequest request) {
        LedgerEntryResponse block = LedgerEntryResponse.from(dateBlockService.blockDates(
                roomId, request.checkIn(), request.checkOut(), request.bedIndices(), request.reason()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Dates blocked", block));
    }

    @DeleteMapping("/blocks/{blockId}")
    public ResponseEntity<ApiResponse<LedgerEntryResponse>> unblock(@PathVariable Long blockId) {
        return ResponseEntity.ok(ApiResponse.ok("Block removed",
                LedgerEntryResponse.from(dateBlockService.unblock(blockId))));
    }
}
