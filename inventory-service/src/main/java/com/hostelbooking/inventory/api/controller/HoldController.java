package com.hostelbooking.inventory.api.controller;

import com.hostelbooking.common.dto.ApiResponse;
import com.hostelbooking.inventory.api.dto.CreateHoldRequest;
import com.hostelbooking.inventory.api.dto.LedgerEntryResponse;
import com.hostelbooking.inventory.api.dto.PaymentResultRequest;
import com.hostelbooking.inventory.domain.hold.HoldReceipt;
import com.hostelbooking.inventory.domain.hold.HoldService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Hold lifecycle for checkout. A 409 with {@code HOLD_CONFLICT} means the beds were taken in the
 * meantime; re-run availability and offer what is left.
 */
@RestController
@RequestMapping("/api/v1/holds")
@RequiredArgsConstructor
public class HoldController {

    private final HoldService holdService;

    @PostMapping
    public ResponseEntity<ApiResponse<HoldReceipt>> createHold(@Valid @RequestBody CreateHoldRequest request) {
        HoldReceipt receipt = holdService.createHold(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Beds held", receipt));
    }

    @PostMapping("/{holdId}/confirm")
    public ResponseEntity<ApiResponse<LedgerEntryResponse>> confirmHold(@PathVariable Long holdId) {
        return ResponseEntity.ok(ApiResponse.ok("Hold confirmed",
                LedgerEntryResponse.from(holdService.confirmHold(holdId))));
    }

    @PostMapping("/{holdId}/release")
    public ResponseEntity<ApiResponse<LedgerEntryResponse>> releaseHold(@PathVariable Long holdId) {
        return ResponseEntity.ok(ApiResponse.ok("Hold released",
                LedgerEntryResponse.from(holdService.releaseHold(holdId))));
    }

    /**
     * Called by the payment collaborator once the charge has settled.
     */
    @PostMapping("/{holdId}/payment-result")
    public ResponseEntity<ApiResponse<LedgerEntryResponse>> paymentResult(
            @PathVariable Long holdId, @Valid @RequestBody PaymentResultRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(LedgerEntryResponse.from(
                holdService.applyPaymentResult(holdId, request.success(), request.paidAmount()))));
    }
}
