package com.hostelbooking.inventory.api.controller;

import com.hostelbooking.common.dto.ApiResponse;
import com.hostelbooking.inventory.api.dto.PricingQuoteRequest;
import com.hostelbooking.inventory.domain.model.StayInterval;
import com.hostelbooking.inventory.domain.room.RoomCatalog;
import com.hostelbooking.inventory.pricing.PriceBreakdown;
import com.hostelbooking.inventory.pricing.PricingEngine;
import com.hostelbooking.inventory.pricing.RoomBeds;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/pricing")
@RequiredArgsConstructor
public class PricingController {

    private final PricingEngine pricingEngine;
    private final RoomCatalog roomCatalog;

    @PostMapping("/quote")
    public ResponseEntity<ApiResponse<PriceBreakdown>> quote(@Valid @RequestBody PricingQuoteRequest request) {
        List<RoomBeds> selection = request.rooms().stream()
                .map(room -> new RoomBeds(roomCatalog.get(room.roomId()), room.bedsRequested()))
                .toList();
        PriceBreakdown breakdown = pricingEngine.quote(StayInterval.of(request.checkIn(), request.checkOut()), selection);
        return ResponseEntity.ok(ApiResponse.ok(breakdown));
    }
}
