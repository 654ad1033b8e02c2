package com.hostelbooking.inventory.api.controller;

import com.hostelbooking.common.dto.ApiResponse;
import com.hostelbooking.inventory.domain.availability.AvailabilityQuery;
import com.hostelbooking.inventory.domain.availability.AvailabilityResult;
import com.hostelbooking.inventory.domain.availability.AvailabilityService;
import com.hostelbooking.inventory.domain.model.StayCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Availability for the checkout flow. Answers come from a short-lived cache.
 */
@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    @GetMapping
    public ResponseEntity<ApiResponse<AvailabilityResult>> checkAvailability(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkIn,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkOut,
            @RequestParam(defaultValue = "1") int beds,
            @RequestParam(required = false) StayCategory category) {
        AvailabilityResult result = availabilityService.checkAvailability(
                new AvailabilityQuery(checkIn, checkOut, beds, category));
        return ResponseEntity.ok(ApiResponse.ok(result));
    }
}
