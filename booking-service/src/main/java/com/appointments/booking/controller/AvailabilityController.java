package com.appointments.booking.controller;

import com.appointments.booking.dto.AvailabilityResponse;
import com.appointments.booking.service.AvailabilityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Slf4j
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    @GetMapping("/api/availability")
    public ResponseEntity<AvailabilityResponse> availability() {
        log.debug("GET /api/availability");
        return ResponseEntity.ok(availabilityService.getAvailability());
    }
}
