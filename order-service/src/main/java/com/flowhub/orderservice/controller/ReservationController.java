package com.flowhub.orderservice.controller;

import com.flowhub.orderservice.dto.ExpirySweepResponse;
import com.flowhub.orderservice.dto.ReservationResponse;
import com.flowhub.orderservice.service.ReservationCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final ReservationCoordinator reservationCoordinator;

    @GetMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> getReservation(@PathVariable UUID reservationId) {
        ReservationResponse response = reservationCoordinator.getReservation(reservationId);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{reservationId}/confirm")
    public ResponseEntity<ReservationResponse> confirmReservation(@PathVariable UUID reservationId) {
        ReservationResponse response = reservationCoordinator.confirm(reservationId);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{reservationId}/release")
    public ResponseEntity<ReservationResponse> releaseReservation(@PathVariable UUID reservationId) {
        ReservationResponse response = reservationCoordinator.release(reservationId);
        return ResponseEntity.ok(response);
    }

    /**
     * Runs an expiry sweep now instead of waiting for the scheduled one.
     */
    @PostMapping("/expire")
    public ResponseEntity<ExpirySweepResponse> expireStale() {
        int expired = reservationCoordinator.expireStale();
        return ResponseEntity.ok(new ExpirySweepResponse(expired));
    }
}
