package com.flowhub.orderservice.controller;

import com.flowhub.orderservice.health.HealthAggregator;
import com.flowhub.orderservice.health.HealthReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final HealthAggregator healthAggregator;

    // DEGRADED is a warning, not an outage, so it is still served with 200
    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        return ResponseEntity.ok(healthAggregator.report());
    }
}
