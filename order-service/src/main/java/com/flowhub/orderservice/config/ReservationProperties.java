package com.flowhub.orderservice.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "flowhub.reservation")
public class ReservationProperties {

    // How long a pending hold lives before the expiry sweep releases it
    @NotNull
    private Duration ttl = Duration.ofHours(24);

    @NotNull
    private Duration sweepInterval = Duration.ofMinutes(1);

    @NotBlank
    private String inventoryUrl = "http://localhost:8082";

    @NotBlank
    private String catalogUrl = "http://localhost:8083";

    @Min(1)
    private int allocationThreads = 8;

    // Upper bound for a whole allocation request, after which the caller gets 409 and the work is cancelled
    @NotNull
    private Duration allocationTimeout = Duration.ofSeconds(60);
}
