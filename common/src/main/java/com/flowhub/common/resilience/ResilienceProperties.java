package com.flowhub.common.resilience;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Circuit breaker and retry settings for outbound calls, bound from {@code flowhub.resilience.*}.
 * The same settings apply to every target; each target still gets its own circuit.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "flowhub.resilience")
public class ResilienceProperties {

    // Consecutive transient failures that open a circuit
    @Min(1)
    private int failureThreshold = 5;

    @NotNull
    private Duration coolDown = Duration.ofSeconds(60);

    // Total attempts per call, first one included
    @Min(1)
    private int maxAttempts = 3;

    @NotNull
    private Duration backoffBase = Duration.ofSeconds(1);

    @NotNull
    private Duration backoffMax = Duration.ofSeconds(10);

    private boolean jitter = true;

    // Used by the HTTP client factory, not by the wrapper
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(2);

    @NotNull
    private Duration callTimeout = Duration.ofSeconds(5);
}
