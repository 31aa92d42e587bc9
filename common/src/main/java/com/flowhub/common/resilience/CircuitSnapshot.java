package com.flowhub.common.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CircuitSnapshot {
    String target;
    CircuitBreaker.State state;
    int consecutiveFailures;
    Instant lastFailureAt;
    long notPermittedCalls;

    public boolean isClosed() {
        return state == CircuitBreaker.State.CLOSED;
    }
}
