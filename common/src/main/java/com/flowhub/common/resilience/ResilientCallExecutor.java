package com.flowhub.common.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Wraps outbound calls with a per-target circuit breaker, bounded retries and a call timeout.
 * <p>
 * Pipeline per call: timeout, then circuit breaker, then retry around both, so every attempt is
 * recorded by the circuit. Only transient failures (see {@link TransientFailureClassifier}) are
 * retried and counted; business errors pass through untouched and leave the circuit alone.
 * <p>
 * Outcomes seen by callers:
 * <ul>
 *     <li>the operation's value;</li>
 *     <li>{@link CircuitOpenException} when the circuit refused the call;</li>
 *     <li>{@link ExhaustedRetriesException} when all attempts failed transiently;</li>
 *     <li>any non-transient error of the operation, unchanged.</li>
 * </ul>
 */
@Slf4j
public class ResilientCallExecutor {

    private final ResilienceProperties properties;
    private final TransientFailureClassifier classifier;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final Clock clock;
    private final Map<String, TargetStats> stats = new ConcurrentHashMap<>();

    public ResilientCallExecutor(ResilienceProperties properties, TransientFailureClassifier classifier) {
        this(properties, classifier, Clock.systemUTC());
    }

    public ResilientCallExecutor(ResilienceProperties properties, TransientFailureClassifier classifier, Clock clock) {
        this.properties = properties;
        this.classifier = classifier;
        this.clock = clock;
        this.circuitBreakerRegistry = CircuitBreakerRegistry.of(circuitBreakerConfig());
        this.retryRegistry = RetryRegistry.of(retryConfig());
    }

    public <T> Mono<T> execute(String target, Mono<T> operation) {
        CircuitBreaker circuitBreaker = circuitBreaker(target);
        Retry retry = retryRegistry.retry(target);

        return operation
                .timeout(properties.getCallTimeout())
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .transformDeferred(RetryOperator.of(retry))
                .onErrorMap(error -> translate(target, error));
    }

    /**
     * False while the target's circuit is open. Does not consume the half-open trial.
     */
    public boolean isCallPermitted(String target) {
        CircuitBreaker.State state = circuitBreaker(target).getState();
        return state != CircuitBreaker.State.OPEN && state != CircuitBreaker.State.FORCED_OPEN;
    }

    public CircuitSnapshot snapshot(String target) {
        CircuitBreaker circuitBreaker = circuitBreaker(target);
        TargetStats targetStats = stats.get(target);
        return CircuitSnapshot.builder()
                .target(target)
                .state(circuitBreaker.getState())
                .consecutiveFailures(targetStats.consecutiveFailures.get())
                .lastFailureAt(targetStats.lastFailureAt.get())
                .notPermittedCalls(targetStats.notPermittedCalls.get())
                .build();
    }

    /**
     * Snapshots of every target called so far, ordered by target name.
     */
    public List<CircuitSnapshot> snapshots() {
        return circuitBreakerRegistry.getAllCircuitBreakers().stream()
                .map(CircuitBreaker::getName)
                .sorted(Comparator.naturalOrder())
                .map(this::snapshot)
                .collect(Collectors.toList());
    }

    private CircuitBreaker circuitBreaker(String target) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(target);
        stats.computeIfAbsent(target, name -> register(circuitBreaker));
        return circuitBreaker;
    }

    private TargetStats register(CircuitBreaker circuitBreaker) {
        TargetStats targetStats = new TargetStats();
        String target = circuitBreaker.getName();
        circuitBreaker.getEventPublisher()
                .onError(event -> {
                    targetStats.consecutiveFailures.incrementAndGet();
                    targetStats.lastFailureAt.set(Instant.now(clock));
                })
                .onSuccess(event -> targetStats.consecutiveFailures.set(0))
                .onCallNotPermitted(event -> targetStats.notPermittedCalls.incrementAndGet())
                .onStateTransition(event -> {
                    switch (event.getStateTransition().getToState()) {
                        case OPEN -> log.warn("Circuit opened. target={}, consecutiveFailures={}",
                                target, targetStats.consecutiveFailures.get());
                        case HALF_OPEN -> log.info("Circuit half-open, allowing one trial call. target={}", target);
                        case CLOSED -> log.info("Circuit closed. target={}", target);
                        default -> log.info("Circuit state changed. target={}, transition={}",
                                target, event.getStateTransition());
                    }
                });
        return targetStats;
    }

    private Throwable translate(String target, Throwable error) {
        if (error instanceof CallNotPermittedException) {
            return new CircuitOpenException(target, error);
        }
        if (classifier.isTransient(error)) {
            return new ExhaustedRetriesException(target, properties.getMaxAttempts(), error);
        }
        return error;
    }

    private CircuitBreakerConfig circuitBreakerConfig() {
        int threshold = properties.getFailureThreshold();
        // A full window of failures with a 100% threshold means N consecutive failures
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(properties.getCoolDown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordException(classifier)
                .build();
    }

    private RetryConfig retryConfig() {
        long base = properties.getBackoffBase().toMillis();
        long max = properties.getBackoffMax().toMillis();
        IntervalFunction backoff = properties.isJitter()
                ? IntervalFunction.ofExponentialRandomBackoff(base, 2.0, 0.25, max)
                : IntervalFunction.ofExponentialBackoff(base, 2.0, max);
        return RetryConfig.custom()
                .maxAttempts(properties.getMaxAttempts())
                .intervalFunction(backoff)
                .retryOnException(classifier)
                .build();
    }

    private static final class TargetStats {
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        private final AtomicReference<Instant> lastFailureAt = new AtomicReference<>();
        private final AtomicLong notPermittedCalls = new AtomicLong();
    }
}
