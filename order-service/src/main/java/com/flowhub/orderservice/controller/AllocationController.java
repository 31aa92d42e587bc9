package com.flowhub.orderservice.controller;

import com.flowhub.orderservice.config.ReservationProperties;
import com.flowhub.orderservice.dto.AllocationRequest;
import com.flowhub.orderservice.dto.ReservationResponse;
import com.flowhub.orderservice.exception.AllocationCancelledException;
import com.flowhub.orderservice.mapper.ReservationMapper;
import com.flowhub.orderservice.model.FulfillmentOrder;
import com.flowhub.orderservice.service.CancellationSignal;
import com.flowhub.orderservice.service.ReservationCoordinator;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Allocation runs on the bounded allocation pool, the servlet thread is released right away.
 * When the request outlives the allocation timeout the work is told to stop.
 */
@RestController
@RequestMapping("/api/v1/allocations")
@Slf4j
public class AllocationController {

    private final ReservationCoordinator reservationCoordinator;
    private final ReservationMapper reservationMapper;
    private final Executor allocationExecutor;
    private final ReservationProperties properties;

    public AllocationController(ReservationCoordinator reservationCoordinator,
                                ReservationMapper reservationMapper,
                                @Qualifier("allocationExecutor") Executor allocationExecutor,
                                ReservationProperties properties) {
        this.reservationCoordinator = reservationCoordinator;
        this.reservationMapper = reservationMapper;
        this.allocationExecutor = allocationExecutor;
        this.properties = properties;
    }

    @PostMapping
    public CompletableFuture<ResponseEntity<ReservationResponse>> allocate(
            @Valid @RequestBody AllocationRequest request) {
        FulfillmentOrder order = reservationMapper.toFulfillmentOrder(request);
        CancellationSignal signal = new CancellationSignal();

        return CompletableFuture
                .supplyAsync(() -> reservationCoordinator.allocate(order, signal), allocationExecutor)
                .orTimeout(properties.getAllocationTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error == null) {
                        return ResponseEntity.status(HttpStatus.CREATED).body(response);
                    }
                    signal.cancel();
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    if (cause instanceof TimeoutException) {
                        log.warn("Allocation timed out, cancelling. orderId={}, timeout={}",
                                order.getOrderId(), properties.getAllocationTimeout());
                        throw new AllocationCancelledException(
                                "Allocation timed out for order " + order.getOrderId());
                    }
                    if (cause instanceof RuntimeException runtimeException) {
                        throw runtimeException;
                    }
                    throw new CompletionException(cause);
                });
    }
}
