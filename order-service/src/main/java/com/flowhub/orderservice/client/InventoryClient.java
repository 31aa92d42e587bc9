package com.flowhub.orderservice.client;

import com.flowhub.common.dto.ReservationAck;
import com.flowhub.common.dto.ReserveStockRequest;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Stock holds at vendor locations. Every call is idempotent on the reservation id.
 * A definitive refusal surfaces as {@link com.flowhub.common.exception.StockRejectedException}.
 */
public interface InventoryClient {

    Mono<ReservationAck> reserve(ReserveStockRequest request);

    /**
     * Releasing an unknown or already released reservation succeeds.
     */
    Mono<ReservationAck> release(UUID reservationId);

    Mono<ReservationAck> confirm(UUID reservationId);
}
