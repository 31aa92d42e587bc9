package com.flowhub.orderservice.service;

import com.flowhub.orderservice.dto.ReservationResponse;
import com.flowhub.orderservice.model.FulfillmentOrder;

import java.util.Optional;
import java.util.UUID;

public interface ReservationCoordinator {

    /**
     * Places a stock hold for the order at the best ranked vendor location that accepts it.
     * Candidates are tried one by one in rank order. If the order already holds an active
     * reservation it is returned unchanged.
     * Publishes order.reserved on success, order.allocation_failed when every candidate refused.
     * A trial that may have left a hold at inventory is recorded as COMPENSATING until released.
     */
    ReservationResponse allocate(FulfillmentOrder order, CancellationSignal signal);

    /**
     * Releases the hold at the inventory service and marks the reservation RELEASED.
     * Releasing a reservation that is no longer active is a no-op.
     * Transition: PENDING | CONFIRMED -> RELEASED
     */
    ReservationResponse release(UUID reservationId);

    /**
     * Turns the hold into a committed allocation.
     * Transition: PENDING -> CONFIRMED
     */
    ReservationResponse confirm(UUID reservationId);

    /**
     * Releases every PENDING reservation whose expiry has passed and marks it EXPIRED.
     * Reservations the inventory service could not release stay PENDING for the next sweep.
     * Also retries the release of COMPENSATING holds left by failed trials and marks them RELEASED.
     *
     * @return number of reservations expired by this sweep
     */
    int expireStale();

    ReservationResponse getReservation(UUID reservationId);

    /**
     * The PENDING or CONFIRMED reservation held for an order (used by event subscribers).
     */
    Optional<ReservationResponse> findActiveForOrder(UUID orderId);
}
