package com.flowhub.orderservice.repository;

import com.flowhub.orderservice.model.Reservation;
import com.flowhub.orderservice.model.ReservationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReservationStore {

    Optional<Reservation> findById(UUID id);

    Reservation save(Reservation reservation);

    /**
     * The PENDING or CONFIRMED reservation of an order, if any. There is at most one.
     */
    Optional<Reservation> findActiveByOrderId(UUID orderId);

    List<Reservation> findPendingExpiredAt(Instant now);

    List<Reservation> findByStatus(ReservationStatus status);
}
