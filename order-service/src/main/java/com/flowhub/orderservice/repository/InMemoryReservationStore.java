package com.flowhub.orderservice.repository;

import com.flowhub.orderservice.model.Reservation;
import com.flowhub.orderservice.model.ReservationStatus;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local reservation store. Returns copies so callers cannot mutate stored state
 * without going through {@link #save(Reservation)}.
 */
@Repository
public class InMemoryReservationStore implements ReservationStore {

    private final Map<UUID, Reservation> reservations = new ConcurrentHashMap<>();

    @Override
    public Optional<Reservation> findById(UUID id) {
        return Optional.ofNullable(reservations.get(id)).map(InMemoryReservationStore::copy);
    }

    @Override
    public Reservation save(Reservation reservation) {
        if (reservation.getId() == null) {
            throw new IllegalArgumentException("Reservation ID must be set before saving");
        }
        reservations.put(reservation.getId(), copy(reservation));
        return reservation;
    }

    @Override
    public Optional<Reservation> findActiveByOrderId(UUID orderId) {
        return reservations.values().stream()
                .filter(reservation -> orderId.equals(reservation.getOrderId()))
                .filter(Reservation::isActive)
                .findFirst()
                .map(InMemoryReservationStore::copy);
    }

    @Override
    public List<Reservation> findPendingExpiredAt(Instant now) {
        return reservations.values().stream()
                .filter(reservation -> reservation.isExpiredAt(now))
                .sorted(Comparator.comparing(Reservation::getExpiresAt))
                .map(InMemoryReservationStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<Reservation> findByStatus(ReservationStatus status) {
        return reservations.values().stream()
                .filter(reservation -> reservation.getStatus() == status)
                .sorted(Comparator.comparing(Reservation::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(InMemoryReservationStore::copy)
                .collect(Collectors.toList());
    }

    private static Reservation copy(Reservation reservation) {
        return reservation.toBuilder()
                .items(reservation.getItems() == null ? null : new ArrayList<>(reservation.getItems()))
                .build();
    }
}
