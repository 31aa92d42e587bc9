package com.flowhub.orderservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {

    private UUID id;
    private UUID orderId;
    private String vendorId;
    private String locationId;
    private List<OrderLine> items;
    private ReservationStatus status;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant updatedAt;

    public boolean isActive() {
        return status == ReservationStatus.PENDING || status == ReservationStatus.CONFIRMED;
    }

    // No further transition is possible
    public boolean isSettled() {
        return status == ReservationStatus.RELEASED || status == ReservationStatus.EXPIRED;
    }

    public boolean isExpiredAt(Instant now) {
        return status == ReservationStatus.PENDING && expiresAt != null && !expiresAt.isAfter(now);
    }
}
