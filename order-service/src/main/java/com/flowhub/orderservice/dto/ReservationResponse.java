package com.flowhub.orderservice.dto;

import com.flowhub.orderservice.model.OrderLine;
import com.flowhub.orderservice.model.ReservationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationResponse {
    private UUID id;
    private UUID orderId;
    private String vendorId;
    private String locationId;
    private List<OrderLine> items;
    private ReservationStatus status;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant updatedAt;
}
