package com.flowhub.common.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Body of {@code POST /reservations} on the inventory service.
 * The reservation id is chosen by the caller so that a retried request
 * refers to the same hold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReserveStockRequest {

    @NotNull(message = "Reservation ID cannot be null")
    private UUID reservationId;

    @NotNull(message = "Order ID cannot be null")
    private UUID orderId;

    @NotBlank(message = "Location ID cannot be blank")
    private String locationId;

    @NotEmpty(message = "At least one item is required")
    @Valid
    private List<ReserveStockItem> items;
}
