package com.flowhub.orderservice.dto;

import com.flowhub.orderservice.selection.SelectionCriteria;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
public class AllocationRequest {
    @NotNull(message = "Order ID cannot be null")
    private UUID orderId;

    @NotEmpty(message = "Order must contain at least one item")
    @Valid
    private List<OrderLineRequest> items;

    @NotNull(message = "Latitude cannot be null")
    @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
    private Double latitude;

    @NotNull(message = "Longitude cannot be null")
    @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
    private Double longitude;

    private boolean urgent;

    // Defaults to BALANCED when omitted
    private SelectionCriteria criteria;
}
