package com.flowhub.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once a vendor location accepted the stock hold for an order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderReservedContract {
    private UUID orderId;
    private String vendorId;
    private String locationId;
    private UUID reservationId;
    private Instant timestamp;
}
