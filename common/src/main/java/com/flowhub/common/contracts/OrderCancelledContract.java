package com.flowhub.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Event contract for an order cancelled by the buyer or by operations.
 * Any stock still held for the order is released.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderCancelledContract {
    private UUID orderId;
    private String reason;
}
