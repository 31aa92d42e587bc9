package com.flowhub.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Event contract sent by the payment side once the buyer paid for an order.
 * order-service confirms the pending stock hold in response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentCompletedContract {
    private UUID orderId;
}
