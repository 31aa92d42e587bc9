package com.flowhub.common.contracts;

/**
 * Routing keys of the domain events exchanged on the FlowHub topic exchange.
 */
public final class EventTypes {

    public static final String ORDER_RESERVED = "order.reserved";
    public static final String ORDER_ALLOCATION_FAILED = "order.allocation_failed";
    public static final String ORDER_RESERVATION_EXPIRED = "order.reservation_expired";
    public static final String ORDER_RESERVATION_CONFIRMED = "order.reservation_confirmed";
    public static final String ORDER_RESERVATION_RELEASED = "order.reservation_released";

    // Consumed by order-service
    public static final String PAYMENT_COMPLETED = "payment.completed";
    public static final String ORDER_CANCELLED = "order.cancelled";

    private EventTypes() {
    }
}
