package com.flowhub.orderservice.subscriber;

import com.flowhub.common.contracts.EventTypes;
import com.flowhub.common.contracts.OrderCancelledContract;
import com.flowhub.common.contracts.PaymentCompletedContract;
import com.flowhub.common.messaging.ResilientBrokerClient;
import com.flowhub.orderservice.dto.ReservationResponse;
import com.flowhub.orderservice.model.ReservationStatus;
import com.flowhub.orderservice.service.ReservationCoordinator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Drives reservations from upstream order events: a completed payment confirms the hold,
 * a cancelled order releases it.
 * Handler exceptions propagate so the message ends up on the dead-letter queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReservationEventSubscriber {

    private final ResilientBrokerClient brokerClient;
    private final ReservationCoordinator reservationCoordinator;

    @PostConstruct
    public void subscribe() {
        brokerClient.subscribe(EventTypes.PAYMENT_COMPLETED, PaymentCompletedContract.class, this::handlePaymentCompleted);
        brokerClient.subscribe(EventTypes.ORDER_CANCELLED, OrderCancelledContract.class, this::handleOrderCancelled);
    }

    public void handlePaymentCompleted(PaymentCompletedContract contract) {
        log.info("Received 'payment.completed' event. orderId={}", contract.getOrderId());
        Optional<ReservationResponse> active = reservationCoordinator.findActiveForOrder(contract.getOrderId());
        if (active.isEmpty()) {
            log.warn("No active reservation for paid order. Ignoring event. orderId={}", contract.getOrderId());
            return;
        }
        if (active.get().getStatus() == ReservationStatus.CONFIRMED) {
            log.info("Reservation already confirmed. Ignoring event (idempotency). orderId={}, reservationId={}",
                    contract.getOrderId(), active.get().getId());
            return;
        }
        reservationCoordinator.confirm(active.get().getId());
    }

    public void handleOrderCancelled(OrderCancelledContract contract) {
        log.info("Received 'order.cancelled' event. orderId={}, reason={}", contract.getOrderId(), contract.getReason());
        Optional<ReservationResponse> active = reservationCoordinator.findActiveForOrder(contract.getOrderId());
        if (active.isEmpty()) {
            log.warn("No active reservation for cancelled order. Ignoring event. orderId={}", contract.getOrderId());
            return;
        }
        reservationCoordinator.release(active.get().getId());
    }
}
