package com.flowhub.orderservice.event;

import com.flowhub.common.contracts.AllocationFailedContract;
import com.flowhub.common.contracts.CandidateRejection;
import com.flowhub.common.contracts.EventTypes;
import com.flowhub.common.contracts.OrderReservedContract;
import com.flowhub.common.contracts.ReservationConfirmedContract;
import com.flowhub.common.contracts.ReservationExpiredContract;
import com.flowhub.common.contracts.ReservationReleasedContract;
import com.flowhub.common.messaging.ResilientBrokerClient;
import com.flowhub.orderservice.model.Reservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Publishes reservation lifecycle events through the resilient broker client.
 * The client buffers while the broker is down, so publishing never fails an allocation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReservationEventPublisher {

    private final ResilientBrokerClient brokerClient;
    private final Clock clock;

    public void orderReserved(Reservation reservation) {
        OrderReservedContract contract = OrderReservedContract.builder()
                .orderId(reservation.getOrderId())
                .vendorId(reservation.getVendorId())
                .locationId(reservation.getLocationId())
                .reservationId(reservation.getId())
                .timestamp(clock.instant())
                .build();
        publish(EventTypes.ORDER_RESERVED, contract, reservation.getOrderId());
    }

    public void allocationFailed(UUID orderId, List<CandidateRejection> reasons) {
        AllocationFailedContract contract = AllocationFailedContract.builder()
                .orderId(orderId)
                .reasons(reasons)
                .timestamp(clock.instant())
                .build();
        publish(EventTypes.ORDER_ALLOCATION_FAILED, contract, orderId);
    }

    public void reservationConfirmed(Reservation reservation) {
        ReservationConfirmedContract contract = ReservationConfirmedContract.builder()
                .orderId(reservation.getOrderId())
                .vendorId(reservation.getVendorId())
                .reservationId(reservation.getId())
                .timestamp(clock.instant())
                .build();
        publish(EventTypes.ORDER_RESERVATION_CONFIRMED, contract, reservation.getOrderId());
    }

    public void reservationReleased(Reservation reservation) {
        ReservationReleasedContract contract = ReservationReleasedContract.builder()
                .orderId(reservation.getOrderId())
                .vendorId(reservation.getVendorId())
                .reservationId(reservation.getId())
                .timestamp(clock.instant())
                .build();
        publish(EventTypes.ORDER_RESERVATION_RELEASED, contract, reservation.getOrderId());
    }

    public void reservationExpired(Reservation reservation) {
        ReservationExpiredContract contract = ReservationExpiredContract.builder()
                .orderId(reservation.getOrderId())
                .vendorId(reservation.getVendorId())
                .reservationId(reservation.getId())
                .timestamp(clock.instant())
                .build();
        publish(EventTypes.ORDER_RESERVATION_EXPIRED, contract, reservation.getOrderId());
    }

    private void publish(String eventType, Object contract, UUID orderId) {
        try {
            brokerClient.publish(eventType, contract);
            log.info("'{}' event handed to broker client. orderId={}", eventType, orderId);
        } catch (RuntimeException e) {
            log.error("Failed to publish '{}' event. orderId={}, error={}", eventType, orderId, e.getMessage(), e);
        }
    }
}
