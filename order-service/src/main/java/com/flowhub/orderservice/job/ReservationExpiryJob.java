package com.flowhub.orderservice.job;

import com.flowhub.orderservice.service.ReservationCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ReservationExpiryJob {

    private final ReservationCoordinator reservationCoordinator;

    @Scheduled(fixedDelayString = "${flowhub.reservation.sweep-interval:PT1M}",
            initialDelayString = "${flowhub.reservation.sweep-interval:PT1M}")
    public void expireStaleReservations() {
        try {
            int expired = reservationCoordinator.expireStale();
            if (expired > 0) {
                log.info("Expired {} stale reservation(s)", expired);
            }
        } catch (RuntimeException e) {
            // Next run retries whatever is still due
            log.error("Expiry sweep failed. error={}", e.getMessage(), e);
        }
    }
}
