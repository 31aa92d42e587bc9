package com.flowhub.orderservice.service;

import com.flowhub.common.contracts.CandidateRejection;
import com.flowhub.common.contracts.RejectionReason;
import com.flowhub.common.dto.ReservationAck;
import com.flowhub.common.dto.ReserveStockItem;
import com.flowhub.common.dto.ReserveStockRequest;
import com.flowhub.common.exception.ResourceNotFoundException;
import com.flowhub.common.exception.StockRejectedException;
import com.flowhub.common.resilience.CircuitOpenException;
import com.flowhub.common.resilience.ExhaustedRetriesException;
import com.flowhub.common.resilience.ResilientCallExecutor;
import com.flowhub.orderservice.client.InventoryClient;
import com.flowhub.orderservice.config.ReservationProperties;
import com.flowhub.orderservice.dto.ReservationResponse;
import com.flowhub.orderservice.event.ReservationEventPublisher;
import com.flowhub.orderservice.exception.AllocationCancelledException;
import com.flowhub.orderservice.exception.AllocationFailedException;
import com.flowhub.orderservice.exception.AllocationInProgressException;
import com.flowhub.orderservice.exception.ExternalServiceException;
import com.flowhub.orderservice.exception.InvalidReservationStateException;
import com.flowhub.orderservice.exception.NoCandidatesAvailableException;
import com.flowhub.orderservice.mapper.ReservationMapper;
import com.flowhub.orderservice.model.FulfillmentOrder;
import com.flowhub.orderservice.model.Reservation;
import com.flowhub.orderservice.model.ReservationStatus;
import com.flowhub.orderservice.model.VendorCandidate;
import com.flowhub.orderservice.repository.ReservationStore;
import com.flowhub.orderservice.selection.RankedCandidate;
import com.flowhub.orderservice.selection.VendorSelectionEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReservationCoordinatorImpl implements ReservationCoordinator {

    public static final String INVENTORY_TARGET = "inventory";

    private final VendorCandidateProvider candidateProvider;
    private final VendorSelectionEngine selectionEngine;
    private final InventoryClient inventoryClient;
    private final ResilientCallExecutor callExecutor;
    private final ReservationStore reservationStore;
    private final ReservationEventPublisher eventPublisher;
    private final ReservationMapper reservationMapper;
    private final ReservationProperties properties;
    private final Clock clock;

    private final Set<UUID> ordersInFlight = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<UUID, Object> reservationLocks = new ConcurrentHashMap<>();

    @Override
    public ReservationResponse allocate(FulfillmentOrder order, CancellationSignal signal) {
        UUID orderId = order.getOrderId();
        if (!ordersInFlight.add(orderId)) {
            throw new AllocationInProgressException("Allocation already in progress for order " + orderId);
        }
        try {
            Optional<Reservation> existing = reservationStore.findActiveByOrderId(orderId);
            if (existing.isPresent()) {
                log.info("Order already holds a reservation, returning it. orderId={}, reservationId={}",
                        orderId, existing.get().getId());
                return reservationMapper.toReservationResponse(existing.get());
            }

            throwIfCancelled(orderId, signal);
            List<VendorCandidate> candidates = candidateProvider.candidatesFor(order);

            List<RankedCandidate> ranked;
            try {
                ranked = selectionEngine.rank(candidates, order.getCriteria(), order.totalQuantity(), order.isUrgent());
            } catch (NoCandidatesAvailableException e) {
                log.warn("No vendor can serve the order. orderId={}, reason={}", orderId, e.getMessage());
                eventPublisher.allocationFailed(orderId, List.of());
                throw e;
            }

            return reserveFirstAccepting(order, ranked, signal);
        } finally {
            ordersInFlight.remove(orderId);
        }
    }

    private ReservationResponse reserveFirstAccepting(FulfillmentOrder order, List<RankedCandidate> ranked,
            CancellationSignal signal) {
        UUID orderId = order.getOrderId();
        List<CandidateRejection> rejections = new ArrayList<>();

        for (RankedCandidate rankedCandidate : ranked) {
            throwIfCancelled(orderId, signal);
            VendorCandidate candidate = rankedCandidate.getCandidate();
            // Generated here so retries of the same trial hit the same hold at the inventory side
            UUID reservationId = UUID.randomUUID();
            Mono<ReservationAck> reserveCall = inventoryClient.reserve(reserveRequest(order, candidate, reservationId));
            AtomicInteger attemptsSent = new AtomicInteger();

            log.info("Trying vendor location. orderId={}, vendorId={}, locationId={}, score={}",
                    orderId, candidate.getVendorId(), candidate.getLocationId(), rankedCandidate.getScore());
            try {
                // Only attempts the circuit let through reach inventory
                callExecutor.execute(INVENTORY_TARGET, Mono.defer(() -> {
                    attemptsSent.incrementAndGet();
                    return reserveCall;
                })).block();
            } catch (StockRejectedException e) {
                log.info("Vendor rejected the hold. orderId={}, vendorId={}, reason={}",
                        orderId, candidate.getVendorId(), e.getMessage());
                rejections.add(rejection(candidate, RejectionReason.REJECTED, e.getMessage()));
                continue;
            } catch (ExhaustedRetriesException e) {
                log.warn("Inventory kept failing for vendor, moving on. orderId={}, vendorId={}, error={}",
                        orderId, candidate.getVendorId(), e.getMessage());
                rejections.add(rejection(candidate, RejectionReason.TRANSIENT_FAILURE, e.getMessage()));
                compensate(order, candidate, reservationId);
                continue;
            } catch (CircuitOpenException e) {
                log.warn("Inventory circuit open, sustained outage. orderId={}, vendorId={}, attemptsSent={}",
                        orderId, candidate.getVendorId(), attemptsSent.get());
                rejections.add(rejection(candidate, RejectionReason.CIRCUIT_OPEN, e.getMessage()));
                // The circuit may have opened after earlier attempts of this trial timed out
                if (attemptsSent.get() > 0) {
                    compensate(order, candidate, reservationId);
                }
                continue;
            } catch (RuntimeException e) {
                log.error("Unexpected error reserving stock. orderId={}, vendorId={}, error={}",
                        orderId, candidate.getVendorId(), e.getMessage(), e);
                rejections.add(rejection(candidate, RejectionReason.UNEXPECTED_ERROR, e.getMessage()));
                compensate(order, candidate, reservationId);
                continue;
            }

            Reservation reservation = saveAccepted(order, candidate, reservationId);
            if (signal.isCancelled()) {
                log.warn("Allocation cancelled after the hold was placed, releasing it. orderId={}, reservationId={}",
                        orderId, reservationId);
                if (!releaseQuietly(reservation)) {
                    throw new AllocationCancelledException("Allocation cancelled for order " + orderId
                            + ", hold " + reservationId + " could not be released yet and will be retried");
                }
                throw new AllocationCancelledException("Allocation cancelled for order " + orderId);
            }
            eventPublisher.orderReserved(reservation);
            log.info("Stock reserved. orderId={}, reservationId={}, vendorId={}, locationId={}, expiresAt={}",
                    orderId, reservationId, candidate.getVendorId(), candidate.getLocationId(),
                    reservation.getExpiresAt());
            return reservationMapper.toReservationResponse(reservation);
        }

        log.warn("Every candidate refused the order. orderId={}, candidates={}", orderId, rejections.size());
        eventPublisher.allocationFailed(orderId, rejections);
        throw new AllocationFailedException(orderId, rejections);
    }

    @Override
    public ReservationResponse release(UUID reservationId) {
        return withLock(reservationId, () -> {
            Reservation reservation = findOrThrow(reservationId);
            if (!reservation.isActive()) {
                log.info("Reservation not active, nothing to release. reservationId={}, status={}",
                        reservationId, reservation.getStatus());
                return reservationMapper.toReservationResponse(reservation);
            }

            releaseAtInventory(reservation);
            Reservation released = transition(reservation, ReservationStatus.RELEASED);
            eventPublisher.reservationReleased(released);
            log.info("Reservation released. reservationId={}, orderId={}", reservationId, released.getOrderId());
            return reservationMapper.toReservationResponse(released);
        });
    }

    @Override
    public ReservationResponse confirm(UUID reservationId) {
        return withLock(reservationId, () -> {
            Reservation reservation = findOrThrow(reservationId);
            if (reservation.getStatus() == ReservationStatus.CONFIRMED) {
                return reservationMapper.toReservationResponse(reservation);
            }
            if (reservation.getStatus() != ReservationStatus.PENDING) {
                throw new InvalidReservationStateException(
                        "Cannot confirm reservation " + reservationId + " in status " + reservation.getStatus());
            }
            if (reservation.isExpiredAt(clock.instant())) {
                throw new InvalidReservationStateException("Reservation " + reservationId + " has expired");
            }

            try {
                callExecutor.execute(INVENTORY_TARGET, inventoryClient.confirm(reservationId)).block();
            } catch (StockRejectedException e) {
                throw new InvalidReservationStateException(
                        "Inventory refused to confirm reservation " + reservationId + ": " + e.getMessage());
            } catch (RuntimeException e) {
                throw new ExternalServiceException("Inventory service could not confirm reservation "
                        + reservationId, e);
            }

            Reservation confirmed = transition(reservation, ReservationStatus.CONFIRMED);
            eventPublisher.reservationConfirmed(confirmed);
            log.info("Reservation confirmed. reservationId={}, orderId={}", reservationId, confirmed.getOrderId());
            return reservationMapper.toReservationResponse(confirmed);
        });
    }

    @Override
    public int expireStale() {
        Instant now = clock.instant();
        List<Reservation> stale = reservationStore.findPendingExpiredAt(now);
        int expired = 0;

        for (Reservation candidate : stale) {
            if (withLock(candidate.getId(), () -> expireIfDue(candidate.getId(), now))) {
                expired++;
            }
        }
        if (!stale.isEmpty()) {
            log.info("Expiry sweep finished. due={}, expired={}", stale.size(), expired);
        }

        List<Reservation> compensating = reservationStore.findByStatus(ReservationStatus.COMPENSATING);
        int compensated = 0;
        for (Reservation hold : compensating) {
            if (withLock(hold.getId(), () -> retryCompensation(hold.getId()))) {
                compensated++;
            }
        }
        if (!compensating.isEmpty()) {
            log.info("Compensation retry finished. pending={}, released={}", compensating.size(), compensated);
        }
        return expired;
    }

    private boolean expireIfDue(UUID reservationId, Instant now) {
        // Re-read under the lock, it may have been confirmed or released meanwhile
        Optional<Reservation> current = reservationStore.findById(reservationId);
        if (current.isEmpty() || !current.get().isExpiredAt(now)) {
            return false;
        }
        try {
            releaseAtInventory(current.get());
        } catch (ExternalServiceException e) {
            log.warn("Could not release expired reservation, will retry next sweep. reservationId={}, error={}",
                    reservationId, e.getMessage());
            return false;
        }
        Reservation expiredReservation = transition(current.get(), ReservationStatus.EXPIRED);
        eventPublisher.reservationExpired(expiredReservation);
        return true;
    }

    private boolean retryCompensation(UUID reservationId) {
        Optional<Reservation> current = reservationStore.findById(reservationId)
                .filter(reservation -> reservation.getStatus() == ReservationStatus.COMPENSATING);
        if (current.isEmpty()) {
            return false;
        }
        try {
            releaseAtInventory(current.get());
        } catch (ExternalServiceException e) {
            log.warn("Compensating release still failing, will retry next sweep. reservationId={}, error={}",
                    reservationId, e.getMessage());
            return false;
        }
        transition(current.get(), ReservationStatus.RELEASED);
        log.info("Compensating release done. orderId={}, reservationId={}", current.get().getOrderId(), reservationId);
        return true;
    }

    @Override
    public ReservationResponse getReservation(UUID reservationId) {
        return reservationMapper.toReservationResponse(findOrThrow(reservationId));
    }

    @Override
    public Optional<ReservationResponse> findActiveForOrder(UUID orderId) {
        return reservationStore.findActiveByOrderId(orderId).map(reservationMapper::toReservationResponse);
    }

    private Reservation saveAccepted(FulfillmentOrder order, VendorCandidate candidate, UUID reservationId) {
        Instant now = clock.instant();
        Reservation reservation = Reservation.builder()
                .id(reservationId)
                .orderId(order.getOrderId())
                .vendorId(candidate.getVendorId())
                .locationId(candidate.getLocationId())
                .items(List.copyOf(order.getItems()))
                .status(ReservationStatus.PENDING)
                .createdAt(now)
                .expiresAt(now.plus(properties.getTtl()))
                .updatedAt(now)
                .build();
        return reservationStore.save(reservation);
    }

    private Reservation transition(Reservation reservation, ReservationStatus status) {
        Reservation updated = reservation.toBuilder()
                .status(status)
                .updatedAt(clock.instant())
                .build();
        return reservationStore.save(updated);
    }

    private void releaseAtInventory(Reservation reservation) {
        try {
            callExecutor.execute(INVENTORY_TARGET, inventoryClient.release(reservation.getId())).block();
        } catch (RuntimeException e) {
            throw new ExternalServiceException("Inventory service could not release reservation "
                    + reservation.getId(), e);
        }
    }

    // The hold was never announced, so no released event goes out
    private boolean releaseQuietly(Reservation reservation) {
        return withLock(reservation.getId(), () -> {
            try {
                releaseAtInventory(reservation);
                transition(reservation, ReservationStatus.RELEASED);
                return true;
            } catch (ExternalServiceException e) {
                log.error("Release after cancellation failed, hold kept for the next sweep. "
                        + "orderId={}, reservationId={}, error={}", reservation.getOrderId(), reservation.getId(), e.getMessage());
                transition(reservation, ReservationStatus.COMPENSATING);
                return false;
            }
        });
    }

    // The inventory may have applied a hold whose reply was lost
    private void compensate(FulfillmentOrder order, VendorCandidate candidate, UUID reservationId) {
        Instant now = clock.instant();
        reservationStore.save(Reservation.builder()
                .id(reservationId)
                .orderId(order.getOrderId())
                .vendorId(candidate.getVendorId())
                .locationId(candidate.getLocationId())
                .items(List.copyOf(order.getItems()))
                .status(ReservationStatus.COMPENSATING)
                .createdAt(now)
                .updatedAt(now)
                .build());

        callExecutor.execute(INVENTORY_TARGET, inventoryClient.release(reservationId))
                .subscribe(
                        ack -> withLock(reservationId, () -> settleCompensation(reservationId)),
                        error -> log.warn("Compensating release failed, the expiry sweep will retry. "
                                + "orderId={}, reservationId={}, error={}", order.getOrderId(), reservationId, error.getMessage()));
    }

    private boolean settleCompensation(UUID reservationId) {
        Optional<Reservation> current = reservationStore.findById(reservationId)
                .filter(reservation -> reservation.getStatus() == ReservationStatus.COMPENSATING);
        current.ifPresent(reservation -> {
            transition(reservation, ReservationStatus.RELEASED);
            log.debug("Compensating release done. orderId={}, reservationId={}", reservation.getOrderId(), reservationId);
        });
        return current.isPresent();
    }

    private void throwIfCancelled(UUID orderId, CancellationSignal signal) {
        if (signal.isCancelled()) {
            log.info("Allocation cancelled by caller. orderId={}", orderId);
            throw new AllocationCancelledException("Allocation cancelled for order " + orderId);
        }
    }

    private Reservation findOrThrow(UUID reservationId) {
        return reservationStore.findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation not found with id: " + reservationId));
    }

    // Monitors of settled or unknown reservations are dropped, those are never written again
    private <T> T withLock(UUID reservationId, Supplier<T> action) {
        Object lock = reservationLocks.computeIfAbsent(reservationId, id -> new Object());
        try {
            synchronized (lock) {
                return action.get();
            }
        } finally {
            boolean settled = reservationStore.findById(reservationId).map(Reservation::isSettled).orElse(true);
            if (settled) {
                reservationLocks.remove(reservationId, lock);
            }
        }
    }

    // Visible for tests
    int trackedLockCount() {
        return reservationLocks.size();
    }

    private static ReserveStockRequest reserveRequest(FulfillmentOrder order, VendorCandidate candidate, UUID reservationId) {
        return ReserveStockRequest.builder()
                .reservationId(reservationId)
                .orderId(order.getOrderId())
                .locationId(candidate.getLocationId())
                .items(order.getItems().stream()
                        .map(line -> ReserveStockItem.builder()
                                .productId(line.getProductId())
                                .size(line.getSize())
                                .quantity(line.getQuantity())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    private static CandidateRejection rejection(VendorCandidate candidate, RejectionReason reason, String detail) {
        return CandidateRejection.builder()
                .vendorId(candidate.getVendorId())
                .locationId(candidate.getLocationId())
                .reason(reason)
                .detail(detail)
                .build();
    }
}
