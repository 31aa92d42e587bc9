package com.flowhub.orderservice.service;

import com.flowhub.common.dto.ReserveStockItem;
import com.flowhub.common.dto.VendorAvailabilityResponse;
import com.flowhub.common.resilience.ResilientCallExecutor;
import com.flowhub.orderservice.client.CatalogClient;
import com.flowhub.orderservice.dto.CandidateSearchRequest;
import com.flowhub.orderservice.exception.ExternalServiceException;
import com.flowhub.orderservice.model.FulfillmentOrder;
import com.flowhub.orderservice.model.VendorCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads candidate vendor locations for an order from the catalog and drops vendors that report
 * themselves unavailable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VendorCandidateProvider {

    public static final String CATALOG_TARGET = "catalog";

    private final CatalogClient catalogClient;
    private final ResilientCallExecutor callExecutor;

    /**
     * @throws ExternalServiceException if the catalog cannot return candidates
     */
    public List<VendorCandidate> candidatesFor(FulfillmentOrder order) {
        CandidateSearchRequest request = CandidateSearchRequest.builder()
                .orderId(order.getOrderId())
                .items(order.getItems().stream()
                        .map(line -> ReserveStockItem.builder()
                                .productId(line.getProductId())
                                .size(line.getSize())
                                .quantity(line.getQuantity())
                                .build())
                        .collect(Collectors.toList()))
                .latitude(order.getDeliveryLocation().getLatitude())
                .longitude(order.getDeliveryLocation().getLongitude())
                .urgent(order.isUrgent())
                .build();

        List<VendorCandidate> candidates;
        try {
            candidates = callExecutor.execute(CATALOG_TARGET, catalogClient.findCandidates(request)).block();
        } catch (RuntimeException e) {
            log.error("Catalog did not return candidates. orderId={}, error={}", order.getOrderId(), e.getMessage());
            throw new ExternalServiceException("Catalog service unavailable for order " + order.getOrderId(), e);
        }
        if (candidates == null || candidates.isEmpty()) {
            log.info("Catalog returned no candidates. orderId={}", order.getOrderId());
            return List.of();
        }

        // One availability check per vendor, shared by all of its locations
        Map<String, Boolean> availability = new HashMap<>();
        List<VendorCandidate> available = candidates.stream()
                .filter(candidate -> availability.computeIfAbsent(candidate.getVendorId(), this::isAvailable))
                .collect(Collectors.toList());
        log.info("Loaded {} candidate(s), {} after availability check. orderId={}",
                candidates.size(), available.size(), order.getOrderId());
        return available;
    }

    private boolean isAvailable(String vendorId) {
        try {
            VendorAvailabilityResponse response = callExecutor
                    .execute(CATALOG_TARGET, catalogClient.availability(vendorId))
                    .block();
            if (response != null && !response.isAvailable()) {
                log.info("Vendor reports itself unavailable, skipping. vendorId={}, capacityInfo={}",
                        vendorId, response.getCapacityInfo());
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            // Inventory has the final word, so an unknown availability keeps the vendor
            log.warn("Availability check failed, keeping vendor. vendorId={}, error={}", vendorId, e.getMessage());
            return true;
        }
    }
}
