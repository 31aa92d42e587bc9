package com.flowhub.orderservice.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * One vendor location able to serve an order, as returned by the catalog.
 * Only lives for the duration of a single allocation.
 */
@Value
@Builder
@Jacksonized
public class VendorCandidate {
    String vendorId;
    String locationId;
    double distanceKm;
    BigDecimal unitPrice;
    BigDecimal deliveryFee;
    // Added on top for urgent orders
    BigDecimal surcharge;
    double estimatedDeliveryHours;
    double rating;
    int availableQuantity;

    public BigDecimal totalCost(int quantity, boolean urgent) {
        BigDecimal total = orZero(unitPrice).multiply(BigDecimal.valueOf(quantity)).add(orZero(deliveryFee));
        if (urgent) {
            total = total.add(orZero(surcharge));
        }
        return total;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
