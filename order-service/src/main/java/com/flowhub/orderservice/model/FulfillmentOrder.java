package com.flowhub.orderservice.model;

import com.flowhub.orderservice.selection.SelectionCriteria;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * An order waiting for a vendor location to hold its stock.
 */
@Value
@Builder
public class FulfillmentOrder {
    UUID orderId;
    List<OrderLine> items;
    GeoPoint deliveryLocation;
    boolean urgent;
    SelectionCriteria criteria;

    public int totalQuantity() {
        return items.stream().mapToInt(OrderLine::getQuantity).sum();
    }
}
