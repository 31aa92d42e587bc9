package com.flowhub.orderservice.exception;

import com.flowhub.common.contracts.CandidateRejection;

import java.util.List;
import java.util.UUID;

/**
 * Every candidate vendor was tried and none could hold the stock.
 * HTTP Status: 422 Unprocessable Entity
 */
public class AllocationFailedException extends RuntimeException {

    private final UUID orderId;
    private final List<CandidateRejection> rejections;

    public AllocationFailedException(UUID orderId, List<CandidateRejection> rejections) {
        super("No vendor could reserve stock for order " + orderId + " (" + rejections.size() + " candidate(s) tried)");
        this.orderId = orderId;
        this.rejections = List.copyOf(rejections);
    }

    public UUID getOrderId() {
        return orderId;
    }

    public List<CandidateRejection> getRejections() {
        return rejections;
    }
}
