package com.flowhub.orderservice.exception;

/**
 * Another allocation for the same order is still running.
 * HTTP Status: 409 Conflict
 */
public class AllocationInProgressException extends RuntimeException {

    public AllocationInProgressException(String message) {
        super(message);
    }
}
