package com.flowhub.orderservice.exception;

/**
 * The caller gave up on the allocation; any hold taken for it has been released.
 * HTTP Status: 409 Conflict
 */
public class AllocationCancelledException extends RuntimeException {

    public AllocationCancelledException(String message) {
        super(message);
    }
}
