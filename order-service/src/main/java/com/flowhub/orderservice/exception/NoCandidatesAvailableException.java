package com.flowhub.orderservice.exception;

/**
 * No vendor location has stock for the order at all.
 * HTTP Status: 422 Unprocessable Entity
 */
public class NoCandidatesAvailableException extends RuntimeException {

    public NoCandidatesAvailableException(String message) {
        super(message);
    }
}
