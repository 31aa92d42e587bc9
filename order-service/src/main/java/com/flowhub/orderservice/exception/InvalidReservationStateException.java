package com.flowhub.orderservice.exception;

/**
 * Exception thrown when a reservation transition is not allowed from its current status
 * For example: confirming a reservation that was already released
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidReservationStateException extends RuntimeException {

    public InvalidReservationStateException(String message) {
        super(message);
    }
}
