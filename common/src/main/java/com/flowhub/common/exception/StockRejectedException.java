package com.flowhub.common.exception;

/**
 * Definitive refusal of a stock hold by the inventory service
 * (insufficient stock, unknown product, closed location).
 * Never retried and never counted against a circuit.
 */
public class StockRejectedException extends RuntimeException {

    public StockRejectedException(String message) {
        super(message);
    }

    public StockRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
