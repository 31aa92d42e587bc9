package com.flowhub.common.contracts;

public enum RejectionReason {
    // Inventory answered and refused the hold
    REJECTED,
    // Retries exhausted on timeouts or connection errors
    TRANSIENT_FAILURE,
    CIRCUIT_OPEN,
    UNEXPECTED_ERROR
}
