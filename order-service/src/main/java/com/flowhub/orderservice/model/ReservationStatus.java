package com.flowhub.orderservice.model;

public enum ReservationStatus {
    PENDING,    // Held at the vendor location, not yet paid
    CONFIRMED,  // Inventory acknowledged the commit
    RELEASED,   // Given back, by cancellation or compensation
    EXPIRED,    // Released by the expiry sweep
    COMPENSATING // Possibly held at inventory after a failed trial, release pending
}
