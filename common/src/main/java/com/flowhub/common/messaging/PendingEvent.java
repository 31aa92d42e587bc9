package com.flowhub.common.messaging;

import lombok.Value;

import java.time.Instant;

/**
 * An already-serialized event waiting in the local buffer for the broker to come back.
 */
@Value
public class PendingEvent {
    String eventType;
    String payload;
    Instant enqueuedAt;
    int replayAttempts;

    public static PendingEvent of(String eventType, String payload, Instant enqueuedAt) {
        return new PendingEvent(eventType, payload, enqueuedAt, 0);
    }

    public PendingEvent withFailedAttempt() {
        return new PendingEvent(eventType, payload, enqueuedAt, replayAttempts + 1);
    }
}
