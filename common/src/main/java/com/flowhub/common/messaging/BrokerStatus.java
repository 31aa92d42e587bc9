package com.flowhub.common.messaging;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class BrokerStatus {
    ConnectionState state;
    int pendingCount;
    String lastError;
    long evictedCount;
    long droppedCount;
    int reconnectAttempts;
    Instant since;

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }
}
