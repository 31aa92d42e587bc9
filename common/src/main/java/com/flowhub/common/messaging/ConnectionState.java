package com.flowhub.common.messaging;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    // Reconnect ceiling exceeded; the client still retries at the capped interval
    FAILED
}
