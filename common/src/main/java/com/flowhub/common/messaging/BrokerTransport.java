package com.flowhub.common.messaging;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Low-level broker connection used by {@link ResilientBrokerClient}.
 * Implementations throw on any failure and never buffer or retry on their own.
 */
public interface BrokerTransport {

    void connect();

    void send(String eventType, String payload);

    /**
     * Starts delivering messages of the given event types to the sink, one at a time.
     * Calling it again replaces the previous bindings.
     */
    void startConsuming(Set<String> eventTypes, InboundMessageSink sink);

    void stopConsuming();

    void close();

    /**
     * Registers the callback invoked when the connection drops without the client asking for it.
     */
    void setConnectionLostListener(Consumer<Throwable> listener);
}
