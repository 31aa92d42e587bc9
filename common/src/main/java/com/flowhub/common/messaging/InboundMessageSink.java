package com.flowhub.common.messaging;

@FunctionalInterface
public interface InboundMessageSink {

    /**
     * Throwing rejects the message; it is not requeued and ends up on the dead-letter queue.
     */
    void onMessage(String eventType, String payload) throws Exception;
}
