package com.flowhub.common.messaging;

/**
 * Broker settings that can never lead to a connection, such as a malformed URL.
 * This is the only broker error that fails application startup.
 */
public class BrokerConfigurationException extends RuntimeException {

    public BrokerConfigurationException(String message) {
        super(message);
    }

    public BrokerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
