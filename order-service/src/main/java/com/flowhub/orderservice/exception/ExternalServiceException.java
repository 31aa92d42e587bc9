package com.flowhub.orderservice.exception;

/**
 * Exception thrown when a collaborator service cannot be reached or keeps failing
 * For example: catalog is down, or inventory did not acknowledge a release
 * HTTP Status: 502 Bad Gateway
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
