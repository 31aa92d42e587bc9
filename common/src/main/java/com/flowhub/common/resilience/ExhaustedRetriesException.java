package com.flowhub.common.resilience;

/**
 * A call kept failing transiently until every retry attempt was used.
 * The last transient failure is the cause.
 */
public class ExhaustedRetriesException extends RuntimeException {

    private final String target;
    private final int attempts;

    public ExhaustedRetriesException(String target, int attempts, Throwable cause) {
        super("Call to " + target + " failed after " + attempts + " attempt(s): " + cause.getMessage(), cause);
        this.target = target;
        this.attempts = attempts;
    }

    public String getTarget() {
        return target;
    }

    public int getAttempts() {
        return attempts;
    }
}
