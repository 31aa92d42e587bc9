package com.flowhub.common.resilience;

/**
 * The circuit of a target is open: the call was refused without touching the network.
 */
public class CircuitOpenException extends RuntimeException {

    private final String target;

    public CircuitOpenException(String target, Throwable cause) {
        super("Circuit open for target " + target, cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
