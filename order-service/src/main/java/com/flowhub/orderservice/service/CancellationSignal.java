package com.flowhub.orderservice.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set by the caller of an allocation when it stops waiting for the result.
 * Checked before every candidate trial.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
