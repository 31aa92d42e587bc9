package com.flowhub.common.resilience;

import com.flowhub.common.exception.StockRejectedException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Decides whether a failure is worth retrying and counts against a circuit.
 * Timeouts, connection errors and gateway-type HTTP statuses are transient; everything else,
 * including every definitive answer from the remote side, is not.
 */
public class TransientFailureClassifier implements Predicate<Throwable> {

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(502, 503, 504);
    private static final int MAX_CAUSE_DEPTH = 10;

    @Override
    public boolean test(Throwable throwable) {
        return isTransient(throwable);
    }

    public boolean isTransient(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof CallNotPermittedException || current instanceof StockRejectedException) {
                return false;
            }
            if (current instanceof WebClientResponseException responseException) {
                return TRANSIENT_STATUSES.contains(responseException.getStatusCode().value());
            }
            if (current instanceof TimeoutException
                    || current instanceof IOException
                    || current instanceof WebClientRequestException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
