package com.xammer.costhub.service.resilience;

import java.util.function.Supplier;

/**
 * Circuit breaker around a retry loop. A call that exhausts its retries counts as a single
 * breaker failure.
 */
public class ResilienceWrapper {

    private final CircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;

    public ResilienceWrapper(CircuitBreaker circuitBreaker, RetryPolicy retryPolicy) {
        this.circuitBreaker = circuitBreaker;
        this.retryPolicy = retryPolicy;
    }

    public <T> T execute(Supplier<T> operation) {
        return circuitBreaker.execute(() -> retryPolicy.execute(operation));
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
