package com.xammer.costhub.service.resilience;

import com.xammer.costhub.exception.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-source circuit breaker.
 * <p>
 * CLOSED counts consecutive failures and opens at {@code failureThreshold}. OPEN rejects every call
 * until {@code recoveryTimeout} has passed since the last failure; the first caller after that becomes
 * the single HALF_OPEN trial and everybody else keeps being rejected until the trial finishes.
 * The trial's outcome alone decides the next state.
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED, OPEN, HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private State state = State.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public <T> T execute(Supplier<T> operation) {
        acquirePermission();
        boolean succeeded = false;
        try {
            T result = operation.get();
            succeeded = true;
            return result;
        } finally {
            if (succeeded) {
                onSuccess();
            } else {
                onFailure();
            }
        }
    }

    private void acquirePermission() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return;
                case OPEN:
                    Instant now = clock.instant();
                    if (lastFailureTime != null && !now.isBefore(lastFailureTime.plus(recoveryTimeout))) {
                        state = State.HALF_OPEN;
                        logger.info("Circuit {} moving to HALF_OPEN, allowing one trial call", name);
                        return;
                    }
                    throw new CircuitOpenException(name);
                default:
                    // HALF_OPEN: a trial is already running
                    throw new CircuitOpenException(name);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess() {
        lock.lock();
        try {
            if (state != State.CLOSED || failureCount > 0) {
                logger.info("Circuit {} closed after successful call", name);
            }
            state = State.CLOSED;
            failureCount = 0;
            lastFailureTime = null;
        } finally {
            lock.unlock();
        }
    }

    private void onFailure() {
        lock.lock();
        try {
            failureCount++;
            lastFailureTime = clock.instant();
            if (state == State.HALF_OPEN || failureCount >= failureThreshold) {
                if (state != State.OPEN) {
                    logger.warn("Circuit {} OPEN after {} consecutive failures", name, failureCount);
                }
                state = State.OPEN;
            }
        } finally {
            lock.unlock();
        }
    }

    public CircuitState snapshot() {
        lock.lock();
        try {
            return new CircuitState(state, failureCount, lastFailureTime);
        } finally {
            lock.unlock();
        }
    }

    public State getState() {
        return snapshot().getState();
    }

    public String getName() {
        return name;
    }
}
