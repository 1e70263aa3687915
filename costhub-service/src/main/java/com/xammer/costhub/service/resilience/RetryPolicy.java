package com.xammer.costhub.service.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Exponential backoff retry shared by every source client. Failures rejected by the
 * retryable predicate are rethrown after the first attempt.
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = duration -> Thread.sleep(duration.toMillis());

    private final Predicate<Throwable> retryable;
    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    public RetryPolicy(Predicate<Throwable> retryable, int maxRetries, Duration baseDelay, Duration maxDelay,
                       Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.retryable = retryable;
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.sleeper = sleeper;
    }

    public <T> T execute(Supplier<T> operation) {
        int attempt = 0;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e) || attempt >= maxRetries) {
                    throw e;
                }
                Duration delay = delayForAttempt(attempt);
                logger.warn("Attempt {} of {} failed ({}), retrying in {} ms",
                        attempt + 1, maxRetries + 1, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
                attempt++;
            }
        }
    }

    /**
     * Delay after the given zero-based failed attempt: {@code min(base * 2^attempt, max)}.
     */
    public Duration delayForAttempt(int attempt) {
        double scaled = baseDelay.toMillis() * Math.pow(2, attempt);
        long cap = maxDelay.toMillis();
        return Duration.ofMillis((long) Math.min(scaled, cap));
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
