package com.xammer.costhub.service.resilience;

import com.xammer.costhub.domain.RecommendationSource;
import com.xammer.costhub.exception.TerminalSourceException;
import com.xammer.costhub.exception.TransientSourceException;
import com.xammer.costhub.service.source.AwsErrorClassifier;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryPolicy policy = new RetryPolicy(AwsErrorClassifier::isRetryable, 3,
            Duration.ofSeconds(1), Duration.ofSeconds(60), sleeps::add);

    @Test
    void terminalFailureIsAttemptedOnce() {
        AtomicInteger attempts = new AtomicInteger();
        TerminalSourceException denied = new TerminalSourceException(RecommendationSource.COH,
                "AccessDeniedException", "access denied");

        TerminalSourceException thrown = assertThrows(TerminalSourceException.class, () -> policy.execute(() -> {
            attempts.incrementAndGet();
            throw denied;
        }));

        assertSame(denied, thrown);
        assertEquals(1, attempts.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void transientFailureIsAttemptedMaxRetriesPlusOneTimes() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(TransientSourceException.class, () -> policy.execute(() -> {
            attempts.incrementAndGet();
            throw new TransientSourceException(RecommendationSource.COST_EXPLORER, "ThrottlingException", "slow down");
        }));

        assertEquals(4, attempts.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
        for (int i = 1; i < sleeps.size(); i++) {
            assertTrue(sleeps.get(i).compareTo(sleeps.get(i - 1)) >= 0);
        }
    }

    @Test
    void succeedsAfterTransientFailures() {
        AtomicInteger attempts = new AtomicInteger();

        String result = policy.execute(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransientSourceException(RecommendationSource.SAVINGS_PLANS, "ServiceUnavailable", "503");
            }
            return "recovered";
        });

        assertEquals("recovered", result);
        assertEquals(3, attempts.get());
        assertEquals(2, sleeps.size());
    }

    @Test
    void delayIsCappedAtMaxDelay() {
        assertEquals(Duration.ofSeconds(32), policy.delayForAttempt(5));
        assertEquals(Duration.ofSeconds(60), policy.delayForAttempt(6));
        assertEquals(Duration.ofSeconds(60), policy.delayForAttempt(40));
    }

    @Test
    void interruptedSleepStopsRetrying() {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy interrupting = new RetryPolicy(AwsErrorClassifier::isRetryable, 3,
                Duration.ofMillis(10), Duration.ofMillis(100), d -> {
                    throw new InterruptedException("shutdown");
                });
        try {
            TransientSourceException thrown = assertThrows(TransientSourceException.class,
                    () -> interrupting.execute(() -> {
                        attempts.incrementAndGet();
                        throw new TransientSourceException(RecommendationSource.COH, "Throttling", "slow down");
                    }));
            assertEquals(1, attempts.get());
            assertEquals(1, thrown.getSuppressed().length);
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsNegativeRetryCount() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(e -> true, -1,
                Duration.ofSeconds(1), Duration.ofSeconds(2), RetryPolicy.THREAD_SLEEPER));
    }
}
