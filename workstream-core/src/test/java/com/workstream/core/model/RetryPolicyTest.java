package com.workstream.core.model;

import org.junit.jupiter.api.Test;
import java.time.Duration;
import java.util.Set;
import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultPolicy_shouldHaveReasonableDefaults() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(2, policy.maxRetries());
        assertEquals(3, policy.maxAttempts());
        assertEquals(RetryPolicy.BackoffStrategy.EXPONENTIAL, policy.backoffStrategy());
        assertEquals(Duration.ofSeconds(1), policy.initialBackoff());
    }

    @Test
    void noRetry_shouldAllowSingleAttempt() {
        RetryPolicy policy = RetryPolicy.noRetry();

        assertEquals(1, policy.maxAttempts());
        assertFalse(policy.hasRetriesLeft(0));
    }

    @Test
    void computeBackoff_exponential_shouldDoubleEachRetry() {
        RetryPolicy policy = RetryPolicy.builder()
            .backoffStrategy(RetryPolicy.BackoffStrategy.EXPONENTIAL)
            .initialBackoff(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofMinutes(10))
            .multiplier(2.0)
            .jitterFactor(0.0) // No jitter for predictable test
            .build();

        assertEquals(Duration.ofSeconds(1), policy.computeBackoff(1));
        assertEquals(Duration.ofSeconds(2), policy.computeBackoff(2));
        assertEquals(Duration.ofSeconds(4), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_linear_shouldGrowByInitialBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .backoffStrategy(RetryPolicy.BackoffStrategy.LINEAR)
            .initialBackoff(Duration.ofMillis(100))
            .maxBackoff(Duration.ofSeconds(10))
            .jitterFactor(0.0)
            .build();

        assertEquals(Duration.ofMillis(100), policy.computeBackoff(1));
        assertEquals(Duration.ofMillis(300), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_fixed_shouldNotGrow() {
        RetryPolicy policy = RetryPolicy.builder()
            .backoffStrategy(RetryPolicy.BackoffStrategy.FIXED)
            .initialBackoff(Duration.ofMillis(250))
            .jitterFactor(0.0)
            .build();

        assertEquals(Duration.ofMillis(250), policy.computeBackoff(1));
        assertEquals(Duration.ofMillis(250), policy.computeBackoff(7));
    }

    @Test
    void computeBackoff_shouldRespectMaxBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofSeconds(10))
            .multiplier(2.0)
            .jitterFactor(0.0)
            .build();

        // Retry 5: 2^4 = 16s, but capped at 10s
        assertEquals(Duration.ofSeconds(10), policy.computeBackoff(5));
    }

    @Test
    void computeBackoff_withJitter_shouldStayWithinRange() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofSeconds(10))
            .maxBackoff(Duration.ofMinutes(1))
            .jitterFactor(0.2)
            .build();

        for (int i = 0; i < 50; i++) {
            long ms = policy.computeBackoff(1).toMillis();
            assertTrue(ms >= 8000 && ms <= 12000, "backoff out of range: " + ms);
        }
    }

    @Test
    void computeBackoff_shouldRejectNonPositiveRetryNumber() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertThrows(IllegalArgumentException.class, () -> policy.computeBackoff(0));
    }

    @Test
    void shouldRetry_shouldHonorNonRetryableErrors() {
        RetryPolicy policy = RetryPolicy.builder()
            .nonRetryableErrors(Set.of("INVALID_INPUT"))
            .build();

        assertFalse(policy.shouldRetry("INVALID_INPUT"));
        assertTrue(policy.shouldRetry("TIMED_OUT"));
        assertTrue(policy.shouldRetry(null));
    }

    @Test
    void hasRetriesLeft_shouldCountRetriesNotAttempts() {
        RetryPolicy policy = RetryPolicy.builder().maxRetries(2).build();

        assertTrue(policy.hasRetriesLeft(0));
        assertTrue(policy.hasRetriesLeft(1));
        assertFalse(policy.hasRetriesLeft(2));
    }

    @Test
    void constructor_shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxRetries(-1).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().multiplier(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .initialBackoff(Duration.ofSeconds(5))
            .maxBackoff(Duration.ofSeconds(1))
            .build());
    }
}
