package com.workstream.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Configuration for node retry behavior.
 * Immutable and reusable across node definitions.
 *
 * Invariants:
 * - maxRetries >= 0 (0 means a single attempt)
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - multiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxRetries,
    BackoffStrategy backoffStrategy,
    Duration initialBackoff,
    Duration maxBackoff,
    double multiplier,
    double jitterFactor,
    Set<String> nonRetryableErrors
) {
    /**
     * Shape of the delay curve between attempts.
     */
    public enum BackoffStrategy {
        FIXED,
        LINEAR,
        EXPONENTIAL
    }

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
        backoffStrategy = backoffStrategy == null ? BackoffStrategy.EXPONENTIAL : backoffStrategy;
        initialBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null ? initialBackoff : maxBackoff;
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * Default retry policy: 2 retries, exponential backoff starting at 1s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(
            2,
            BackoffStrategy.EXPONENTIAL,
            Duration.ofSeconds(1),
            Duration.ofMinutes(1),
            2.0,
            0.1,
            Set.of()
        );
    }

    /**
     * No retry policy: single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(
            0,
            BackoffStrategy.FIXED,
            Duration.ZERO,
            Duration.ZERO,
            1.0,
            0.0,
            Set.of()
        );
    }

    /**
     * Compute the delay before a retry.
     *
     * @param retryNumber 1-indexed retry number (1 = first retry after the initial attempt)
     * @return Duration to wait before the retry is dispatched
     */
    public Duration computeBackoff(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("Retry number must be >= 1");
        }

        double baseBackoffMs = switch (backoffStrategy) {
            case FIXED -> initialBackoff.toMillis();
            case LINEAR -> (double) initialBackoff.toMillis() * retryNumber;
            case EXPONENTIAL -> initialBackoff.toMillis() * Math.pow(multiplier, retryNumber - 1);
        };

        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());

        // backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange +
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Check if the given error code may be retried at all.
     *
     * @param errorCode The error code reported for the failed attempt
     * @return true unless the code is listed as non-retryable
     */
    public boolean shouldRetry(String errorCode) {
        return errorCode == null || !nonRetryableErrors.contains(errorCode);
    }

    /**
     * Check if more retries are available.
     *
     * @param retriesUsed Number of retries already consumed
     * @return true if another retry can be made
     */
    public boolean hasRetriesLeft(int retriesUsed) {
        return retriesUsed < maxRetries;
    }

    /**
     * Total attempts permitted, including the first.
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxRetries(maxRetries)
            .backoffStrategy(backoffStrategy)
            .initialBackoff(initialBackoff)
            .maxBackoff(maxBackoff)
            .multiplier(multiplier)
            .jitterFactor(jitterFactor)
            .nonRetryableErrors(nonRetryableErrors);
    }

    public static class Builder {
        private int maxRetries = 2;
        private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(1);
        private double multiplier = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> nonRetryableErrors = Set.of();

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffStrategy(BackoffStrategy backoffStrategy) {
            this.backoffStrategy = backoffStrategy;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                maxRetries, backoffStrategy, initialBackoff, maxBackoff,
                multiplier, jitterFactor, nonRetryableErrors
            );
        }
    }
}
