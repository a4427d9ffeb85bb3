package com.workstream.engine.coordinator;

import com.workstream.core.model.RetryPolicy;

import java.time.Duration;

/**
 * Tuning knobs of a {@link DagExecutor}.
 *
 * @param maxParallelism          upper bound on nodes dispatched in one wave
 * @param failOnValidationError   default failure policy of VALIDATION nodes; nodes may override
 * @param defaultRetryPolicy      used for nodes without their own policy
 * @param cancellationGracePeriod how long running nodes may finish after a cancel request
 * @param pollInterval            barrier poll period, bounds cancellation latency
 * @param archiveOnCompletion     drop the checkpoint once a run reaches a terminal status
 */
public record ExecutorSettings(
    int maxParallelism,
    boolean failOnValidationError,
    RetryPolicy defaultRetryPolicy,
    Duration cancellationGracePeriod,
    Duration pollInterval,
    boolean archiveOnCompletion
) {
    public ExecutorSettings {
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("maxParallelism must be >= 1");
        }
        defaultRetryPolicy = defaultRetryPolicy == null ? RetryPolicy.defaultPolicy() : defaultRetryPolicy;
        cancellationGracePeriod = cancellationGracePeriod == null ? Duration.ofSeconds(30) : cancellationGracePeriod;
        pollInterval = pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()
            ? Duration.ofMillis(50)
            : pollInterval;
    }

    public static ExecutorSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxParallelism = 4;
        private boolean failOnValidationError = true;
        private RetryPolicy defaultRetryPolicy = RetryPolicy.defaultPolicy();
        private Duration cancellationGracePeriod = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofMillis(50);
        private boolean archiveOnCompletion = false;

        public Builder maxParallelism(int maxParallelism) {
            this.maxParallelism = maxParallelism;
            return this;
        }

        public Builder failOnValidationError(boolean failOnValidationError) {
            this.failOnValidationError = failOnValidationError;
            return this;
        }

        public Builder defaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
            this.defaultRetryPolicy = defaultRetryPolicy;
            return this;
        }

        public Builder cancellationGracePeriod(Duration cancellationGracePeriod) {
            this.cancellationGracePeriod = cancellationGracePeriod;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder archiveOnCompletion(boolean archiveOnCompletion) {
            this.archiveOnCompletion = archiveOnCompletion;
            return this;
        }

        public ExecutorSettings build() {
            return new ExecutorSettings(maxParallelism, failOnValidationError, defaultRetryPolicy,
                cancellationGracePeriod, pollInterval, archiveOnCompletion);
        }
    }
}
