package com.workstream.engine.config;

import com.workstream.core.model.RetryPolicy;
import com.workstream.core.repository.CheckpointRepository;
import com.workstream.core.repository.ExecutionEventRepository;
import com.workstream.engine.context.ContextStore;
import com.workstream.engine.contract.ContractRegistry;
import com.workstream.engine.coordinator.DagExecutor;
import com.workstream.engine.coordinator.ExecutorSettings;
import com.workstream.engine.lifecycle.ExecutorShutdownHandler;
import com.workstream.engine.metrics.WorkflowMetrics;
import com.workstream.engine.persistence.CheckpointCodec;
import com.workstream.engine.persistence.InMemoryCheckpointRepository;
import com.workstream.engine.persistence.InMemoryExecutionEventRepository;
import com.workstream.engine.runner.NodeRunnerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.Duration;

/**
 * Spring wiring for the engine.
 *
 * Settings come from {@code workstream.properties} on the classpath. Every key
 * has a default, so the file is optional. Durations use ISO-8601 notation (PT30S).
 *
 * Persistence defaults to the in-memory repositories. For durable checkpoints,
 * override the {@code checkpointRepository} bean with a
 * {@link com.workstream.engine.persistence.jdbc.JdbcCheckpointRepository}.
 */
@Configuration
@PropertySource(value = "classpath:workstream.properties", ignoreResourceNotFound = true)
public class EngineConfiguration {

    @Bean
    public RetryPolicy defaultRetryPolicy(
            @Value("${workstream.retry.max-retries:2}") int maxRetries,
            @Value("${workstream.retry.backoff-strategy:EXPONENTIAL}") RetryPolicy.BackoffStrategy strategy,
            @Value("${workstream.retry.initial-backoff:PT1S}") String initialBackoff,
            @Value("${workstream.retry.max-backoff:PT1M}") String maxBackoff,
            @Value("${workstream.retry.multiplier:2.0}") double multiplier,
            @Value("${workstream.retry.jitter-factor:0.1}") double jitterFactor) {
        return RetryPolicy.builder()
            .maxRetries(maxRetries)
            .backoffStrategy(strategy)
            .initialBackoff(Duration.parse(initialBackoff))
            .maxBackoff(Duration.parse(maxBackoff))
            .multiplier(multiplier)
            .jitterFactor(jitterFactor)
            .build();
    }

    @Bean
    public ExecutorSettings executorSettings(
            RetryPolicy defaultRetryPolicy,
            @Value("${workstream.executor.max-parallelism:4}") int maxParallelism,
            @Value("${workstream.executor.fail-on-validation-error:true}") boolean failOnValidationError,
            @Value("${workstream.executor.cancellation-grace-period:PT30S}") String gracePeriod,
            @Value("${workstream.executor.poll-interval:PT0.05S}") String pollInterval,
            @Value("${workstream.checkpoint.archive-on-completion:false}") boolean archiveOnCompletion) {
        return ExecutorSettings.builder()
            .maxParallelism(maxParallelism)
            .failOnValidationError(failOnValidationError)
            .defaultRetryPolicy(defaultRetryPolicy)
            .cancellationGracePeriod(Duration.parse(gracePeriod))
            .pollInterval(Duration.parse(pollInterval))
            .archiveOnCompletion(archiveOnCompletion)
            .build();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", "workstream");
        return registry;
    }

    @Bean
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        WorkflowMetrics metrics = new WorkflowMetrics();
        metrics.bindTo(meterRegistry);
        return metrics;
    }

    @Bean
    public ContractRegistry contractRegistry(WorkflowMetrics metrics) {
        ContractRegistry registry = new ContractRegistry();
        registry.addListener(event -> metrics.contractChanged(event.type().name()));
        return registry;
    }

    @Bean
    public CheckpointCodec checkpointCodec() {
        return new CheckpointCodec();
    }

    @Bean
    public CheckpointRepository checkpointRepository(CheckpointCodec codec) {
        return new InMemoryCheckpointRepository(codec);
    }

    @Bean
    public ExecutionEventRepository executionEventRepository() {
        return new InMemoryExecutionEventRepository();
    }

    @Bean
    public ContextStore contextStore(CheckpointRepository checkpointRepository) {
        return new ContextStore(checkpointRepository);
    }

    @Bean
    public NodeRunnerRegistry nodeRunnerRegistry() {
        return new NodeRunnerRegistry();
    }

    @Bean
    public DagExecutor dagExecutor(
            NodeRunnerRegistry runners,
            ContextStore contextStore,
            ExecutorSettings settings,
            WorkflowMetrics metrics,
            ExecutionEventRepository executionEventRepository) {
        return new DagExecutor(runners, contextStore, settings, metrics, executionEventRepository);
    }

    @Bean
    public ExecutorShutdownHandler executorShutdownHandler(DagExecutor dagExecutor) {
        return new ExecutorShutdownHandler(dagExecutor);
    }
}
