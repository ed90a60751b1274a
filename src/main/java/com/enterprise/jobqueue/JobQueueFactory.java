package com.enterprise.jobqueue;

import com.enterprise.jobqueue.broker.TaskBroker;
import com.enterprise.jobqueue.client.TaskClient;
import com.enterprise.jobqueue.config.ConfigValidator;
import com.enterprise.jobqueue.config.JobQueueConfig;
import com.enterprise.jobqueue.core.TaskCodec;
import com.enterprise.jobqueue.idempotency.IdempotencyGuard;
import com.enterprise.jobqueue.inspector.BrokerQueueInspector;
import com.enterprise.jobqueue.monitoring.MetricsCollector;
import com.enterprise.jobqueue.retry.FailureHandler;
import com.enterprise.jobqueue.retry.RetryPolicy;
import com.enterprise.jobqueue.store.MapDBBackingStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Factory for creating and wiring a job queue
 */
public class JobQueueFactory {

    private static final Logger logger = LoggerFactory.getLogger(JobQueueFactory.class);

    private JobQueueFactory() {
    }

    /**
     * Create a job queue with default configuration: in-memory store, three queues
     */
    public static JobQueue createDefault() {
        return create(JobQueueConfig.builder().build());
    }

    public static JobQueue create(JobQueueConfig config) {
        return create(config, new SimpleMeterRegistry(), OpenTelemetry.noop(), Clock.systemUTC());
    }

    /**
     * Create a job queue with custom configuration
     *
     * @throws IllegalArgumentException when the configuration is invalid
     */
    public static JobQueue create(JobQueueConfig config, MeterRegistry meterRegistry,
                                  OpenTelemetry openTelemetry, Clock clock) {
        List<ConfigValidator.ValidationError> errors = new ConfigValidator().validate(config);
        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }

        logger.info("Creating job queue with configuration: {}", config);

        JobQueueConfig.QueueConfig queueConfig = config.getQueueConfig();
        MapDBBackingStore store = queueConfig.getDbPath() == null
            ? MapDBBackingStore.inMemory(clock)
            : MapDBBackingStore.file(queueConfig.getDbPath(), clock);

        TaskCodec codec = new TaskCodec();
        TaskBroker broker = TaskBroker.builder()
            .store(store)
            .codec(codec)
            .queues(queueConfig.getQueues())
            .clock(clock)
            .completedRetention(queueConfig.getCompletedRetention())
            .pollInterval(config.getWorkerConfig().getPollInterval())
            .build();

        MetricsCollector metricsCollector = null;
        if (config.getMonitoringConfig().isEnableMetrics()) {
            metricsCollector = new MetricsCollector(meterRegistry);
            metricsCollector.registerQueueGauges(broker);
        }

        JobQueueConfig.RetryConfig retryConfig = config.getRetryConfig();
        TaskClient client = new TaskClient(broker, codec, metricsCollector,
            retryConfig.getDefaultMaxRetry(), config.getWorkerConfig().getDefaultTaskTimeout());

        RetryPolicy retryPolicy = RetryPolicy.builder()
            .baseDelay(retryConfig.getBaseDelay())
            .backoffMultiplier(retryConfig.getBackoffMultiplier())
            .maxDelay(retryConfig.getMaxDelay())
            .jitterFactor(retryConfig.isEnableJitter() ? 0.1 : 0.0)
            .panicsAreTerminal(retryConfig.isPanicsAreTerminal())
            .build();

        FailureHandler.Builder failureHandler = FailureHandler.builder()
            .broker(broker)
            .retryPolicy(retryPolicy);
        if (metricsCollector != null) {
            MetricsCollector metrics = metricsCollector;
            failureHandler
                .retryNotifier(task -> metrics.recordRetry(task.getQueue(), task.getType()))
                .terminalNotifier(task -> metrics.recordFailed(task.getQueue(), task.getType()));
        }

        JobQueueConfig.IdempotencyConfig idempotencyConfig = config.getIdempotencyConfig();
        IdempotencyGuard idempotencyGuard = IdempotencyGuard.builder()
            .store(store)
            .objectMapper(codec.getObjectMapper())
            .failMode(idempotencyConfig.getFailMode())
            .keyPrefix(idempotencyConfig.getKeyPrefix())
            .defaultTtl(idempotencyConfig.getTtl())
            .clock(clock)
            .build();

        JobQueue jobQueue = new JobQueue(config, store, codec, broker, client, metricsCollector,
            failureHandler.build(), idempotencyGuard, new BrokerQueueInspector(broker, metricsCollector),
            openTelemetry);
        logger.info("Job queue created with queues {}", broker.getQueues());
        return jobQueue;
    }
}
