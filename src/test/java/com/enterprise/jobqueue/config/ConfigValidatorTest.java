package com.enterprise.jobqueue.config;

import com.enterprise.jobqueue.broker.QueueDefinition;
import com.enterprise.jobqueue.idempotency.FailMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {

    private ConfigValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ConfigValidator();
    }

    private List<String> fields(JobQueueConfig config) {
        return validator.validate(config).stream()
            .map(ConfigValidator.ValidationError::getField)
            .collect(Collectors.toList());
    }

    @Test
    void testDefaultsAreValid() {
        assertTrue(validator.validate(JobQueueConfig.builder().build()).isEmpty());
    }

    @Test
    void testInvalidWorkerConfig() {
        JobQueueConfig config = JobQueueConfig.builder()
            .workerConfig(new JobQueueConfig.WorkerConfig(
                0, Duration.ofSeconds(-1), Duration.ZERO, Duration.ofMinutes(1), Duration.ZERO))
            .build();

        List<String> fields = fields(config);

        assertTrue(fields.contains("worker.concurrency"));
        assertTrue(fields.contains("worker.shutdownTimeout"));
        assertTrue(fields.contains("worker.pollInterval"));
        assertTrue(fields.contains("worker.defaultTaskTimeout"));
        assertFalse(fields.contains("worker.janitorInterval"));
    }

    @Test
    void testQueueConfig() {
        JobQueueConfig empty = JobQueueConfig.builder()
            .queueConfig(new JobQueueConfig.QueueConfig(Collections.emptyList(), null, Duration.ZERO))
            .build();
        assertEquals(Collections.singletonList("queue.queues"), fields(empty));

        JobQueueConfig duplicate = JobQueueConfig.builder()
            .queueConfig(new JobQueueConfig.QueueConfig(Arrays.asList(
                QueueDefinition.of("default", 3),
                QueueDefinition.of("default", 1)), "  ", Duration.ofSeconds(-5)))
            .build();
        List<ConfigValidator.ValidationError> errors = validator.validate(duplicate);

        assertEquals(3, errors.size());
        assertEquals("queue.queues: Duplicate queue name: default", errors.get(0).toString());
        assertEquals("queue.dbPath", errors.get(1).getField());
        assertEquals("queue.completedRetention", errors.get(2).getField());
    }

    @Test
    void testRetryConfig() {
        JobQueueConfig config = JobQueueConfig.builder()
            .retryConfig(new JobQueueConfig.RetryConfig(
                -1, Duration.ofMinutes(10), 0.5, Duration.ofMinutes(1), true, false))
            .build();

        assertEquals(Arrays.asList("retry.defaultMaxRetry", "retry.backoffMultiplier", "retry.delayRange"),
            fields(config));
    }

    @Test
    void testIdempotencyAndMonitoringConfig() {
        JobQueueConfig config = JobQueueConfig.builder()
            .idempotencyConfig(new JobQueueConfig.IdempotencyConfig(null, "", Duration.ZERO))
            .monitoringConfig(new JobQueueConfig.MonitoringConfig(true, false, 0))
            .build();

        assertEquals(Arrays.asList("idempotency.failMode", "idempotency.keyPrefix", "idempotency.ttl",
            "monitoring.queueDepthThreshold"), fields(config));
    }

    @Test
    void testFailClosedIsAccepted() {
        JobQueueConfig config = JobQueueConfig.builder()
            .idempotencyConfig(new JobQueueConfig.IdempotencyConfig(FailMode.FAIL_CLOSED, "job:", Duration.ofHours(1)))
            .build();

        assertTrue(validator.validate(config).isEmpty());
    }
}
