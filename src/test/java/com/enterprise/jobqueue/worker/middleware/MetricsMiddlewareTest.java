package com.enterprise.jobqueue.worker.middleware;

import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskContext;
import com.enterprise.jobqueue.core.TaskHandler;
import com.enterprise.jobqueue.core.TaskImpl;
import com.enterprise.jobqueue.exception.TaskTimeoutException;
import com.enterprise.jobqueue.monitoring.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MetricsMiddlewareTest {

    private SimpleMeterRegistry registry;
    private MetricsMiddleware middleware;
    private final Task task = TaskImpl.builder().type("report").queue("low").build();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        middleware = new MetricsMiddleware(new MetricsCollector(registry));
    }

    private double processed(String status) {
        return registry.get(MetricsCollector.TASKS_PROCESSED)
            .tag("queue", "low").tag("type", "report").tag("status", status)
            .counter().count();
    }

    @Test
    void testSuccessRecorded() throws Exception {
        middleware.apply((context, payload) -> { })
            .handle(TaskContext.forTask(task, Clock.systemUTC()), new byte[0]);

        assertEquals(1.0, processed(MetricsCollector.STATUS_SUCCESS));
        assertEquals(1, registry.get(MetricsCollector.TASK_DURATION).timer().count());
    }

    @Test
    void testFailureAndTimeoutRecorded() {
        TaskHandler timingOut = middleware.apply((context, payload) -> {
            throw new TaskTimeoutException(task.getId(), Duration.ofSeconds(1));
        });

        assertThrows(TaskTimeoutException.class,
            () -> timingOut.handle(TaskContext.forTask(task, Clock.systemUTC()), new byte[0]));

        assertEquals(1.0, processed(MetricsCollector.STATUS_FAILURE));
        assertEquals(1.0, registry.get(MetricsCollector.TASKS_TIMED_OUT).tag("type", "report").counter().count());
    }
}
