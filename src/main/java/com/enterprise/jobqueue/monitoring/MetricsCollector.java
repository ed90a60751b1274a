package com.enterprise.jobqueue.monitoring;

import com.enterprise.jobqueue.broker.QueueDefinition;
import com.enterprise.jobqueue.broker.TaskBroker;
import com.enterprise.jobqueue.core.TaskState;
import com.enterprise.jobqueue.exception.BrokerUnavailableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects and exposes metrics for the job queue
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    public static final String TASKS_ENQUEUED = "jobqueue.tasks.enqueued";
    public static final String TASKS_PROCESSED = "jobqueue.tasks.processed";
    public static final String TASK_DURATION = "jobqueue.task.duration";
    public static final String TASKS_RETRIED = "jobqueue.tasks.retried";
    public static final String TASKS_FAILED = "jobqueue.tasks.failed";
    public static final String TASKS_PANICKED = "jobqueue.tasks.panics";
    public static final String TASKS_TIMED_OUT = "jobqueue.tasks.timeouts";
    public static final String QUEUE_DEPTH = "jobqueue.queue.depth";

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILURE = "failure";

    private static final List<TaskState> GAUGED_STATES = Arrays.asList(
        TaskState.PENDING, TaskState.ACTIVE, TaskState.SCHEDULED, TaskState.RETRY, TaskState.FAILED);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        logger.info("MetricsCollector initialized");
    }

    /**
     * Record a task handed to the broker by a producer
     */
    public void recordEnqueued(String queue, String taskType) {
        counter(TASKS_ENQUEUED, "Tasks enqueued by producers", "queue", queue, "type", taskType).increment();
    }

    /**
     * Record one processed attempt with its outcome
     */
    public void recordProcessed(String queue, String taskType, String status) {
        counter(TASKS_PROCESSED, "Task attempts processed", "queue", queue, "type", taskType, "status", status)
            .increment();
    }

    public void recordDuration(String queue, String taskType, Duration duration) {
        String key = TASK_DURATION + "|" + queue + "|" + taskType;
        timers.computeIfAbsent(key, k ->
            Timer.builder(TASK_DURATION)
                .tag("queue", queue)
                .tag("type", taskType)
                .description("Task handler execution time")
                .register(meterRegistry)
        ).record(duration);
    }

    public void recordRetry(String queue, String taskType) {
        counter(TASKS_RETRIED, "Tasks scheduled for another attempt", "queue", queue, "type", taskType).increment();
    }

    public void recordFailed(String queue, String taskType) {
        counter(TASKS_FAILED, "Tasks moved to the FAILED state", "queue", queue, "type", taskType).increment();
    }

    public void recordPanic(String taskType) {
        counter(TASKS_PANICKED, "Unchecked failures recovered from handlers", "type", taskType).increment();
    }

    public void recordTimeout(String taskType) {
        counter(TASKS_TIMED_OUT, "Attempts cancelled at their deadline", "type", taskType).increment();
    }

    /**
     * Register depth gauges for every queue and waiting state of the broker
     */
    public void registerQueueGauges(TaskBroker broker) {
        for (QueueDefinition queue : broker.getQueues()) {
            for (TaskState state : GAUGED_STATES) {
                Gauge.builder(QUEUE_DEPTH, broker, b -> depth(b, queue.getName(), state))
                    .tag("queue", queue.getName())
                    .tag("state", state.name().toLowerCase())
                    .description("Number of tasks per queue and state")
                    .register(meterRegistry);
            }
        }
        logger.debug("Queue depth gauges registered for {}", broker.getQueues());
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    private Counter counter(String name, String description, String... tags) {
        String key = name + "|" + String.join("|", tags);
        return counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .description(description)
                .register(meterRegistry)
        );
    }

    private static double depth(TaskBroker broker, String queue, TaskState state) {
        try {
            return broker.countTasks(queue, state);
        } catch (BrokerUnavailableException e) {
            logger.debug("Queue depth unavailable for {}: {}", queue, e.getMessage());
            return Double.NaN;
        }
    }
}
