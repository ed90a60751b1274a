package com.enterprise.jobqueue.client;

import com.enterprise.jobqueue.broker.QueueDefinition;
import com.enterprise.jobqueue.broker.TaskBroker;
import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskCodec;
import com.enterprise.jobqueue.core.TaskImpl;
import com.enterprise.jobqueue.core.TaskState;
import com.enterprise.jobqueue.exception.BrokerUnavailableException;
import com.enterprise.jobqueue.exception.QueueUnknownException;
import com.enterprise.jobqueue.exception.SerializationFailedException;
import com.enterprise.jobqueue.monitoring.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Producer side entry point: builds tasks and enqueues them through the broker
 */
public class TaskClient {
    
    private static final Logger logger = LoggerFactory.getLogger(TaskClient.class);
    
    private final TaskBroker broker;
    private final TaskCodec codec;
    private final MetricsCollector metricsCollector;
    private final int defaultMaxRetry;
    private final Duration defaultTimeout;
    private final Clock clock;
    
    public TaskClient(TaskBroker broker, TaskCodec codec, MetricsCollector metricsCollector,
                      int defaultMaxRetry, Duration defaultTimeout) {
        this.broker = broker;
        this.codec = codec;
        this.metricsCollector = metricsCollector;
        this.defaultMaxRetry = defaultMaxRetry;
        this.defaultTimeout = defaultTimeout;
        this.clock = broker.getClock();
    }
    
    /**
     * Serialize the payload as JSON and enqueue a task of the given type
     */
    public TaskInfo enqueue(String taskType, Object payload, EnqueueOptions options)
            throws QueueUnknownException, SerializationFailedException, BrokerUnavailableException {
        byte[] data = payload instanceof byte[] ? (byte[]) payload : codec.encodePayload(payload);
        return enqueueRaw(taskType, data, options);
    }
    
    /**
     * Enqueue a task whose payload is already serialized
     */
    public TaskInfo enqueueRaw(String taskType, byte[] payload, EnqueueOptions options)
            throws QueueUnknownException, SerializationFailedException, BrokerUnavailableException {
        if (taskType == null || taskType.trim().isEmpty()) {
            throw new IllegalArgumentException("Task type cannot be empty");
        }
        EnqueueOptions effective = options != null ? options : EnqueueOptions.defaults();
        
        Instant now = clock.instant();
        Instant processAt = effective.getProcessAt();
        if (effective.getProcessIn() != null) {
            processAt = now.plus(effective.getProcessIn());
        }
        boolean delayed = processAt != null && processAt.isAfter(now);
        
        TaskImpl.Builder builder = TaskImpl.builder()
            .type(taskType)
            .payload(payload)
            .queue(effective.getQueue())
            .state(delayed ? TaskState.SCHEDULED : TaskState.PENDING)
            .maxRetry(effective.getMaxRetry() != null ? effective.getMaxRetry() : defaultMaxRetry)
            .timeoutMs((effective.getTimeout() != null ? effective.getTimeout() : defaultTimeout).toMillis())
            .processAt(delayed ? processAt : null)
            .enqueuedAt(now);
        if (effective.getTaskId() != null) {
            builder.id(effective.getTaskId());
        }
        Task task = builder.build();
        
        broker.enqueue(effective.getQueue(), task);
        if (metricsCollector != null) {
            metricsCollector.recordEnqueued(effective.getQueue(), taskType);
        }
        logger.debug("Enqueued task {} of type {} on queue {}", task.getId(), taskType, effective.getQueue());
        return TaskInfo.of(task);
    }
    
    public TaskInfo enqueueCritical(String taskType, Object payload)
            throws QueueUnknownException, SerializationFailedException, BrokerUnavailableException {
        return enqueue(taskType, payload, EnqueueOptions.onQueue(QueueDefinition.CRITICAL));
    }
    
    public TaskInfo enqueueDefault(String taskType, Object payload)
            throws QueueUnknownException, SerializationFailedException, BrokerUnavailableException {
        return enqueue(taskType, payload, EnqueueOptions.onQueue(QueueDefinition.DEFAULT));
    }
    
    public TaskInfo enqueueLow(String taskType, Object payload)
            throws QueueUnknownException, SerializationFailedException, BrokerUnavailableException {
        return enqueue(taskType, payload, EnqueueOptions.onQueue(QueueDefinition.LOW));
    }
}
