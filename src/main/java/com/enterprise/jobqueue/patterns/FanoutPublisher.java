package com.enterprise.jobqueue.patterns;

import com.enterprise.jobqueue.client.EnqueueOptions;
import com.enterprise.jobqueue.client.TaskClient;
import com.enterprise.jobqueue.client.TaskInfo;
import com.enterprise.jobqueue.core.TaskCodec;
import com.enterprise.jobqueue.exception.JobQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Publishes an event as one independent task per registered handler, so a
 * failing handler retries on its own without affecting the others.
 */
public class FanoutPublisher {

    private static final Logger logger = LoggerFactory.getLogger(FanoutPublisher.class);

    public static final String TASK_TYPE_PREFIX = "fanout:";

    private final TaskClient client;
    private final TaskCodec codec;
    private final FanoutRegistry registry;
    private final Clock clock;

    public FanoutPublisher(TaskClient client, TaskCodec codec, FanoutRegistry registry, Clock clock) {
        this.client = client;
        this.codec = codec;
        this.registry = registry;
        this.clock = clock;
    }

    public static String taskType(String eventType, String handlerId) {
        return TASK_TYPE_PREFIX + eventType + ":" + handlerId;
    }

    /**
     * Enqueue the event for every handler. Failures are collected per handler
     * and returned; an empty list means every handler got its task.
     */
    public List<FanoutError> publish(FanoutEvent event) {
        FanoutEvent stamped = event.getTimestamp() == null ? event.withTimestamp(clock.instant()) : event;

        List<FanoutRegistry.Registration> registrations = registry.handlers(stamped.getType());
        if (registrations.isEmpty()) {
            logger.warn("No handlers registered for event type {}", stamped.getType());
            return Collections.emptyList();
        }

        List<FanoutError> errors = new ArrayList<>();
        for (FanoutRegistry.Registration registration : registrations) {
            String taskType = taskType(stamped.getType(), registration.getHandlerId());
            try {
                byte[] payload = codec.encodePayload(stamped);
                TaskInfo info = client.enqueueRaw(taskType, payload, EnqueueOptions.onQueue(registration.getQueue()));
                logger.debug("Fan-out task {} enqueued for handler {} on {}",
                            info.getId(), registration.getHandlerId(), info.getQueue());
            } catch (JobQueueException e) {
                logger.error("Fan-out enqueue failed for event type {} handler {}",
                            stamped.getType(), registration.getHandlerId(), e);
                errors.add(new FanoutError(registration.getHandlerId(), e));
            }
        }
        return errors;
    }

    /**
     * Enqueue failure for one handler
     */
    public static final class FanoutError {
        private final String handlerId;
        private final JobQueueException cause;

        FanoutError(String handlerId, JobQueueException cause) {
            this.handlerId = handlerId;
            this.cause = cause;
        }

        public String getHandlerId() { return handlerId; }
        public JobQueueException getCause() { return cause; }
    }
}
