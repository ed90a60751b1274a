package com.enterprise.jobqueue.patterns;

import com.enterprise.jobqueue.core.TaskCodec;
import com.enterprise.jobqueue.core.TaskContext;
import com.enterprise.jobqueue.core.TaskHandler;
import com.enterprise.jobqueue.core.TaskRegistry;
import com.enterprise.jobqueue.exception.SerializationFailedException;
import com.enterprise.jobqueue.exception.SkipRetryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Worker side of fan-out: routes a {@code fanout:{event}:{handler}} task to the
 * registered event handler. Unparseable types, unknown handlers and malformed
 * events are not retried.
 */
public class FanoutDispatcher implements TaskHandler {

    private static final Logger logger = LoggerFactory.getLogger(FanoutDispatcher.class);

    private final FanoutRegistry registry;
    private final TaskCodec codec;

    public FanoutDispatcher(FanoutRegistry registry, TaskCodec codec) {
        this.registry = registry;
        this.codec = codec;
    }

    /**
     * Register this dispatcher for every handler currently in the fan-out registry
     */
    public TaskRegistry.Builder registerAll(TaskRegistry.Builder builder, Iterable<String> eventTypes) {
        for (String eventType : eventTypes) {
            for (FanoutRegistry.Registration registration : registry.handlers(eventType)) {
                builder.register(FanoutPublisher.taskType(eventType, registration.getHandlerId()), this);
            }
        }
        return builder;
    }

    @Override
    public void handle(TaskContext context, byte[] payload) throws Exception {
        String taskType = context.getTask().getType();
        if (!taskType.startsWith(FanoutPublisher.TASK_TYPE_PREFIX)) {
            throw new SkipRetryException("Invalid fan-out task type: " + taskType);
        }

        String remaining = taskType.substring(FanoutPublisher.TASK_TYPE_PREFIX.length());
        int separator = remaining.lastIndexOf(':');
        if (separator <= 0 || separator == remaining.length() - 1) {
            throw new SkipRetryException("Invalid fan-out task type: " + taskType);
        }
        String eventType = remaining.substring(0, separator);
        String handlerId = remaining.substring(separator + 1);

        Optional<FanoutRegistry.Registration> registration = registry.find(eventType, handlerId);
        if (!registration.isPresent()) {
            throw new SkipRetryException("Handler " + handlerId + " not found for event " + eventType);
        }

        FanoutEvent event;
        try {
            event = codec.decodePayload(payload, FanoutEvent.class);
        } catch (SerializationFailedException e) {
            throw new SkipRetryException("Malformed fan-out event for " + taskType, e);
        }

        logger.debug("Dispatching event {} to handler {}", eventType, handlerId);
        registration.get().getHandler().handle(context, event);
    }
}
