package com.enterprise.jobqueue.examples;

import com.enterprise.jobqueue.core.TaskCodec;
import com.enterprise.jobqueue.core.TaskContext;
import com.enterprise.jobqueue.core.TaskHandler;
import com.enterprise.jobqueue.exception.SerializationFailedException;
import com.enterprise.jobqueue.exception.SkipRetryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Archives an order. A payload without a valid order id can never succeed,
 * so it is rejected without retry.
 */
public class ArchiveOrderHandler implements TaskHandler {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveOrderHandler.class);

    public static final String TASK_TYPE = "order:archive";

    private final TaskCodec codec;

    public ArchiveOrderHandler(TaskCodec codec) {
        this.codec = codec;
    }

    @Override
    public void handle(TaskContext context, byte[] payload) throws Exception {
        String taskId = context.getTask().getId();

        ArchiveOrderPayload order;
        try {
            order = codec.decodePayload(payload, ArchiveOrderPayload.class);
        } catch (SerializationFailedException e) {
            logger.error("Invalid payload for task {} of type {}", taskId, TASK_TYPE, e);
            throw new SkipRetryException("Invalid order archive payload", e);
        }

        if (order == null || order.getOrderId() == null) {
            logger.error("Missing order_id for task {} of type {}", taskId, TASK_TYPE);
            throw new SkipRetryException("order_id is required");
        }

        if (context.isCancelled()) {
            throw new InterruptedException("Archive of order " + order.getOrderId() + " cancelled");
        }

        logger.info("Archiving order {} for task {}", order.getOrderId(), taskId);
        context.writeResult(("archived:" + order.getOrderId()).getBytes(StandardCharsets.UTF_8));
        logger.info("Order {} archived", order.getOrderId());
    }
}
