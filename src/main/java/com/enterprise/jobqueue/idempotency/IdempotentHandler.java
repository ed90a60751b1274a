package com.enterprise.jobqueue.idempotency;

import com.enterprise.jobqueue.core.TaskContext;
import com.enterprise.jobqueue.core.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Decorates a handler with an idempotency guard. Duplicates return normally
 * without running the delegate, so they are never retried.
 */
public class IdempotentHandler implements TaskHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(IdempotentHandler.class);
    
    private final TaskHandler delegate;
    private final IdempotencyGuard guard;
    private final KeyExtractor keyExtractor;
    private final Duration ttl;
    
    public IdempotentHandler(TaskHandler delegate, IdempotencyGuard guard, KeyExtractor keyExtractor, Duration ttl) {
        if (delegate == null || guard == null || keyExtractor == null) {
            throw new IllegalArgumentException("delegate, guard and keyExtractor are required");
        }
        this.delegate = delegate;
        this.guard = guard;
        this.keyExtractor = keyExtractor;
        this.ttl = ttl != null ? ttl : guard.getDefaultTtl();
    }
    
    public static IdempotentHandler wrap(TaskHandler delegate, IdempotencyGuard guard) {
        return new IdempotentHandler(delegate, guard, KeyExtractor.taskId(), null);
    }
    
    @Override
    public void handle(TaskContext context, byte[] payload) throws Exception {
        String key = keyExtractor.extract(context.getTask());
        Reservation reservation = guard.reserve(key, ttl);
        if (reservation.isAlreadyHandled()) {
            logger.info("Duplicate task {} of type {} skipped (key {})",
                context.getTask().getId(), context.getTask().getType(), key);
            reservation.getCachedResult().ifPresent(context::writeResult);
            return;
        }
        
        boolean completed = false;
        try {
            delegate.handle(context, payload);
            completed = true;
        } finally {
            if (reservation.isHeld()) {
                if (completed) {
                    guard.release(key, context.getResult().orElse(null), ttl);
                } else {
                    guard.abandon(key);
                }
            }
        }
    }
}
