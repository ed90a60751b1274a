package com.enterprise.jobqueue.worker.middleware;

import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskHandler;
import com.enterprise.jobqueue.exception.HandlerPanicException;
import com.enterprise.jobqueue.monitoring.MetricsCollector;
import com.enterprise.jobqueue.worker.TaskMiddleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts unchecked exceptions and errors escaping a handler into
 * {@link HandlerPanicException} so a misbehaving handler never kills a worker loop.
 * A {@link VirtualMachineError} is left to propagate.
 */
public class RecoveryMiddleware implements TaskMiddleware {
    
    private static final Logger logger = LoggerFactory.getLogger(RecoveryMiddleware.class);
    
    private final MetricsCollector metricsCollector;
    
    public RecoveryMiddleware() {
        this(null);
    }
    
    public RecoveryMiddleware(MetricsCollector metricsCollector) {
        this.metricsCollector = metricsCollector;
    }
    
    @Override
    public TaskHandler apply(TaskHandler next) {
        return (context, payload) -> {
            try {
                next.handle(context, payload);
            } catch (RuntimeException e) {
                throw panic(context.getTask(), e);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Error e) {
                throw panic(context.getTask(), e);
            }
        };
    }
    
    private HandlerPanicException panic(Task task, Throwable cause) {
        logger.error("Recovered from panic in handler for task {} of type {}", task.getId(), task.getType(), cause);
        if (metricsCollector != null) {
            metricsCollector.recordPanic(task.getType());
        }
        return new HandlerPanicException(task.getType(), cause);
    }
}
