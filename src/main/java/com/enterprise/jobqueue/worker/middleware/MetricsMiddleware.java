package com.enterprise.jobqueue.worker.middleware;

import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskHandler;
import com.enterprise.jobqueue.exception.TaskTimeoutException;
import com.enterprise.jobqueue.monitoring.MetricsCollector;
import com.enterprise.jobqueue.worker.TaskMiddleware;

import java.time.Duration;

/**
 * Records the processed counter and duration timer of every attempt
 */
public class MetricsMiddleware implements TaskMiddleware {
    
    private final MetricsCollector metricsCollector;
    
    public MetricsMiddleware(MetricsCollector metricsCollector) {
        this.metricsCollector = metricsCollector;
    }
    
    @Override
    public TaskHandler apply(TaskHandler next) {
        return (context, payload) -> {
            Task task = context.getTask();
            long start = System.nanoTime();
            String status = MetricsCollector.STATUS_FAILURE;
            try {
                next.handle(context, payload);
                status = MetricsCollector.STATUS_SUCCESS;
            } catch (TaskTimeoutException e) {
                metricsCollector.recordTimeout(task.getType());
                throw e;
            } finally {
                metricsCollector.recordDuration(task.getQueue(), task.getType(),
                    Duration.ofNanos(System.nanoTime() - start));
                metricsCollector.recordProcessed(task.getQueue(), task.getType(), status);
            }
        };
    }
}
