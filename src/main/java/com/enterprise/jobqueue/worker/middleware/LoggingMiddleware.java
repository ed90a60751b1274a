package com.enterprise.jobqueue.worker.middleware;

import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskHandler;
import com.enterprise.jobqueue.worker.TaskMiddleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured log line per attempt; the task identity is kept in the MDC while it runs
 */
public class LoggingMiddleware implements TaskMiddleware {
    
    private static final Logger logger = LoggerFactory.getLogger(LoggingMiddleware.class);
    
    public static final String MDC_TASK_ID = "task_id";
    public static final String MDC_TASK_TYPE = "task_type";
    public static final String MDC_QUEUE = "queue";
    public static final String MDC_RETRY_COUNT = "retry_count";
    
    @Override
    public TaskHandler apply(TaskHandler next) {
        return (context, payload) -> {
            Task task = context.getTask();
            MDC.put(MDC_TASK_ID, task.getId());
            MDC.put(MDC_TASK_TYPE, task.getType());
            MDC.put(MDC_QUEUE, task.getQueue());
            MDC.put(MDC_RETRY_COUNT, String.valueOf(task.getRetryCount()));
            long start = System.currentTimeMillis();
            try {
                logger.debug("Processing task {} of type {}", task.getId(), task.getType());
                next.handle(context, payload);
                logger.info("Task processed: type={} id={} retry_count={} duration={}ms success=true",
                           task.getType(), task.getId(), task.getRetryCount(), System.currentTimeMillis() - start);
            } catch (Exception e) {
                logger.warn("Task processed: type={} id={} retry_count={} duration={}ms success=false error={}",
                           task.getType(), task.getId(), task.getRetryCount(),
                           System.currentTimeMillis() - start, e.getMessage());
                throw e;
            } finally {
                MDC.remove(MDC_TASK_ID);
                MDC.remove(MDC_TASK_TYPE);
                MDC.remove(MDC_QUEUE);
                MDC.remove(MDC_RETRY_COUNT);
            }
        };
    }
}
