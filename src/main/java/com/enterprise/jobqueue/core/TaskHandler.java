package com.enterprise.jobqueue.core;

/**
 * Handler for a single task type.
 * A normal return completes the task. Throwing a
 * {@link com.enterprise.jobqueue.exception.SkipRetryException} fails it permanently,
 * any other exception schedules a retry while the retry budget lasts.
 */
@FunctionalInterface
public interface TaskHandler {
    
    /**
     * Process the task payload
     */
    void handle(TaskContext context, byte[] payload) throws Exception;
}
