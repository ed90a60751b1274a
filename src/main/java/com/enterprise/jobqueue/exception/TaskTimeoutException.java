package com.enterprise.jobqueue.exception;

import java.time.Duration;

/**
 * Thrown when a handler runs past its processing deadline
 */
public class TaskTimeoutException extends Exception {
    
    private final Duration timeout;
    
    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task " + taskId + " exceeded its processing deadline of " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }
    
    public Duration getTimeout() {
        return timeout;
    }
}
