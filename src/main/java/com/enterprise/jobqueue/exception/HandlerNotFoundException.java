package com.enterprise.jobqueue.exception;

/**
 * Exception thrown when no handler is registered for a task type
 */
public class HandlerNotFoundException extends JobQueueException {
    
    private final String taskType;
    
    public HandlerNotFoundException(String taskType) {
        super(ErrorCode.INTERNAL, "No handler registered for task type: " + taskType);
        this.taskType = taskType;
    }
    
    public String getTaskType() {
        return taskType;
    }
}
