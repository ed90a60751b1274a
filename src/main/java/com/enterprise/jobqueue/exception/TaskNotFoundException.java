package com.enterprise.jobqueue.exception;

/**
 * Exception thrown when a requested task is not found, or is no longer in the
 * state the operation requires
 */
public class TaskNotFoundException extends JobQueueException {
    
    private final String taskId;
    
    public TaskNotFoundException(String taskId) {
        super(ErrorCode.NOT_FOUND, "Task not found: " + taskId);
        this.taskId = taskId;
    }
    
    public String getTaskId() {
        return taskId;
    }
}
