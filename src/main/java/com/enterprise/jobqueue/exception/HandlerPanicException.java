package com.enterprise.jobqueue.exception;

/**
 * Wraps an unchecked exception or error that escaped a task handler
 */
public class HandlerPanicException extends Exception {
    
    public HandlerPanicException(String taskType, Throwable cause) {
        super("panic recovered in handler for " + taskType + ": " + cause, cause);
    }
}
