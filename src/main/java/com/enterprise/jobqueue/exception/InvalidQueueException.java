package com.enterprise.jobqueue.exception;

/**
 * Exception thrown by the queue inspector for a queue name that is not configured
 */
public class InvalidQueueException extends JobQueueException {
    
    private final String queueName;
    
    public InvalidQueueException(String queueName) {
        super(ErrorCode.BAD_REQUEST, "Invalid queue name: " + queueName);
        this.queueName = queueName;
    }
    
    public String getQueueName() {
        return queueName;
    }
}
