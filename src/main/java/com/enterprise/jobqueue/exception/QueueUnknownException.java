package com.enterprise.jobqueue.exception;

/**
 * Exception thrown when a producer enqueues into a queue that is not configured
 */
public class QueueUnknownException extends JobQueueException {
    
    private final String queueName;
    
    public QueueUnknownException(String queueName) {
        super(ErrorCode.BAD_REQUEST, "Unknown queue: " + queueName);
        this.queueName = queueName;
    }
    
    public String getQueueName() {
        return queueName;
    }
}
