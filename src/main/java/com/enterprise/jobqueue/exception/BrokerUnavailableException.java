package com.enterprise.jobqueue.exception;

/**
 * Exception thrown when the broker's backing store cannot be reached.
 * This is an infrastructure failure, never a task failure.
 */
public class BrokerUnavailableException extends JobQueueException {
    
    public BrokerUnavailableException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL, message, cause);
    }
}
