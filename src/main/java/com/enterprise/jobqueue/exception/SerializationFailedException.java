package com.enterprise.jobqueue.exception;

/**
 * Exception thrown when a payload or task record cannot be (de)serialized
 */
public class SerializationFailedException extends JobQueueException {
    
    public SerializationFailedException(String message, Throwable cause) {
        super(ErrorCode.BAD_REQUEST, message, cause);
    }
}
