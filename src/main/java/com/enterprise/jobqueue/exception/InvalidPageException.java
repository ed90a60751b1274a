package com.enterprise.jobqueue.exception;

/**
 * Exception thrown for a page or page size below 1
 */
public class InvalidPageException extends JobQueueException {
    
    public InvalidPageException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }
}
