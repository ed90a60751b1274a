package com.enterprise.jobqueue.exception;

/**
 * Base exception for job queue related errors
 */
public class JobQueueException extends Exception {
    
    private final ErrorCode errorCode;
    
    public JobQueueException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public JobQueueException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
