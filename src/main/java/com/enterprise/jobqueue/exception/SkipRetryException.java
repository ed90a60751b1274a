package com.enterprise.jobqueue.exception;

/**
 * Thrown by a handler to mark a failure as permanent. The task moves straight
 * to FAILED without consuming its retry budget. The marker is honoured anywhere
 * in the cause chain.
 */
public class SkipRetryException extends Exception {
    
    public SkipRetryException(String message) {
        super(message);
    }
    
    public SkipRetryException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * Whether the given error, or any of its causes, carries the skip-retry marker
     */
    public static boolean isMarked(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 32) {
            if (current instanceof SkipRetryException) {
                return true;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
