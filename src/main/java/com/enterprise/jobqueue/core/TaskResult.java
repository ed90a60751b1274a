package com.enterprise.jobqueue.core;

import com.enterprise.jobqueue.exception.SkipRetryException;

import java.time.Duration;

/**
 * Outcome of a single task attempt
 */
public final class TaskResult {
    
    private final boolean success;
    private final Throwable exception;
    private final Duration duration;
    
    private TaskResult(boolean success, Throwable exception, Duration duration) {
        this.success = success;
        this.exception = exception;
        this.duration = duration;
    }
    
    public static TaskResult success(Duration duration) {
        return new TaskResult(true, null, duration);
    }
    
    public static TaskResult failure(Throwable exception, Duration duration) {
        if (exception == null) {
            throw new IllegalArgumentException("A failed result needs its exception");
        }
        return new TaskResult(false, exception, duration);
    }
    
    public boolean isSuccess() {
        return success;
    }
    
    public Throwable getException() {
        return exception;
    }
    
    public String getErrorMessage() {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        return message != null ? message : exception.getClass().getSimpleName();
    }
    
    /**
     * Whether the failure was marked permanent by the handler
     */
    public boolean isSkipRetry() {
        return exception != null && SkipRetryException.isMarked(exception);
    }
    
    public Duration getDuration() {
        return duration;
    }
    
    @Override
    public String toString() {
        return success ? "TaskResult{success, " + duration.toMillis() + "ms}"
            : "TaskResult{failure=" + getErrorMessage() + ", " + duration.toMillis() + "ms}";
    }
}
