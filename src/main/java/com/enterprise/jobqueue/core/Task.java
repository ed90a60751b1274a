package com.enterprise.jobqueue.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;

/**
 * A unit of work stored by the broker and executed by a worker
 */
public interface Task {
    
    /**
     * Unique identifier, stable across retries
     */
    String getId();
    
    /**
     * Handler routing key, by convention "{domain}:{action}"
     */
    String getType();
    
    /**
     * Serialized payload handed to the handler
     */
    byte[] getPayload();
    
    /**
     * Queue the task was enqueued into
     */
    String getQueue();
    
    TaskState getState();
    
    /**
     * Number of retries consumed so far
     */
    int getRetryCount();
    
    /**
     * Maximum number of retries before the task fails permanently
     */
    int getMaxRetry();
    
    Instant getEnqueuedAt();
    
    /**
     * When the last attempt started, null if it never ran
     */
    Instant getProcessedAt();
    
    String getLastError();
    
    Instant getLastFailedAt();
    
    /**
     * Earliest time the task may run, null for immediately
     */
    Instant getProcessAt();
    
    /**
     * Processing deadline per attempt in milliseconds
     */
    long getTimeoutMs();
    
    @JsonIgnore
    default Duration getTimeout() {
        return Duration.ofMillis(getTimeoutMs());
    }
    
    /**
     * Create a copy of this task in the given state
     *
     * @throws IllegalStateException if the state machine forbids the transition
     */
    Task transitionTo(TaskState next);
    
    Task withQueue(String queue);
    
    Task withRetryCount(int retryCount);
    
    Task withProcessAt(Instant processAt);
    
    Task withProcessedAt(Instant processedAt);
    
    Task withFailure(String lastError, Instant lastFailedAt);
    
    Task withEnqueuedAt(Instant enqueuedAt);
}
