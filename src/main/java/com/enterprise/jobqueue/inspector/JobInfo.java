package com.enterprise.jobqueue.inspector;

import com.enterprise.jobqueue.core.Task;

import java.time.Instant;

/**
 * Admin view of a queued or running task
 */
public final class JobInfo {
    
    private final String taskId;
    private final String type;
    private final String payloadPreview;
    private final String state;
    private final String queue;
    private final int maxRetry;
    private final int retried;
    private final Instant createdAt;
    private final Instant nextProcessAt;
    private final String lastError;
    
    private JobInfo(Task task) {
        this.taskId = task.getId();
        this.type = task.getType();
        this.payloadPreview = PayloadPreview.of(task.getPayload());
        this.state = task.getState().name().toLowerCase();
        this.queue = task.getQueue();
        this.maxRetry = task.getMaxRetry();
        this.retried = task.getRetryCount();
        this.createdAt = task.getEnqueuedAt();
        this.nextProcessAt = task.getProcessAt();
        this.lastError = task.getLastError();
    }
    
    public static JobInfo from(Task task) {
        return new JobInfo(task);
    }
    
    public String getTaskId() { return taskId; }
    
    public String getType() { return type; }
    
    public String getPayloadPreview() { return payloadPreview; }
    
    public String getState() { return state; }
    
    public String getQueue() { return queue; }
    
    public int getMaxRetry() { return maxRetry; }
    
    public int getRetried() { return retried; }
    
    public Instant getCreatedAt() { return createdAt; }
    
    public Instant getNextProcessAt() { return nextProcessAt; }
    
    public String getLastError() { return lastError; }
}
