package com.enterprise.jobqueue.inspector;

import com.enterprise.jobqueue.core.Task;

import java.time.Instant;

/**
 * Admin view of a task in the FAILED state
 */
public final class FailedJobInfo {
    
    private final String taskId;
    private final String type;
    private final String payloadPreview;
    private final String errorMessage;
    private final Instant failedAt;
    private final int retryCount;
    private final int maxRetry;
    
    private FailedJobInfo(Task task) {
        this.taskId = task.getId();
        this.type = task.getType();
        this.payloadPreview = PayloadPreview.of(task.getPayload());
        this.errorMessage = task.getLastError();
        this.failedAt = task.getLastFailedAt();
        this.retryCount = task.getRetryCount();
        this.maxRetry = task.getMaxRetry();
    }
    
    public static FailedJobInfo from(Task task) {
        return new FailedJobInfo(task);
    }
    
    public String getTaskId() { return taskId; }
    
    public String getType() { return type; }
    
    public String getPayloadPreview() { return payloadPreview; }
    
    public String getErrorMessage() { return errorMessage; }
    
    public Instant getFailedAt() { return failedAt; }
    
    public int getRetryCount() { return retryCount; }
    
    public int getMaxRetry() { return maxRetry; }
}
