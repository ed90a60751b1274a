package com.enterprise.jobqueue.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Default, immutable implementation of the Task interface
 */
public class TaskImpl implements Task {
    
    private final String id;
    private final String type;
    private final byte[] payload;
    private final String queue;
    private final TaskState state;
    private final int retryCount;
    private final int maxRetry;
    private final Instant enqueuedAt;
    private final Instant processedAt;
    private final String lastError;
    private final Instant lastFailedAt;
    private final Instant processAt;
    private final long timeoutMs;
    
    @JsonCreator
    public TaskImpl(@JsonProperty("id") String id,
                    @JsonProperty("type") String type,
                    @JsonProperty("payload") byte[] payload,
                    @JsonProperty("queue") String queue,
                    @JsonProperty("state") TaskState state,
                    @JsonProperty("retryCount") int retryCount,
                    @JsonProperty("maxRetry") int maxRetry,
                    @JsonProperty("enqueuedAt") Instant enqueuedAt,
                    @JsonProperty("processedAt") Instant processedAt,
                    @JsonProperty("lastError") String lastError,
                    @JsonProperty("lastFailedAt") Instant lastFailedAt,
                    @JsonProperty("processAt") Instant processAt,
                    @JsonProperty("timeoutMs") long timeoutMs) {
        this.id = id;
        this.type = type;
        this.payload = payload != null ? payload : new byte[0];
        this.queue = queue;
        this.state = state;
        this.retryCount = retryCount;
        this.maxRetry = maxRetry;
        this.enqueuedAt = enqueuedAt;
        this.processedAt = processedAt;
        this.lastError = lastError;
        this.lastFailedAt = lastFailedAt;
        this.processAt = processAt;
        this.timeoutMs = timeoutMs;
    }
    
    @Override
    public String getId() { return id; }
    
    @Override
    public String getType() { return type; }
    
    @Override
    public byte[] getPayload() { return payload.clone(); }
    
    @Override
    public String getQueue() { return queue; }
    
    @Override
    public TaskState getState() { return state; }
    
    @Override
    public int getRetryCount() { return retryCount; }
    
    @Override
    public int getMaxRetry() { return maxRetry; }
    
    @Override
    public Instant getEnqueuedAt() { return enqueuedAt; }
    
    @Override
    public Instant getProcessedAt() { return processedAt; }
    
    @Override
    public String getLastError() { return lastError; }
    
    @Override
    public Instant getLastFailedAt() { return lastFailedAt; }
    
    @Override
    public Instant getProcessAt() { return processAt; }
    
    @Override
    public long getTimeoutMs() { return timeoutMs; }
    
    @Override
    public Task transitionTo(TaskState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Illegal transition %s -> %s for task %s", state, next, id));
        }
        return toBuilder().state(next).build();
    }
    
    @Override
    public Task withQueue(String queue) {
        return toBuilder().queue(queue).build();
    }
    
    @Override
    public Task withRetryCount(int retryCount) {
        return toBuilder().retryCount(retryCount).build();
    }
    
    @Override
    public Task withProcessAt(Instant processAt) {
        return toBuilder().processAt(processAt).build();
    }
    
    @Override
    public Task withProcessedAt(Instant processedAt) {
        return toBuilder().processedAt(processedAt).build();
    }
    
    @Override
    public Task withFailure(String lastError, Instant lastFailedAt) {
        return toBuilder().lastError(lastError).lastFailedAt(lastFailedAt).build();
    }
    
    @Override
    public Task withEnqueuedAt(Instant enqueuedAt) {
        return toBuilder().enqueuedAt(enqueuedAt).build();
    }
    
    private Builder toBuilder() {
        return new Builder()
            .id(id)
            .type(type)
            .payload(payload)
            .queue(queue)
            .state(state)
            .retryCount(retryCount)
            .maxRetry(maxRetry)
            .enqueuedAt(enqueuedAt)
            .processedAt(processedAt)
            .lastError(lastError)
            .lastFailedAt(lastFailedAt)
            .processAt(processAt)
            .timeoutMs(timeoutMs);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskImpl)) return false;
        TaskImpl other = (TaskImpl) o;
        return id.equals(other.id) && state == other.state && retryCount == other.retryCount;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(id, state, retryCount);
    }
    
    @Override
    public String toString() {
        return "Task{id=" + id + ", type=" + type + ", queue=" + queue + ", state=" + state
            + ", retry=" + retryCount + "/" + maxRetry + "}";
    }
    
    /**
     * Builder for creating Task instances
     */
    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String type;
        private byte[] payload = new byte[0];
        private String queue = "default";
        private TaskState state = TaskState.PENDING;
        private int retryCount = 0;
        private int maxRetry = 25;
        private Instant enqueuedAt = Instant.now();
        private Instant processedAt;
        private String lastError;
        private Instant lastFailedAt;
        private Instant processAt;
        private long timeoutMs = 30 * 60 * 1000L; // 30 minutes
        
        public Builder id(String id) {
            this.id = id;
            return this;
        }
        
        public Builder type(String type) {
            this.type = type;
            return this;
        }
        
        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }
        
        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }
        
        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }
        
        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }
        
        public Builder maxRetry(int maxRetry) {
            this.maxRetry = maxRetry;
            return this;
        }
        
        public Builder enqueuedAt(Instant enqueuedAt) {
            this.enqueuedAt = enqueuedAt;
            return this;
        }
        
        public Builder processedAt(Instant processedAt) {
            this.processedAt = processedAt;
            return this;
        }
        
        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }
        
        public Builder lastFailedAt(Instant lastFailedAt) {
            this.lastFailedAt = lastFailedAt;
            return this;
        }
        
        public Builder processAt(Instant processAt) {
            this.processAt = processAt;
            return this;
        }
        
        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }
        
        public TaskImpl build() {
            if (id == null || id.trim().isEmpty()) {
                throw new IllegalArgumentException("Task id is required");
            }
            if (type == null || type.trim().isEmpty()) {
                throw new IllegalArgumentException("Task type is required");
            }
            if (state == null) {
                throw new IllegalArgumentException("Task state is required");
            }
            if (maxRetry < 0) {
                throw new IllegalArgumentException("maxRetry cannot be negative");
            }
            if (retryCount < 0 || retryCount > maxRetry) {
                throw new IllegalArgumentException(
                    "retryCount must be between 0 and maxRetry (" + maxRetry + "): " + retryCount);
            }
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("Task timeout must be positive");
            }
            return new TaskImpl(id, type, payload, queue, state, retryCount, maxRetry,
                enqueuedAt, processedAt, lastError, lastFailedAt, processAt, timeoutMs);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
}
