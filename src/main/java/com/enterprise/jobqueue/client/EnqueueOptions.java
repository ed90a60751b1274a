package com.enterprise.jobqueue.client;

import com.enterprise.jobqueue.broker.QueueDefinition;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-enqueue options. Unset values fall back to the client defaults.
 */
public final class EnqueueOptions {
    
    private final String queue;
    private final Integer maxRetry;
    private final Duration timeout;
    private final Instant processAt;
    private final Duration processIn;
    private final String taskId;
    
    private EnqueueOptions(Builder builder) {
        this.queue = builder.queue;
        this.maxRetry = builder.maxRetry;
        this.timeout = builder.timeout;
        this.processAt = builder.processAt;
        this.processIn = builder.processIn;
        this.taskId = builder.taskId;
    }
    
    public static EnqueueOptions defaults() {
        return builder().build();
    }
    
    public static EnqueueOptions onQueue(String queue) {
        return builder().queue(queue).build();
    }
    
    public String getQueue() { return queue; }
    
    public Integer getMaxRetry() { return maxRetry; }
    
    public Duration getTimeout() { return timeout; }
    
    public Instant getProcessAt() { return processAt; }
    
    public Duration getProcessIn() { return processIn; }
    
    public String getTaskId() { return taskId; }
    
    /**
     * Copy of these options targeting another queue
     */
    public EnqueueOptions withQueue(String queue) {
        return builder()
            .queue(queue)
            .maxRetry(maxRetry)
            .timeout(timeout)
            .processAt(processAt)
            .processIn(processIn)
            .taskId(taskId)
            .build();
    }
    
    /**
     * Builder for enqueue options
     */
    public static class Builder {
        private String queue = QueueDefinition.DEFAULT;
        private Integer maxRetry;
        private Duration timeout;
        private Instant processAt;
        private Duration processIn;
        private String taskId;
        
        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }
        
        public Builder maxRetry(Integer maxRetry) {
            this.maxRetry = maxRetry;
            return this;
        }
        
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }
        
        public Builder processAt(Instant processAt) {
            this.processAt = processAt;
            return this;
        }
        
        public Builder processIn(Duration processIn) {
            this.processIn = processIn;
            return this;
        }
        
        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }
        
        public EnqueueOptions build() {
            if (processAt != null && processIn != null) {
                throw new IllegalArgumentException("processAt and processIn are mutually exclusive");
            }
            if (maxRetry != null && maxRetry < 0) {
                throw new IllegalArgumentException("maxRetry cannot be negative");
            }
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            return new EnqueueOptions(this);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
}
