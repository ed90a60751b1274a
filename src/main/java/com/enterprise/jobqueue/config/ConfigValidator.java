package com.enterprise.jobqueue.config;

import com.enterprise.jobqueue.broker.QueueDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates job queue configuration
 */
public class ConfigValidator {
    
    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(JobQueueConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        
        validateWorkerConfig(config.getWorkerConfig(), errors);
        validateQueueConfig(config.getQueueConfig(), errors);
        validateRetryConfig(config.getRetryConfig(), errors);
        validateIdempotencyConfig(config.getIdempotencyConfig(), errors);
        validateMonitoringConfig(config.getMonitoringConfig(), errors);
        
        return errors;
    }
    
    private void validateWorkerConfig(JobQueueConfig.WorkerConfig config, List<ValidationError> errors) {
        if (config.getConcurrency() <= 0) {
            errors.add(new ValidationError("worker.concurrency", 
                "Concurrency must be greater than 0"));
        }
        
        if (config.getShutdownTimeout().isNegative()) {
            errors.add(new ValidationError("worker.shutdownTimeout", 
                "Shutdown timeout cannot be negative"));
        }
        
        if (config.getPollInterval().isNegative() || config.getPollInterval().isZero()) {
            errors.add(new ValidationError("worker.pollInterval", 
                "Poll interval must be positive"));
        }
        
        if (config.getJanitorInterval().isNegative() || config.getJanitorInterval().isZero()) {
            errors.add(new ValidationError("worker.janitorInterval", 
                "Janitor interval must be positive"));
        }
        
        if (config.getDefaultTaskTimeout().isNegative() || config.getDefaultTaskTimeout().isZero()) {
            errors.add(new ValidationError("worker.defaultTaskTimeout", 
                "Default task timeout must be positive"));
        }
    }
    
    private void validateQueueConfig(JobQueueConfig.QueueConfig config, List<ValidationError> errors) {
        if (config.getQueues().isEmpty()) {
            errors.add(new ValidationError("queue.queues", 
                "At least one queue is required"));
        }
        
        Set<String> names = new HashSet<>();
        for (QueueDefinition queue : config.getQueues()) {
            if (!names.add(queue.getName())) {
                errors.add(new ValidationError("queue.queues", 
                    "Duplicate queue name: " + queue.getName()));
            }
        }
        
        if (config.getDbPath() != null && config.getDbPath().trim().isEmpty()) {
            errors.add(new ValidationError("queue.dbPath", 
                "Database path cannot be blank, leave it unset for an in-memory store"));
        }
        
        if (config.getCompletedRetention().isNegative()) {
            errors.add(new ValidationError("queue.completedRetention", 
                "Completed retention cannot be negative"));
        }
    }
    
    private void validateRetryConfig(JobQueueConfig.RetryConfig config, List<ValidationError> errors) {
        if (config.getDefaultMaxRetry() < 0) {
            errors.add(new ValidationError("retry.defaultMaxRetry", 
                "Maximum retries cannot be negative"));
        }
        
        if (config.getBaseDelay().isNegative()) {
            errors.add(new ValidationError("retry.baseDelay", 
                "Base delay cannot be negative"));
        }
        
        if (config.getBackoffMultiplier() < 1.0) {
            errors.add(new ValidationError("retry.backoffMultiplier", 
                "Backoff multiplier must be at least 1.0"));
        }
        
        if (config.getMaxDelay().isNegative()) {
            errors.add(new ValidationError("retry.maxDelay", 
                "Maximum delay cannot be negative"));
        }
        
        if (config.getBaseDelay().compareTo(config.getMaxDelay()) > 0) {
            errors.add(new ValidationError("retry.delayRange", 
                "Base delay cannot be greater than maximum delay"));
        }
    }
    
    private void validateIdempotencyConfig(JobQueueConfig.IdempotencyConfig config, List<ValidationError> errors) {
        if (config.getFailMode() == null) {
            errors.add(new ValidationError("idempotency.failMode", 
                "Fail mode is required"));
        }
        
        if (config.getKeyPrefix() == null || config.getKeyPrefix().isEmpty()) {
            errors.add(new ValidationError("idempotency.keyPrefix", 
                "Key prefix is required"));
        }
        
        if (config.getTtl().isNegative() || config.getTtl().isZero()) {
            errors.add(new ValidationError("idempotency.ttl", 
                "TTL must be positive"));
        }
    }
    
    private void validateMonitoringConfig(JobQueueConfig.MonitoringConfig config, List<ValidationError> errors) {
        if (config.getQueueDepthThreshold() <= 0) {
            errors.add(new ValidationError("monitoring.queueDepthThreshold", 
                "Queue depth threshold must be greater than 0"));
        }
    }
    
    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        
        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }
        
        public String getField() { return field; }
        public String getMessage() { return message; }
        
        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
