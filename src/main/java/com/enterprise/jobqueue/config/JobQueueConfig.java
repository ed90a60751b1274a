package com.enterprise.jobqueue.config;

import com.enterprise.jobqueue.broker.QueueDefinition;
import com.enterprise.jobqueue.idempotency.FailMode;
import com.enterprise.jobqueue.idempotency.IdempotencyGuard;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Configuration for the job queue
 */
public class JobQueueConfig {
    
    private final WorkerConfig workerConfig;
    private final QueueConfig queueConfig;
    private final RetryConfig retryConfig;
    private final IdempotencyConfig idempotencyConfig;
    private final MonitoringConfig monitoringConfig;
    
    public JobQueueConfig(WorkerConfig workerConfig, QueueConfig queueConfig, RetryConfig retryConfig,
                          IdempotencyConfig idempotencyConfig, MonitoringConfig monitoringConfig) {
        this.workerConfig = workerConfig;
        this.queueConfig = queueConfig;
        this.retryConfig = retryConfig;
        this.idempotencyConfig = idempotencyConfig;
        this.monitoringConfig = monitoringConfig;
    }
    
    public WorkerConfig getWorkerConfig() { return workerConfig; }
    public QueueConfig getQueueConfig() { return queueConfig; }
    public RetryConfig getRetryConfig() { return retryConfig; }
    public IdempotencyConfig getIdempotencyConfig() { return idempotencyConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }

    @Override
    public String toString() {
        return "JobQueueConfig{" +
                "concurrency=" + workerConfig.getConcurrency() +
                ", queues=" + queueConfig.getQueues() +
                ", dbPath=" + (queueConfig.getDbPath() == null ? "in-memory" : queueConfig.getDbPath()) +
                ", defaultMaxRetry=" + retryConfig.getDefaultMaxRetry() +
                ", failMode=" + idempotencyConfig.getFailMode() +
                ", metrics=" + monitoringConfig.isEnableMetrics() +
                ", tracing=" + monitoringConfig.isEnableTracing() +
                '}';
    }

    /**
     * Worker pool configuration
     */
    public static class WorkerConfig {
        private final int concurrency;
        private final Duration shutdownTimeout;
        private final Duration pollInterval;
        private final Duration janitorInterval;
        private final Duration defaultTaskTimeout;
        
        public WorkerConfig(int concurrency, Duration shutdownTimeout, Duration pollInterval,
                            Duration janitorInterval, Duration defaultTaskTimeout) {
            this.concurrency = concurrency;
            this.shutdownTimeout = shutdownTimeout;
            this.pollInterval = pollInterval;
            this.janitorInterval = janitorInterval;
            this.defaultTaskTimeout = defaultTaskTimeout;
        }
        
        public int getConcurrency() { return concurrency; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public Duration getPollInterval() { return pollInterval; }
        public Duration getJanitorInterval() { return janitorInterval; }
        public Duration getDefaultTaskTimeout() { return defaultTaskTimeout; }
    }
    
    /**
     * Queue and storage configuration. A null dbPath keeps everything in memory.
     */
    public static class QueueConfig {
        private final List<QueueDefinition> queues;
        private final String dbPath;
        private final Duration completedRetention;
        
        public QueueConfig(List<QueueDefinition> queues, String dbPath, Duration completedRetention) {
            this.queues = Collections.unmodifiableList(new ArrayList<>(queues));
            this.dbPath = dbPath;
            this.completedRetention = completedRetention;
        }
        
        public List<QueueDefinition> getQueues() { return queues; }
        public String getDbPath() { return dbPath; }
        public Duration getCompletedRetention() { return completedRetention; }
    }
    
    /**
     * Retry configuration
     */
    public static class RetryConfig {
        private final int defaultMaxRetry;
        private final Duration baseDelay;
        private final double backoffMultiplier;
        private final Duration maxDelay;
        private final boolean enableJitter;
        private final boolean panicsAreTerminal;
        
        public RetryConfig(int defaultMaxRetry, Duration baseDelay, double backoffMultiplier,
                           Duration maxDelay, boolean enableJitter, boolean panicsAreTerminal) {
            this.defaultMaxRetry = defaultMaxRetry;
            this.baseDelay = baseDelay;
            this.backoffMultiplier = backoffMultiplier;
            this.maxDelay = maxDelay;
            this.enableJitter = enableJitter;
            this.panicsAreTerminal = panicsAreTerminal;
        }
        
        public int getDefaultMaxRetry() { return defaultMaxRetry; }
        public Duration getBaseDelay() { return baseDelay; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public Duration getMaxDelay() { return maxDelay; }
        public boolean isEnableJitter() { return enableJitter; }
        public boolean isPanicsAreTerminal() { return panicsAreTerminal; }
    }
    
    /**
     * Idempotency guard configuration
     */
    public static class IdempotencyConfig {
        private final FailMode failMode;
        private final String keyPrefix;
        private final Duration ttl;
        
        public IdempotencyConfig(FailMode failMode, String keyPrefix, Duration ttl) {
            this.failMode = failMode;
            this.keyPrefix = keyPrefix;
            this.ttl = ttl;
        }
        
        public FailMode getFailMode() { return failMode; }
        public String getKeyPrefix() { return keyPrefix; }
        public Duration getTtl() { return ttl; }
    }
    
    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        private final boolean enableTracing;
        private final long queueDepthThreshold;
        
        public MonitoringConfig(boolean enableMetrics, boolean enableTracing, long queueDepthThreshold) {
            this.enableMetrics = enableMetrics;
            this.enableTracing = enableTracing;
            this.queueDepthThreshold = queueDepthThreshold;
        }
        
        public boolean isEnableMetrics() { return enableMetrics; }
        public boolean isEnableTracing() { return enableTracing; }
        public long getQueueDepthThreshold() { return queueDepthThreshold; }
    }
    
    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private WorkerConfig workerConfig = Defaults.defaultWorkerConfig();
        private QueueConfig queueConfig = Defaults.defaultQueueConfig();
        private RetryConfig retryConfig = Defaults.defaultRetryConfig();
        private IdempotencyConfig idempotencyConfig = Defaults.defaultIdempotencyConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();
        
        public Builder workerConfig(WorkerConfig workerConfig) {
            this.workerConfig = workerConfig;
            return this;
        }
        
        public Builder queueConfig(QueueConfig queueConfig) {
            this.queueConfig = queueConfig;
            return this;
        }
        
        public Builder retryConfig(RetryConfig retryConfig) {
            this.retryConfig = retryConfig;
            return this;
        }
        
        public Builder idempotencyConfig(IdempotencyConfig idempotencyConfig) {
            this.idempotencyConfig = idempotencyConfig;
            return this;
        }
        
        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }
        
        public JobQueueConfig build() {
            return new JobQueueConfig(workerConfig, queueConfig, retryConfig, idempotencyConfig, monitoringConfig);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Default configurations
     */
    public static class Defaults {
        public static WorkerConfig defaultWorkerConfig() {
            return new WorkerConfig(
                10, Duration.ofSeconds(30), Duration.ofSeconds(1), Duration.ofMinutes(1), Duration.ofMinutes(30)
            );
        }
        
        public static QueueConfig defaultQueueConfig() {
            return new QueueConfig(
                defaultQueues(), null, Duration.ZERO
            );
        }
        
        public static List<QueueDefinition> defaultQueues() {
            return Arrays.asList(
                QueueDefinition.of(QueueDefinition.CRITICAL, 6),
                QueueDefinition.of(QueueDefinition.DEFAULT, 3),
                QueueDefinition.of(QueueDefinition.LOW, 1)
            );
        }
        
        public static RetryConfig defaultRetryConfig() {
            return new RetryConfig(
                25, Duration.ofSeconds(5), 2.0, Duration.ofMinutes(5), true, false
            );
        }
        
        public static IdempotencyConfig defaultIdempotencyConfig() {
            return new IdempotencyConfig(
                FailMode.FAIL_OPEN, IdempotencyGuard.DEFAULT_KEY_PREFIX, IdempotencyGuard.DEFAULT_TTL
            );
        }
        
        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(
                true, false, 10000
            );
        }
    }
}
