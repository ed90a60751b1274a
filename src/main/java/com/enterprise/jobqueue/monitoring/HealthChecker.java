package com.enterprise.jobqueue.monitoring;

import com.enterprise.jobqueue.broker.QueueDefinition;
import com.enterprise.jobqueue.broker.TaskBroker;
import com.enterprise.jobqueue.core.TaskState;
import com.enterprise.jobqueue.exception.BrokerUnavailableException;
import com.enterprise.jobqueue.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health checker for the job queue
 */
public class HealthChecker {

    private static final Logger logger = LoggerFactory.getLogger(HealthChecker.class);

    private final TaskBroker broker;
    private final WorkerPool workerPool;
    private final long queueDepthThreshold;

    public HealthChecker(TaskBroker broker, WorkerPool workerPool, long queueDepthThreshold) {
        this.broker = broker;
        this.workerPool = workerPool;
        this.queueDepthThreshold = queueDepthThreshold;
    }

    /**
     * Run every check. A worker pool is optional, producer-only processes have none.
     */
    public HealthStatus check() {
        HealthStatus.Builder builder = HealthStatus.builder();

        boolean storeReachable = checkStore(builder);
        checkWorkers(builder);
        if (storeReachable) {
            checkQueueDepths(builder);
        }

        HealthStatus status = builder.build();
        if (!status.isHealthy()) {
            logger.warn("Health check failed: {}", status.getFailedChecks());
        }
        return status;
    }

    private boolean checkStore(HealthStatus.Builder builder) {
        try {
            broker.ping();
            builder.addCheck("store.reachable", true, "Backing store is reachable");
            return true;
        } catch (BrokerUnavailableException e) {
            builder.addCheck("store.reachable", false, "Backing store unreachable: " + e.getMessage());
            return false;
        }
    }

    private void checkWorkers(HealthStatus.Builder builder) {
        if (workerPool == null) {
            return;
        }
        boolean running = workerPool.isRunning();
        builder.addCheck("workers.running", running, running
            ? String.format("%d workers running, %d tasks active",
                workerPool.getConcurrency(), workerPool.getActiveTaskCount())
            : "Worker pool is not running");
    }

    private void checkQueueDepths(HealthStatus.Builder builder) {
        for (QueueDefinition queue : broker.getQueues()) {
            String check = "queue." + queue.getName() + ".depth";
            try {
                long pending = broker.countTasks(queue.getName(), TaskState.PENDING);
                boolean healthy = pending < queueDepthThreshold;
                builder.addCheck(check, healthy,
                    String.format("%d pending tasks (threshold %d)", pending, queueDepthThreshold));
            } catch (BrokerUnavailableException e) {
                builder.addCheck(check, false, "Error reading queue depth: " + e.getMessage());
            }
        }
    }

    /**
     * Health status result
     */
    public static class HealthStatus {
        private final boolean healthy;
        private final Map<String, CheckResult> checks;
        private final Instant timestamp;

        private HealthStatus(boolean healthy, Map<String, CheckResult> checks, Instant timestamp) {
            this.healthy = healthy;
            this.checks = checks;
            this.timestamp = timestamp;
        }

        public boolean isHealthy() { return healthy; }
        public Map<String, CheckResult> getChecks() { return checks; }
        public Instant getTimestamp() { return timestamp; }

        public Map<String, String> getFailedChecks() {
            Map<String, String> failed = new LinkedHashMap<>();
            checks.forEach((name, result) -> {
                if (!result.isPassed()) {
                    failed.put(name, result.getMessage());
                }
            });
            return failed;
        }

        public static class CheckResult {
            private final boolean passed;
            private final String message;

            public CheckResult(boolean passed, String message) {
                this.passed = passed;
                this.message = message;
            }

            public boolean isPassed() { return passed; }
            public String getMessage() { return message; }
        }

        public static class Builder {
            private final Map<String, CheckResult> checks = new LinkedHashMap<>();

            public Builder addCheck(String name, boolean passed, String message) {
                checks.put(name, new CheckResult(passed, message));
                return this;
            }

            public HealthStatus build() {
                boolean healthy = checks.values().stream().allMatch(CheckResult::isPassed);
                return new HealthStatus(healthy, Collections.unmodifiableMap(checks), Instant.now());
            }
        }

        public static Builder builder() {
            return new Builder();
        }
    }
}
