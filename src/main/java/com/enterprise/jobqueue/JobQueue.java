package com.enterprise.jobqueue;

import com.enterprise.jobqueue.broker.TaskBroker;
import com.enterprise.jobqueue.client.TaskClient;
import com.enterprise.jobqueue.config.JobQueueConfig;
import com.enterprise.jobqueue.core.TaskCodec;
import com.enterprise.jobqueue.core.TaskRegistry;
import com.enterprise.jobqueue.idempotency.IdempotencyGuard;
import com.enterprise.jobqueue.inspector.QueueInspector;
import com.enterprise.jobqueue.monitoring.HealthChecker;
import com.enterprise.jobqueue.monitoring.MetricsCollector;
import com.enterprise.jobqueue.patterns.FanoutPublisher;
import com.enterprise.jobqueue.patterns.FanoutRegistry;
import com.enterprise.jobqueue.patterns.FireAndForget;
import com.enterprise.jobqueue.retry.FailureHandler;
import com.enterprise.jobqueue.scheduler.PeriodicTaskScheduler;
import com.enterprise.jobqueue.store.BackingStore;
import com.enterprise.jobqueue.worker.WorkerPool;
import com.enterprise.jobqueue.worker.middleware.LoggingMiddleware;
import com.enterprise.jobqueue.worker.middleware.MetricsMiddleware;
import com.enterprise.jobqueue.worker.middleware.RecoveryMiddleware;
import com.enterprise.jobqueue.worker.middleware.TracingMiddleware;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The wired components of one job queue deployment. Producer and worker
 * processes both start from here; closing it closes the backing store.
 */
public class JobQueue implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JobQueue.class);

    private final JobQueueConfig config;
    private final BackingStore store;
    private final TaskCodec codec;
    private final TaskBroker broker;
    private final TaskClient client;
    private final MetricsCollector metricsCollector;
    private final FailureHandler failureHandler;
    private final IdempotencyGuard idempotencyGuard;
    private final QueueInspector inspector;
    private final OpenTelemetry openTelemetry;

    JobQueue(JobQueueConfig config, BackingStore store, TaskCodec codec, TaskBroker broker,
             TaskClient client, MetricsCollector metricsCollector, FailureHandler failureHandler,
             IdempotencyGuard idempotencyGuard, QueueInspector inspector, OpenTelemetry openTelemetry) {
        this.config = config;
        this.store = store;
        this.codec = codec;
        this.broker = broker;
        this.client = client;
        this.metricsCollector = metricsCollector;
        this.failureHandler = failureHandler;
        this.idempotencyGuard = idempotencyGuard;
        this.inspector = inspector;
        this.openTelemetry = openTelemetry;
    }

    /**
     * A worker pool builder configured from the worker settings, with the standard
     * middleware order: recovery, tracing, metrics, logging. More middleware may be
     * appended with {@link WorkerPool.Builder#use}; it runs inside these.
     */
    public WorkerPool.Builder workerPoolBuilder(TaskRegistry registry) {
        JobQueueConfig.WorkerConfig workerConfig = config.getWorkerConfig();
        WorkerPool.Builder builder = WorkerPool.builder()
            .broker(broker)
            .registry(registry)
            .failureHandler(failureHandler)
            .concurrency(workerConfig.getConcurrency())
            .shutdownTimeout(workerConfig.getShutdownTimeout())
            .pollInterval(workerConfig.getPollInterval())
            .janitorInterval(workerConfig.getJanitorInterval());

        builder.use(new RecoveryMiddleware(metricsCollector));
        if (config.getMonitoringConfig().isEnableTracing()) {
            builder.use(new TracingMiddleware(openTelemetry));
        }
        if (metricsCollector != null) {
            builder.use(new MetricsMiddleware(metricsCollector));
        }
        builder.use(new LoggingMiddleware());
        return builder;
    }

    public HealthChecker healthChecker(WorkerPool workerPool) {
        return new HealthChecker(broker, workerPool, config.getMonitoringConfig().getQueueDepthThreshold());
    }

    public PeriodicTaskScheduler newScheduler() {
        return new PeriodicTaskScheduler(client);
    }

    public FireAndForget fireAndForget() {
        return new FireAndForget(client);
    }

    public FanoutPublisher fanoutPublisher(FanoutRegistry registry) {
        return new FanoutPublisher(client, codec, registry, broker.getClock());
    }

    public JobQueueConfig getConfig() { return config; }
    public BackingStore getStore() { return store; }
    public TaskCodec getCodec() { return codec; }
    public TaskBroker getBroker() { return broker; }
    public TaskClient getClient() { return client; }

    /**
     * Null when metrics are disabled
     */
    public MetricsCollector getMetricsCollector() { return metricsCollector; }
    public FailureHandler getFailureHandler() { return failureHandler; }
    public IdempotencyGuard getIdempotencyGuard() { return idempotencyGuard; }
    public QueueInspector getInspector() { return inspector; }
    public OpenTelemetry getOpenTelemetry() { return openTelemetry; }

    @Override
    public void close() throws Exception {
        store.close();
        logger.info("Job queue closed");
    }
}
