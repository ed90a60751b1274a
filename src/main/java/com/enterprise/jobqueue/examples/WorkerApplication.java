package com.enterprise.jobqueue.examples;

import com.enterprise.jobqueue.JobQueue;
import com.enterprise.jobqueue.JobQueueFactory;
import com.enterprise.jobqueue.config.JobQueueConfig;
import com.enterprise.jobqueue.core.TaskRegistry;
import com.enterprise.jobqueue.idempotency.IdempotentHandler;
import com.enterprise.jobqueue.idempotency.KeyExtractor;
import com.enterprise.jobqueue.monitoring.HealthChecker;
import com.enterprise.jobqueue.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Standalone worker process. Pass a database file path as the first argument
 * to keep the queues across restarts; without one the queues live in memory.
 * MapDB locks the file, so producers must run in this process.
 * <p>
 * The shutdown hook drains the pool before it closes the store.
 */
public class WorkerApplication {

    private static final Logger logger = LoggerFactory.getLogger(WorkerApplication.class);

    public static void main(String[] args) throws Exception {
        JobQueueConfig.Builder configBuilder = JobQueueConfig.builder();
        if (args.length > 0) {
            configBuilder.queueConfig(new JobQueueConfig.QueueConfig(
                JobQueueConfig.Defaults.defaultQueues(), args[0], Duration.ZERO));
        }
        JobQueue jobQueue = JobQueueFactory.create(configBuilder.build());

        ArchiveOrderHandler archiveOrder = new ArchiveOrderHandler(jobQueue.getCodec());
        TaskRegistry registry = TaskRegistry.builder()
            .register(ArchiveOrderHandler.TASK_TYPE, new IdempotentHandler(
                archiveOrder,
                jobQueue.getIdempotencyGuard(),
                KeyExtractor.payloadField(jobQueue.getCodec().getObjectMapper(), "order_id"),
                jobQueue.getIdempotencyGuard().getDefaultTtl()))
            .build();

        WorkerPool workerPool = jobQueue.workerPoolBuilder(registry).build();
        HealthChecker healthChecker = jobQueue.healthChecker(workerPool);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            workerPool.shutdown();
            try {
                jobQueue.close();
            } catch (Exception e) {
                logger.error("Error closing job queue", e);
            }
            stopped.countDown();
        }, "job-worker-shutdown"));

        workerPool.start();
        logger.info("Worker started, healthy={}", healthChecker.check().isHealthy());
        stopped.await();
    }
}
