package com.enterprise.jobqueue.patterns;

import com.enterprise.jobqueue.broker.QueueDefinition;
import com.enterprise.jobqueue.client.EnqueueOptions;
import com.enterprise.jobqueue.client.TaskClient;
import com.enterprise.jobqueue.client.TaskInfo;
import com.enterprise.jobqueue.exception.JobQueueException;
import com.enterprise.jobqueue.worker.TaskThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Enqueues non-critical work without making the caller wait or handle errors.
 * Tasks go to the low queue unless the options name another one.
 */
public class FireAndForget implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FireAndForget.class);

    public static final Duration DEFAULT_ENQUEUE_TIMEOUT = Duration.ofSeconds(5);

    private final TaskClient client;
    private final Duration enqueueTimeout;
    private final ExecutorService executor;

    public FireAndForget(TaskClient client) {
        this(client, DEFAULT_ENQUEUE_TIMEOUT);
    }

    public FireAndForget(TaskClient client, Duration enqueueTimeout) {
        this.client = client;
        this.enqueueTimeout = enqueueTimeout;
        this.executor = Executors.newCachedThreadPool(new TaskThreadFactory("fire-and-forget-", true));
    }

    public CompletableFuture<Optional<TaskInfo>> submit(String taskType, Object payload) {
        return submit(taskType, payload, null);
    }

    /**
     * Enqueue in the background. The returned future never completes exceptionally;
     * it holds the task info, or nothing when the enqueue failed or timed out.
     */
    public CompletableFuture<Optional<TaskInfo>> submit(String taskType, Object payload, EnqueueOptions options) {
        EnqueueOptions effective = options != null ? options : EnqueueOptions.onQueue(QueueDefinition.LOW);

        return CompletableFuture.supplyAsync(() -> {
                try {
                    return client.enqueue(taskType, payload, effective);
                } catch (JobQueueException e) {
                    throw new CompletionException(e);
                }
            }, executor)
            .orTimeout(enqueueTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((info, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                    logger.error("Fire-and-forget enqueue failed for task type {}", taskType, cause);
                    return Optional.<TaskInfo>empty();
                }
                logger.debug("Fire-and-forget task {} of type {} enqueued on {}",
                            info.getId(), taskType, info.getQueue());
                return Optional.of(info);
            });
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
