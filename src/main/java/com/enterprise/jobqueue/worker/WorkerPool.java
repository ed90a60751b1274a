package com.enterprise.jobqueue.worker;

import com.enterprise.jobqueue.broker.TaskBroker;
import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskContext;
import com.enterprise.jobqueue.core.TaskHandler;
import com.enterprise.jobqueue.core.TaskRegistry;
import com.enterprise.jobqueue.core.TaskResult;
import com.enterprise.jobqueue.exception.BrokerUnavailableException;
import com.enterprise.jobqueue.exception.TaskTimeoutException;
import com.enterprise.jobqueue.retry.FailureHandler;
import io.opentelemetry.context.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of worker loops. Each loop takes a task from the broker, runs it
 * through the middleware chain and the registered handler, and records the outcome.
 * <p>
 * Handlers run on a separate handler thread so that a loop can enforce the task's
 * deadline. Shutdown stops dequeuing, waits for in-flight tasks up to the shutdown
 * timeout and then interrupts them; interrupted tasks go back to PENDING.
 */
public class WorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private static final long INITIAL_BACKOFF_MS = 100;
    private static final long MAX_BACKOFF_MS = 5000;

    private final TaskBroker broker;
    private final TaskRegistry registry;
    private final FailureHandler failureHandler;
    private final MiddlewareChain middlewareChain;
    private final int concurrency;
    private final Duration shutdownTimeout;
    private final Duration pollInterval;
    private final Duration janitorInterval;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeTasks = new AtomicInteger(0);
    private final TaskHandler pipeline;

    private ExecutorService loopExecutor;
    private ExecutorService handlerThreads;
    private ExecutorService handlerExecutor;
    private ScheduledExecutorService janitor;

    public WorkerPool(TaskBroker broker, TaskRegistry registry, FailureHandler failureHandler,
                      MiddlewareChain middlewareChain, int concurrency, Duration shutdownTimeout,
                      Duration pollInterval, Duration janitorInterval) {
        this.broker = broker;
        this.registry = registry;
        this.failureHandler = failureHandler;
        this.middlewareChain = middlewareChain;
        this.concurrency = concurrency;
        this.shutdownTimeout = shutdownTimeout;
        this.pollInterval = pollInterval;
        this.janitorInterval = janitorInterval;
        this.clock = broker.getClock();
        this.pipeline = middlewareChain.then(this::invokeRegisteredHandler);
    }

    /**
     * Launch the worker loops
     */
    public synchronized void start() {
        if (running.get()) {
            throw new IllegalStateException("Worker pool is already running");
        }

        try {
            broker.recoverOrphaned();
        } catch (BrokerUnavailableException e) {
            logger.warn("Could not recover orphaned tasks at startup: {}", e.getMessage());
        }

        running.set(true);
        handlerThreads = Executors.newCachedThreadPool(new TaskThreadFactory("job-handler-", true));
        // Spans started by the tracing middleware stay current on the handler thread
        handlerExecutor = Context.taskWrapping(handlerThreads);
        loopExecutor = Executors.newFixedThreadPool(concurrency, new TaskThreadFactory("job-worker-", false));
        for (int i = 0; i < concurrency; i++) {
            final int workerId = i;
            loopExecutor.submit(() -> runLoop(workerId));
        }

        janitor = Executors.newSingleThreadScheduledExecutor(new TaskThreadFactory("job-janitor-", true));
        long intervalMs = janitorInterval.toMillis();
        janitor.scheduleWithFixedDelay(this::runJanitor, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        logger.info("Worker pool started with concurrency={}, queues={}, handlers={}",
                   concurrency, broker.getQueues(), registry.getTaskTypes());
    }

    private void runLoop(int workerId) {
        long backoffMs = 0;
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            Task task;
            try {
                Optional<Task> next = broker.dequeue(pollInterval);
                backoffMs = 0;
                if (!next.isPresent()) {
                    continue;
                }
                task = next.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (BrokerUnavailableException e) {
                backoffMs = backoffMs == 0 ? INITIAL_BACKOFF_MS : Math.min(MAX_BACKOFF_MS, backoffMs * 2);
                logger.warn("Worker {} cannot reach the broker, backing off {}ms: {}",
                           workerId, backoffMs, e.getMessage());
                if (!pause(backoffMs)) {
                    break;
                }
                continue;
            }

            try {
                process(task);
            } catch (RuntimeException e) {
                logger.error("Unexpected error in worker {} while processing task {}", workerId, task.getId(), e);
            }
        }
        logger.debug("Worker {} stopped", workerId);
    }

    private void process(Task task) {
        activeTasks.incrementAndGet();
        TaskContext context = TaskContext.forTask(task, clock);
        long startNanos = System.nanoTime();
        TaskResult result;
        try {
            pipeline.handle(context, task.getPayload());
            result = TaskResult.success(elapsedSince(startNanos));
        } catch (InterruptedException e) {
            if (!running.get()) {
                requeueInterrupted(task);
                Thread.currentThread().interrupt();
                activeTasks.decrementAndGet();
                return;
            }
            result = TaskResult.failure(e, elapsedSince(startNanos));
        } catch (Exception e) {
            result = TaskResult.failure(e, elapsedSince(startNanos));
        }

        try {
            recordOutcome(task, result);
        } finally {
            activeTasks.decrementAndGet();
        }
    }

    /**
     * Store the outcome of an attempt, retrying with backoff while the broker is
     * unreachable. Once the pool stops the task is left ACTIVE for orphan recovery.
     */
    private void recordOutcome(Task task, TaskResult result) {
        long backoffMs = INITIAL_BACKOFF_MS;
        while (true) {
            try {
                if (result.isSuccess()) {
                    broker.complete(task);
                } else {
                    failureHandler.handleFailure(task, result);
                }
                return;
            } catch (BrokerUnavailableException e) {
                if (!running.get()) {
                    logger.error("Could not record the outcome of task {} during shutdown, "
                                + "it stays active until orphan recovery", task.getId(), e);
                    return;
                }
                logger.warn("Could not record the outcome of task {}, retrying in {}ms: {}",
                           task.getId(), backoffMs, e.getMessage());
                if (!pause(backoffMs)) {
                    logger.error("Interrupted while recording the outcome of task {}, "
                                + "it stays active until orphan recovery", task.getId());
                    return;
                }
                backoffMs = Math.min(MAX_BACKOFF_MS, backoffMs * 2);
            }
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private void requeueInterrupted(Task task) {
        try {
            broker.requeue(task);
            logger.warn("Task {} interrupted by shutdown, requeued", task.getId());
        } catch (BrokerUnavailableException e) {
            logger.error("Could not requeue interrupted task {}", task.getId(), e);
        }
    }

    /**
     * Innermost handler of the chain: resolves the registered handler and runs it
     * on a handler thread, bounded by the task deadline
     */
    private void invokeRegisteredHandler(TaskContext context, byte[] payload) throws Exception {
        Task task = context.getTask();
        TaskHandler handler = registry.getHandler(task.getType());

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<Void> future = handlerExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                handler.handle(context, payload);
                return null;
            } finally {
                MDC.clear();
            }
        });

        try {
            future.get(context.getRemaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            context.cancel();
            future.cancel(true);
            throw new TaskTimeoutException(task.getId(), task.getTimeout());
        } catch (InterruptedException e) {
            context.cancel();
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private void runJanitor() {
        try {
            int completed = broker.purgeCompleted();
            int expired = broker.purgeExpiredKeys();
            if (completed > 0 || expired > 0) {
                logger.debug("Janitor purged {} completed tasks and {} expired keys", completed, expired);
            }
        } catch (BrokerUnavailableException e) {
            logger.warn("Janitor skipped, broker unavailable: {}", e.getMessage());
        }
    }

    private boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stop dequeuing, wait for in-flight tasks, then interrupt the stragglers
     */
    public synchronized void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Shutting down worker pool...");

        janitor.shutdownNow();
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Worker pool did not terminate gracefully, interrupting {} in-flight tasks",
                           activeTasks.get());
                loopExecutor.shutdownNow();
                if (!loopExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.error("Worker loops did not stop after interruption");
                }
            }
        } catch (InterruptedException e) {
            logger.error("Interrupted during shutdown", e);
            loopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            handlerExecutor.shutdownNow();
        }

        logger.info("Worker pool shutdown completed");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Number of tasks currently being processed
     */
    public int getActiveTaskCount() {
        return activeTasks.get();
    }

    public int getConcurrency() {
        return concurrency;
    }

    public MiddlewareChain getMiddlewareChain() {
        return middlewareChain;
    }

    /**
     * Builder for creating worker pools
     */
    public static class Builder {
        private TaskBroker broker;
        private TaskRegistry registry;
        private FailureHandler failureHandler;
        private final List<TaskMiddleware> middlewares = new ArrayList<>();
        private int concurrency = 10;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration janitorInterval = Duration.ofMinutes(1);

        public Builder broker(TaskBroker broker) {
            this.broker = broker;
            return this;
        }

        public Builder registry(TaskRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder failureHandler(FailureHandler failureHandler) {
            this.failureHandler = failureHandler;
            return this;
        }

        /**
         * Append a middleware; the first one added is the outermost
         */
        public Builder use(TaskMiddleware middleware) {
            this.middlewares.add(middleware);
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder janitorInterval(Duration janitorInterval) {
            this.janitorInterval = janitorInterval;
            return this;
        }

        public WorkerPool build() {
            if (broker == null || registry == null) {
                throw new IllegalArgumentException("Broker and registry are required");
            }
            if (concurrency <= 0) {
                throw new IllegalArgumentException("Concurrency must be greater than 0");
            }
            FailureHandler handler = failureHandler != null ? failureHandler
                : FailureHandler.builder().broker(broker).build();
            return new WorkerPool(broker, registry, handler, new MiddlewareChain(middlewares),
                concurrency, shutdownTimeout, pollInterval, janitorInterval);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
