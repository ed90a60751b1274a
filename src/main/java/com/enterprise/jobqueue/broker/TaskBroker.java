package com.enterprise.jobqueue.broker;

import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskCodec;
import com.enterprise.jobqueue.core.TaskState;
import com.enterprise.jobqueue.exception.BrokerUnavailableException;
import com.enterprise.jobqueue.exception.QueueUnknownException;
import com.enterprise.jobqueue.exception.SerializationFailedException;
import com.enterprise.jobqueue.exception.TaskNotFoundException;
import com.enterprise.jobqueue.store.BackingStore;
import com.enterprise.jobqueue.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority queue broker on top of a {@link BackingStore}.
 * <p>
 * Every task is stored once as a JSON record under {@code task:{id}}; the queues
 * only index task ids. Ready tasks sit in a FIFO list per queue, while active,
 * retrying, scheduled, failed and retained completed tasks sit in scored sets.
 * State changes of a record are compare-and-set operations, so a concurrent
 * admin action and a worker never both win.
 */
public class TaskBroker {

    private static final Logger logger = LoggerFactory.getLogger(TaskBroker.class);

    private static final int BATCH_SIZE = 100;

    private final BackingStore store;
    private final TaskCodec codec;
    private final Map<String, QueueDefinition> queues;
    private final WeightedRoundRobin scheduler;
    private final Clock clock;
    private final Duration completedRetention;
    private final Duration pollInterval;

    // Selection and pop must not interleave, otherwise credits are consumed for tasks another worker took
    private final ReentrantLock dispatchLock = new ReentrantLock();
    private final Object signal = new Object();

    public TaskBroker(BackingStore store, TaskCodec codec, List<QueueDefinition> queueDefinitions,
                      Clock clock, Duration completedRetention, Duration pollInterval) {
        if (store == null) {
            throw new IllegalArgumentException("Backing store is required");
        }
        this.store = store;
        this.codec = codec;
        this.queues = new LinkedHashMap<>();
        for (QueueDefinition definition : queueDefinitions) {
            if (queues.put(definition.getName(), definition) != null) {
                throw new IllegalArgumentException("Duplicate queue: " + definition.getName());
            }
        }
        this.scheduler = new WeightedRoundRobin(queueDefinitions);
        this.clock = clock;
        this.completedRetention = completedRetention;
        this.pollInterval = pollInterval;

        logger.info("TaskBroker initialized with queues {}", queueDefinitions);
    }

    /**
     * Store a new task and index it in the given queue.
     * A task in state SCHEDULED waits until its processAt time, a PENDING task is ready at once.
     */
    public String enqueue(String queueName, Task task)
            throws QueueUnknownException, SerializationFailedException, BrokerUnavailableException {
        if (!queues.containsKey(queueName)) {
            throw new QueueUnknownException(queueName);
        }
        if (task.getState() != TaskState.PENDING && task.getState() != TaskState.SCHEDULED) {
            throw new IllegalArgumentException("Only new tasks can be enqueued, got state " + task.getState());
        }
        if (task.getState() == TaskState.SCHEDULED && task.getProcessAt() == null) {
            throw new IllegalArgumentException("A scheduled task needs a processAt time");
        }

        Task stored = task.withQueue(queueName).withEnqueuedAt(clock.instant());
        byte[] record = codec.encodeTask(stored);

        try {
            if (!store.putIfAbsent(taskKey(stored.getId()), record, null)) {
                throw new IllegalArgumentException("Task id already exists: " + stored.getId());
            }
            if (stored.getState() == TaskState.SCHEDULED) {
                store.addScored(indexName(queueName, TaskState.SCHEDULED), stored.getId(),
                    stored.getProcessAt().toEpochMilli());
            } else {
                store.pushTail(indexName(queueName, TaskState.PENDING), stored.getId());
            }
        } catch (StoreUnavailableException e) {
            throw unavailable("enqueue", e);
        }

        signalWorkers();
        logger.debug("Task {} of type {} enqueued into {}", stored.getId(), stored.getType(), queueName);
        return stored.getId();
    }

    /**
     * Take the next ready task, waiting up to maxWait for one to arrive
     */
    public Optional<Task> dequeue(Duration maxWait) throws BrokerUnavailableException, InterruptedException {
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Dequeue interrupted");
            }
            Optional<Task> task = tryDequeue();
            if (task.isPresent()) {
                return task;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            awaitSignal(Math.min(remaining, pollInterval.toNanos()));
        }
    }

    /**
     * Block until a task is ready. Cancellation is thread interruption.
     */
    public Task take() throws BrokerUnavailableException, InterruptedException {
        while (true) {
            Optional<Task> task = dequeue(pollInterval);
            if (task.isPresent()) {
                return task.get();
            }
        }
    }

    private Optional<Task> tryDequeue() throws BrokerUnavailableException {
        dispatchLock.lock();
        try {
            promoteDue();
            while (true) {
                Optional<String> selected = scheduler.select(
                    name -> store.listSize(indexName(name, TaskState.PENDING)) > 0);
                if (!selected.isPresent()) {
                    return Optional.empty();
                }
                String queueName = selected.get();
                Optional<String> taskId = store.popHead(indexName(queueName, TaskState.PENDING));
                if (!taskId.isPresent()) {
                    continue;
                }
                Optional<Task> activated = activate(queueName, taskId.get());
                if (activated.isPresent()) {
                    return activated;
                }
            }
        } catch (StoreUnavailableException e) {
            throw unavailable("dequeue", e);
        } finally {
            dispatchLock.unlock();
        }
    }

    private Optional<Task> activate(String queueName, String taskId) {
        Optional<StoredTask> stored = load(taskId);
        if (!stored.isPresent() || stored.get().task.getState() != TaskState.PENDING) {
            logger.warn("Skipping stale entry {} in queue {}", taskId, queueName);
            return Optional.empty();
        }
        Instant now = clock.instant();
        Task active = stored.get().task.transitionTo(TaskState.ACTIVE).withProcessedAt(now);
        if (!store.compareAndSet(taskKey(taskId), stored.get().record, encode(active), null)) {
            logger.warn("Task {} changed while being dequeued, skipping", taskId);
            return Optional.empty();
        }
        store.addScored(indexName(queueName, TaskState.ACTIVE), taskId, now.toEpochMilli());
        logger.debug("Task {} dequeued from {}", taskId, queueName);
        return Optional.of(active);
    }

    /**
     * Move retry and scheduled tasks whose time has come back to their pending list
     *
     * @return number of promoted tasks
     */
    public int promoteDue() throws BrokerUnavailableException {
        long now = clock.millis();
        int promoted = 0;
        try {
            for (String queueName : queues.keySet()) {
                for (TaskState waiting : Arrays.asList(TaskState.RETRY, TaskState.SCHEDULED)) {
                    for (String taskId : store.popDueScored(indexName(queueName, waiting), now, BATCH_SIZE)) {
                        if (makePending(queueName, taskId, waiting)) {
                            promoted++;
                        }
                    }
                }
            }
        } catch (StoreUnavailableException e) {
            throw unavailable("promote", e);
        }
        if (promoted > 0) {
            logger.debug("Promoted {} due tasks to pending", promoted);
        }
        return promoted;
    }

    private boolean makePending(String queueName, String taskId, TaskState expected) {
        Optional<StoredTask> stored = load(taskId);
        if (!stored.isPresent() || stored.get().task.getState() != expected) {
            return false;
        }
        Task pending = stored.get().task.transitionTo(TaskState.PENDING);
        if (!store.compareAndSet(taskKey(taskId), stored.get().record, encode(pending), null)) {
            return false;
        }
        store.pushTail(indexName(queueName, TaskState.PENDING), taskId);
        return true;
    }

    /**
     * Mark an active task as successfully processed
     */
    public void complete(Task task) throws BrokerUnavailableException {
        try {
            StoredTask current = loadActive(task);
            Task completed = current.task.transitionTo(TaskState.COMPLETED);
            String queueName = completed.getQueue();
            if (completedRetention.isZero()) {
                casDelete(current);
            } else {
                casUpdate(current, completed);
                store.addScored(indexName(queueName, TaskState.COMPLETED), task.getId(),
                    clock.instant().plus(completedRetention).toEpochMilli());
            }
            store.removeScored(indexName(queueName, TaskState.ACTIVE), task.getId());
            store.increment(processedCounter(queueName), 1);
        } catch (StoreUnavailableException e) {
            throw unavailable("complete", e);
        }
    }

    /**
     * Schedule another attempt of an active task, consuming one retry
     */
    public Task retry(Task task, Duration delay, String error) throws BrokerUnavailableException {
        try {
            StoredTask current = loadActive(task);
            Instant now = clock.instant();
            Task retrying = current.task.transitionTo(TaskState.RETRY)
                .withRetryCount(current.task.getRetryCount() + 1)
                .withProcessAt(now.plus(delay))
                .withFailure(error, now);
            casUpdate(current, retrying);
            String queueName = retrying.getQueue();
            store.removeScored(indexName(queueName, TaskState.ACTIVE), task.getId());
            store.addScored(indexName(queueName, TaskState.RETRY), task.getId(),
                retrying.getProcessAt().toEpochMilli());
            store.increment(processedCounter(queueName), 1);
            store.increment(failedCounter(queueName), 1);
            return retrying;
        } catch (StoreUnavailableException e) {
            throw unavailable("retry", e);
        }
    }

    /**
     * Move an active task to the terminal FAILED state
     */
    public Task fail(Task task, String error) throws BrokerUnavailableException {
        try {
            StoredTask current = loadActive(task);
            Instant now = clock.instant();
            Task failed = current.task.transitionTo(TaskState.FAILED).withFailure(error, now);
            casUpdate(current, failed);
            String queueName = failed.getQueue();
            store.removeScored(indexName(queueName, TaskState.ACTIVE), task.getId());
            store.addScored(indexName(queueName, TaskState.FAILED), task.getId(), now.toEpochMilli());
            store.increment(processedCounter(queueName), 1);
            store.increment(failedCounter(queueName), 1);
            return failed;
        } catch (StoreUnavailableException e) {
            throw unavailable("fail", e);
        }
    }

    /**
     * Put an interrupted active task back to pending without consuming a retry
     */
    public void requeue(Task task) throws BrokerUnavailableException {
        try {
            StoredTask current = loadActive(task);
            Task pending = current.task.transitionTo(TaskState.PENDING);
            casUpdate(current, pending);
            store.removeScored(indexName(pending.getQueue(), TaskState.ACTIVE), task.getId());
            store.pushTail(indexName(pending.getQueue(), TaskState.PENDING), task.getId());
        } catch (StoreUnavailableException e) {
            throw unavailable("requeue", e);
        }
        signalWorkers();
    }

    /**
     * Requeue tasks left active by a previous process that stopped without finishing them.
     * Must only be called before any worker of this process starts dequeuing.
     */
    public int recoverOrphaned() throws BrokerUnavailableException {
        int recovered = 0;
        try {
            for (String queueName : queues.keySet()) {
                String activeIndex = indexName(queueName, TaskState.ACTIVE);
                for (String taskId : store.popDueScored(activeIndex, Long.MAX_VALUE, Integer.MAX_VALUE)) {
                    Optional<StoredTask> stored = load(taskId);
                    if (!stored.isPresent() || stored.get().task.getState() != TaskState.ACTIVE) {
                        continue;
                    }
                    casUpdate(stored.get(), stored.get().task.transitionTo(TaskState.PENDING));
                    store.pushTail(indexName(queueName, TaskState.PENDING), taskId);
                    recovered++;
                }
            }
        } catch (StoreUnavailableException e) {
            throw unavailable("recover", e);
        }
        if (recovered > 0) {
            logger.warn("Requeued {} tasks left active by a previous run", recovered);
        }
        return recovered;
    }

    /**
     * Operator retry of a failed task: FAILED to PENDING with a fresh retry budget
     */
    public Task retryFailed(String queueName, String taskId)
            throws TaskNotFoundException, BrokerUnavailableException {
        try {
            StoredTask current = loadFailed(queueName, taskId);
            Task pending = current.task.transitionTo(TaskState.PENDING)
                .withRetryCount(0)
                .withProcessAt(null);
            if (!store.compareAndSet(taskKey(taskId), current.record, encode(pending), null)) {
                throw new TaskNotFoundException(taskId);
            }
            store.removeScored(indexName(queueName, TaskState.FAILED), taskId);
            store.pushTail(indexName(queueName, TaskState.PENDING), taskId);
            signalWorkers();
            logger.info("Failed task {} in queue {} requeued by operator", taskId, queueName);
            return pending;
        } catch (StoreUnavailableException e) {
            throw unavailable("retryFailed", e);
        }
    }

    /**
     * Permanently remove a failed task
     */
    public void deleteFailed(String queueName, String taskId)
            throws TaskNotFoundException, BrokerUnavailableException {
        try {
            StoredTask current = loadFailed(queueName, taskId);
            if (!store.compareAndDelete(taskKey(taskId), current.record)) {
                throw new TaskNotFoundException(taskId);
            }
            store.removeScored(indexName(queueName, TaskState.FAILED), taskId);
            logger.info("Failed task {} in queue {} deleted by operator", taskId, queueName);
        } catch (StoreUnavailableException e) {
            throw unavailable("deleteFailed", e);
        }
    }

    /**
     * Delete completed tasks whose retention window has elapsed
     */
    public int purgeCompleted() throws BrokerUnavailableException {
        long now = clock.millis();
        int purged = 0;
        try {
            for (String queueName : queues.keySet()) {
                List<String> expired;
                do {
                    expired = store.popDueScored(indexName(queueName, TaskState.COMPLETED), now, BATCH_SIZE);
                    for (String taskId : expired) {
                        if (store.delete(taskKey(taskId))) {
                            purged++;
                        }
                    }
                } while (expired.size() == BATCH_SIZE);
            }
        } catch (StoreUnavailableException e) {
            throw unavailable("purgeCompleted", e);
        }
        if (purged > 0) {
            logger.debug("Purged {} completed tasks", purged);
        }
        return purged;
    }

    /**
     * Drop expired keys of the underlying store, such as idempotency records
     */
    public int purgeExpiredKeys() throws BrokerUnavailableException {
        try {
            return store.purgeExpired();
        } catch (StoreUnavailableException e) {
            throw unavailable("purgeExpired", e);
        }
    }

    public Optional<Task> findTask(String taskId) throws BrokerUnavailableException {
        try {
            return load(taskId).map(stored -> stored.task);
        } catch (StoreUnavailableException e) {
            throw unavailable("findTask", e);
        }
    }

    /**
     * Number of tasks of a queue in the given state
     */
    public long countTasks(String queueName, TaskState state) throws BrokerUnavailableException {
        try {
            if (state == TaskState.PENDING) {
                return store.listSize(indexName(queueName, state));
            }
            return store.scoredSize(indexName(queueName, state));
        } catch (StoreUnavailableException e) {
            throw unavailable("countTasks", e);
        }
    }

    /**
     * Tasks of a queue in the given state, in index order (FIFO for pending, by score otherwise)
     */
    public List<Task> listTasks(String queueName, TaskState state, long offset, int limit)
            throws BrokerUnavailableException {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        try {
            List<String> ids = state == TaskState.PENDING
                ? store.listRange(indexName(queueName, state), offset, limit)
                : store.scoredRange(indexName(queueName, state), offset, limit);
            List<Task> tasks = new ArrayList<>(ids.size());
            for (String taskId : ids) {
                load(taskId).ifPresent(stored -> tasks.add(stored.task));
            }
            return tasks;
        } catch (StoreUnavailableException e) {
            throw unavailable("listTasks", e);
        }
    }

    public long getProcessedCount(String queueName) throws BrokerUnavailableException {
        try {
            return store.counter(processedCounter(queueName));
        } catch (StoreUnavailableException e) {
            throw unavailable("processedCount", e);
        }
    }

    public long getFailedCount(String queueName) throws BrokerUnavailableException {
        try {
            return store.counter(failedCounter(queueName));
        } catch (StoreUnavailableException e) {
            throw unavailable("failedCount", e);
        }
    }

    public void ping() throws BrokerUnavailableException {
        try {
            store.ping();
        } catch (StoreUnavailableException e) {
            throw unavailable("ping", e);
        }
    }

    public boolean isKnownQueue(String queueName) {
        return queues.containsKey(queueName);
    }

    /**
     * Queues in configuration order
     */
    public List<QueueDefinition> getQueues() {
        return new ArrayList<>(queues.values());
    }

    public Clock getClock() {
        return clock;
    }

    private StoredTask loadActive(Task task) {
        Optional<StoredTask> stored = load(task.getId());
        if (!stored.isPresent()) {
            throw new IllegalStateException("Record of active task " + task.getId() + " is missing");
        }
        return stored.get();
    }

    private StoredTask loadFailed(String queueName, String taskId) throws TaskNotFoundException {
        Optional<StoredTask> stored = load(taskId);
        if (!stored.isPresent()
                || stored.get().task.getState() != TaskState.FAILED
                || !queueName.equals(stored.get().task.getQueue())) {
            throw new TaskNotFoundException(taskId);
        }
        return stored.get();
    }

    private Optional<StoredTask> load(String taskId) {
        Optional<byte[]> record = store.get(taskKey(taskId));
        if (!record.isPresent()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new StoredTask(record.get(), codec.decodeTask(record.get())));
        } catch (SerializationFailedException e) {
            logger.error("Ignoring unreadable record of task {}", taskId, e);
            return Optional.empty();
        }
    }

    private void casUpdate(StoredTask current, Task next) {
        if (!store.compareAndSet(taskKey(next.getId()), current.record, encode(next), null)) {
            throw new IllegalStateException("Task " + next.getId() + " was modified concurrently");
        }
    }

    private void casDelete(StoredTask current) {
        if (!store.compareAndDelete(taskKey(current.task.getId()), current.record)) {
            throw new IllegalStateException("Task " + current.task.getId() + " was modified concurrently");
        }
    }

    private byte[] encode(Task task) {
        try {
            return codec.encodeTask(task);
        } catch (SerializationFailedException e) {
            throw new IllegalStateException("Unable to encode task " + task.getId(), e);
        }
    }

    private void awaitSignal(long nanos) throws InterruptedException {
        synchronized (signal) {
            TimeUnit.NANOSECONDS.timedWait(signal, nanos);
        }
    }

    private void signalWorkers() {
        synchronized (signal) {
            signal.notifyAll();
        }
    }

    private BrokerUnavailableException unavailable(String operation, StoreUnavailableException e) {
        return new BrokerUnavailableException("Broker unavailable during " + operation + ": " + e.getMessage(), e);
    }

    static String taskKey(String taskId) {
        return "task:" + taskId;
    }

    static String indexName(String queueName, TaskState state) {
        return "queue:" + queueName + ":" + state.name().toLowerCase();
    }

    private static String processedCounter(String queueName) {
        return "stats:" + queueName + ":processed";
    }

    private static String failedCounter(String queueName) {
        return "stats:" + queueName + ":failed";
    }

    /**
     * A decoded task together with the exact bytes it was read from, used for compare-and-set
     */
    private static final class StoredTask {
        private final byte[] record;
        private final Task task;

        private StoredTask(byte[] record, Task task) {
            this.record = record;
            this.task = task;
        }
    }

    /**
     * Builder for creating brokers
     */
    public static class Builder {
        private BackingStore store;
        private TaskCodec codec = new TaskCodec();
        private List<QueueDefinition> queues = Arrays.asList(
            QueueDefinition.of(QueueDefinition.CRITICAL, 6),
            QueueDefinition.of(QueueDefinition.DEFAULT, 3),
            QueueDefinition.of(QueueDefinition.LOW, 1));
        private Clock clock = Clock.systemUTC();
        private Duration completedRetention = Duration.ZERO;
        private Duration pollInterval = Duration.ofMillis(100);

        public Builder store(BackingStore store) {
            this.store = store;
            return this;
        }

        public Builder codec(TaskCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder queues(List<QueueDefinition> queues) {
            this.queues = queues;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder completedRetention(Duration completedRetention) {
            this.completedRetention = completedRetention;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public TaskBroker build() {
            return new TaskBroker(store, codec, queues, clock, completedRetention, pollInterval);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
