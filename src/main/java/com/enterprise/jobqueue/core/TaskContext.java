package com.enterprise.jobqueue.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-attempt execution context handed to handlers and middleware
 */
public class TaskContext {
    
    private final Task task;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<byte[]> result = new AtomicReference<>();
    
    public TaskContext(Task task, Instant deadline, Clock clock) {
        this.task = task;
        this.deadline = deadline;
        this.clock = clock;
    }
    
    public static TaskContext forTask(Task task, Clock clock) {
        return new TaskContext(task, clock.instant().plus(task.getTimeout()), clock);
    }
    
    public Task getTask() {
        return task;
    }
    
    public Instant getDeadline() {
        return deadline;
    }
    
    /**
     * Time left before the deadline, never negative
     */
    public Duration getRemaining() {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
    
    /**
     * Long-running handlers should poll this and stop early once it returns true
     */
    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }
    
    public void cancel() {
        cancelled.set(true);
    }
    
    /**
     * Record a result for the attempt, cached by the idempotency guard on success
     */
    public void writeResult(byte[] data) {
        result.set(data != null ? data.clone() : null);
    }
    
    public Optional<byte[]> getResult() {
        return Optional.ofNullable(result.get());
    }
}
