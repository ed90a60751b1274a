package com.enterprise.jobqueue.retry;

import com.enterprise.jobqueue.broker.TaskBroker;
import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskResult;
import com.enterprise.jobqueue.exception.BrokerUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Routes a failed attempt either to a delayed retry or to the terminal FAILED state
 */
public class FailureHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(FailureHandler.class);
    
    private final TaskBroker broker;
    private final RetryPolicy retryPolicy;
    private final Consumer<Task> retryNotifier;
    private final Consumer<Task> terminalNotifier;
    
    public FailureHandler(TaskBroker broker, RetryPolicy retryPolicy,
                          Consumer<Task> retryNotifier, Consumer<Task> terminalNotifier) {
        this.broker = broker;
        this.retryPolicy = retryPolicy;
        this.retryNotifier = retryNotifier;
        this.terminalNotifier = terminalNotifier;
    }
    
    /**
     * Handle a failed task execution
     *
     * @return the task as stored after the transition
     */
    public Task handleFailure(Task task, TaskResult result) throws BrokerUnavailableException {
        if (retryPolicy.shouldRetry(task, result)) {
            return handleRetry(task, result);
        }
        return handleFinalFailure(task, result);
    }
    
    private Task handleRetry(Task task, TaskResult result) throws BrokerUnavailableException {
        Duration retryDelay = retryPolicy.getRetryDelay(task, task.getRetryCount());
        
        logger.warn("Task {} failed (attempt {}/{}), retrying in {}ms. Error: {}",
                   task.getId(), task.getRetryCount() + 1, task.getMaxRetry() + 1,
                   retryDelay.toMillis(), result.getErrorMessage());
        
        Task retrying = broker.retry(task, retryDelay, result.getErrorMessage());
        notify(retryNotifier, retrying);
        return retrying;
    }
    
    private Task handleFinalFailure(Task task, TaskResult result) throws BrokerUnavailableException {
        if (result.isSkipRetry()) {
            logger.error("Task {} failed permanently, retry skipped: {}", task.getId(), result.getErrorMessage());
        } else {
            logger.error("Task {} failed permanently after {} retries. Final error: {}",
                       task.getId(), task.getRetryCount(), result.getErrorMessage());
        }
        
        Task failed = broker.fail(task, result.getErrorMessage());
        notify(terminalNotifier, failed);
        return failed;
    }
    
    private void notify(Consumer<Task> notifier, Task task) {
        if (notifier == null) {
            return;
        }
        try {
            notifier.accept(task);
        } catch (RuntimeException e) {
            logger.error("Error in failure notifier for task {}", task.getId(), e);
        }
    }
    
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
    
    /**
     * Builder for creating failure handlers
     */
    public static class Builder {
        private TaskBroker broker;
        private RetryPolicy retryPolicy = RetryPolicy.Predefined.standard();
        private Consumer<Task> retryNotifier;
        private Consumer<Task> terminalNotifier;
        
        public Builder broker(TaskBroker broker) {
            this.broker = broker;
            return this;
        }
        
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }
        
        public Builder retryNotifier(Consumer<Task> retryNotifier) {
            this.retryNotifier = retryNotifier;
            return this;
        }
        
        public Builder terminalNotifier(Consumer<Task> terminalNotifier) {
            this.terminalNotifier = terminalNotifier;
            return this;
        }
        
        public FailureHandler build() {
            if (broker == null) {
                throw new IllegalArgumentException("Broker is required");
            }
            return new FailureHandler(broker, retryPolicy, retryNotifier, terminalNotifier);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
}
