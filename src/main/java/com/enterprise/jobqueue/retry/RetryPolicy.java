package com.enterprise.jobqueue.retry;

import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskResult;
import com.enterprise.jobqueue.exception.HandlerNotFoundException;
import com.enterprise.jobqueue.exception.HandlerPanicException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Decides whether a failed attempt is retried and how long the task waits
 */
public interface RetryPolicy {
    
    /**
     * Determine if a task should be retried based on the result
     */
    boolean shouldRetry(Task task, TaskResult result);
    
    /**
     * Calculate the delay before the next attempt, given the retries consumed so far
     */
    Duration getRetryDelay(Task task, int retryCount);
    
    /**
     * Exponential backoff: min(maxDelay, baseDelay * multiplier^n + jitter)
     */
    class DefaultRetryPolicy implements RetryPolicy {
        private final Duration baseDelay;
        private final double backoffMultiplier;
        private final Duration maxDelay;
        private final double jitterFactor;
        private final boolean panicsAreTerminal;
        private final Predicate<Throwable> retryableExceptions;
        
        public DefaultRetryPolicy(Duration baseDelay, double backoffMultiplier, Duration maxDelay,
                                  double jitterFactor, boolean panicsAreTerminal,
                                  Predicate<Throwable> retryableExceptions) {
            this.baseDelay = baseDelay;
            this.backoffMultiplier = backoffMultiplier;
            this.maxDelay = maxDelay;
            this.jitterFactor = jitterFactor;
            this.panicsAreTerminal = panicsAreTerminal;
            this.retryableExceptions = retryableExceptions;
        }
        
        @Override
        public boolean shouldRetry(Task task, TaskResult result) {
            if (result.isSuccess()) {
                return false;
            }
            
            if (task.getRetryCount() >= task.getMaxRetry()) {
                return false;
            }
            
            if (result.isSkipRetry()) {
                return false;
            }
            
            Throwable exception = result.getException();
            if (exception instanceof HandlerNotFoundException) {
                return false;
            }
            if (panicsAreTerminal && exception instanceof HandlerPanicException) {
                return false;
            }
            
            return retryableExceptions.test(exception);
        }
        
        @Override
        public Duration getRetryDelay(Task task, int retryCount) {
            double delayMs = baseDelay.toMillis() * Math.pow(backoffMultiplier, retryCount);
            
            if (jitterFactor > 0) {
                delayMs += delayMs * jitterFactor * ThreadLocalRandom.current().nextDouble();
            }
            
            long actualDelay = (long) Math.min(delayMs, (double) maxDelay.toMillis());
            return Duration.ofMillis(actualDelay);
        }
        
        public Duration getBaseDelay() {
            return baseDelay;
        }
        
        public Duration getMaxDelay() {
            return maxDelay;
        }
    }
    
    /**
     * Builder for creating retry policies
     */
    class Builder {
        private Duration baseDelay = Duration.ofSeconds(5);
        private double backoffMultiplier = 2.0;
        private Duration maxDelay = Duration.ofMinutes(5);
        private double jitterFactor = 0.1;
        private boolean panicsAreTerminal = false;
        private Predicate<Throwable> retryableExceptions = ex -> true;
        
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }
        
        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }
        
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }
        
        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }
        
        public Builder panicsAreTerminal(boolean panicsAreTerminal) {
            this.panicsAreTerminal = panicsAreTerminal;
            return this;
        }
        
        public Builder retryableExceptions(Predicate<Throwable> retryableExceptions) {
            this.retryableExceptions = retryableExceptions;
            return this;
        }
        
        public RetryPolicy build() {
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("Backoff multiplier must be at least 1.0");
            }
            if (jitterFactor < 0) {
                throw new IllegalArgumentException("Jitter factor cannot be negative");
            }
            return new DefaultRetryPolicy(baseDelay, backoffMultiplier, maxDelay, jitterFactor,
                panicsAreTerminal, retryableExceptions);
        }
    }
    
    static Builder builder() {
        return new Builder();
    }
    
    /**
     * Predefined retry policies
     */
    class Predefined {
        
        /**
         * Every failure is terminal
         */
        public static RetryPolicy noRetry() {
            return builder().retryableExceptions(ex -> false).build();
        }
        
        /**
         * Quick retry policy for transient failures
         */
        public static RetryPolicy quickRetry() {
            return builder()
                .baseDelay(Duration.ofSeconds(1))
                .backoffMultiplier(1.5)
                .maxDelay(Duration.ofSeconds(10))
                .build();
        }
        
        /**
         * Standard retry policy
         */
        public static RetryPolicy standard() {
            return builder()
                .baseDelay(Duration.ofSeconds(5))
                .backoffMultiplier(2.0)
                .maxDelay(Duration.ofMinutes(5))
                .build();
        }
    }
}
