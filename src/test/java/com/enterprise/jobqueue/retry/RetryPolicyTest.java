package com.enterprise.jobqueue.retry;

import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskImpl;
import com.enterprise.jobqueue.core.TaskResult;
import com.enterprise.jobqueue.exception.HandlerNotFoundException;
import com.enterprise.jobqueue.exception.HandlerPanicException;
import com.enterprise.jobqueue.exception.SkipRetryException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.builder()
        .baseDelay(Duration.ofSeconds(1))
        .backoffMultiplier(2.0)
        .maxDelay(Duration.ofSeconds(30))
        .jitterFactor(0)
        .build();

    private Task task(int retryCount, int maxRetry) {
        return TaskImpl.builder().type("t").maxRetry(maxRetry).retryCount(retryCount).build();
    }

    private TaskResult failure(Throwable error) {
        return TaskResult.failure(error, Duration.ofMillis(5));
    }

    @Test
    void testRetriesOrdinaryFailureWithinBudget() {
        assertTrue(policy.shouldRetry(task(0, 3), failure(new IOException("down"))));
        assertTrue(policy.shouldRetry(task(2, 3), failure(new IOException("down"))));
    }

    @Test
    void testStopsAtMaxRetry() {
        assertFalse(policy.shouldRetry(task(3, 3), failure(new IOException("down"))));
        assertFalse(policy.shouldRetry(task(0, 0), failure(new IOException("down"))));
    }

    @Test
    void testSuccessIsNeverRetried() {
        assertFalse(policy.shouldRetry(task(0, 3), TaskResult.success(Duration.ZERO)));
    }

    @Test
    void testSkipRetryAnywhereInCauseChain() {
        Exception wrapped = new IllegalStateException("outer", new SkipRetryException("bad payload"));

        assertFalse(policy.shouldRetry(task(0, 3), failure(new SkipRetryException("bad payload"))));
        assertFalse(policy.shouldRetry(task(0, 3), failure(wrapped)));
    }

    @Test
    void testMissingHandlerIsTerminal() {
        assertFalse(policy.shouldRetry(task(0, 3), failure(new HandlerNotFoundException("t"))));
    }

    @Test
    void testPanicsRetryUnlessConfiguredTerminal() {
        HandlerPanicException panic = new HandlerPanicException("t", new NullPointerException());
        RetryPolicy strict = RetryPolicy.builder().panicsAreTerminal(true).build();

        assertTrue(policy.shouldRetry(task(0, 3), failure(panic)));
        assertFalse(strict.shouldRetry(task(0, 3), failure(panic)));
    }

    @Test
    void testExponentialBackoffIsCapped() {
        Task t = task(0, 10);

        assertEquals(Duration.ofSeconds(1), policy.getRetryDelay(t, 0));
        assertEquals(Duration.ofSeconds(2), policy.getRetryDelay(t, 1));
        assertEquals(Duration.ofSeconds(8), policy.getRetryDelay(t, 3));
        assertEquals(Duration.ofSeconds(30), policy.getRetryDelay(t, 10));
    }

    @Test
    void testJitterStaysWithinFactor() {
        RetryPolicy jittered = RetryPolicy.builder()
            .baseDelay(Duration.ofSeconds(10))
            .jitterFactor(0.1)
            .maxDelay(Duration.ofMinutes(5))
            .build();

        for (int i = 0; i < 50; i++) {
            long delay = jittered.getRetryDelay(task(0, 3), 0).toMillis();
            assertTrue(delay >= 10_000 && delay <= 11_000, "delay " + delay);
        }
    }

    @Test
    void testNoRetryPolicy() {
        assertFalse(RetryPolicy.Predefined.noRetry().shouldRetry(task(0, 3), failure(new IOException())));
    }

    @Test
    void testRejectsShrinkingMultiplier() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().backoffMultiplier(0.5).build());
    }
}
