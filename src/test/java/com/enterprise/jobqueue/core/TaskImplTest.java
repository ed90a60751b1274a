package com.enterprise.jobqueue.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskImplTest {

    @Test
    void testBuilderDefaults() {
        TaskImpl task = TaskImpl.builder()
            .type("email:send")
            .build();

        assertNotNull(task.getId());
        assertFalse(task.getId().isEmpty());
        assertEquals("default", task.getQueue());
        assertEquals(TaskState.PENDING, task.getState());
        assertEquals(0, task.getRetryCount());
        assertEquals(25, task.getMaxRetry());
        assertEquals(Duration.ofMinutes(30), task.getTimeout());
        assertEquals(0, task.getPayload().length);
    }

    @Test
    void testRejectsMissingType() {
        assertThrows(IllegalArgumentException.class, () -> TaskImpl.builder().build());
        assertThrows(IllegalArgumentException.class, () -> TaskImpl.builder().type("  ").build());
    }

    @Test
    void testRetryCountMustStayWithinMaxRetry() {
        assertThrows(IllegalArgumentException.class, () ->
            TaskImpl.builder().type("t").maxRetry(2).retryCount(3).build());
        assertThrows(IllegalArgumentException.class, () ->
            TaskImpl.builder().type("t").retryCount(-1).build());

        TaskImpl atCeiling = TaskImpl.builder().type("t").maxRetry(2).retryCount(2).build();
        assertEquals(2, atCeiling.getRetryCount());
    }

    @Test
    void testPayloadIsDefensivelyCopied() {
        byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);
        TaskImpl task = TaskImpl.builder().type("t").payload(payload).build();

        task.getPayload()[0] = 'X';

        assertEquals("hello", new String(task.getPayload(), StandardCharsets.UTF_8));
    }

    @Test
    void testLegalTransitionReturnsNewTask() {
        TaskImpl task = TaskImpl.builder().type("t").build();

        Task active = task.transitionTo(TaskState.ACTIVE);

        assertEquals(TaskState.ACTIVE, active.getState());
        assertEquals(TaskState.PENDING, task.getState());
        assertEquals(task.getId(), active.getId());
    }

    @Test
    void testIllegalTransitionThrows() {
        TaskImpl task = TaskImpl.builder().type("t").build();

        assertThrows(IllegalStateException.class, () -> task.transitionTo(TaskState.COMPLETED));
    }

    @Test
    void testWithFailureKeepsIdentity() {
        Instant failedAt = Instant.parse("2024-01-01T00:00:00Z");
        TaskImpl task = TaskImpl.builder().type("t").maxRetry(3).build();

        Task failed = task.withRetryCount(1).withFailure("boom", failedAt);

        assertEquals(task.getId(), failed.getId());
        assertEquals(1, failed.getRetryCount());
        assertEquals("boom", failed.getLastError());
        assertEquals(failedAt, failed.getLastFailedAt());
    }
}
