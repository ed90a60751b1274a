package com.enterprise.jobqueue.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskStateTest {

    @Test
    void testPendingOnlyMovesToActive() {
        assertTrue(TaskState.PENDING.canTransitionTo(TaskState.ACTIVE));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.COMPLETED));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.FAILED));
    }

    @Test
    void testActiveOutcomes() {
        assertTrue(TaskState.ACTIVE.canTransitionTo(TaskState.COMPLETED));
        assertTrue(TaskState.ACTIVE.canTransitionTo(TaskState.RETRY));
        assertTrue(TaskState.ACTIVE.canTransitionTo(TaskState.FAILED));
        assertTrue(TaskState.ACTIVE.canTransitionTo(TaskState.PENDING));
        assertFalse(TaskState.ACTIVE.canTransitionTo(TaskState.SCHEDULED));
    }

    @Test
    void testWaitingStatesBecomePending() {
        assertTrue(TaskState.RETRY.canTransitionTo(TaskState.PENDING));
        assertTrue(TaskState.SCHEDULED.canTransitionTo(TaskState.PENDING));
        assertFalse(TaskState.RETRY.canTransitionTo(TaskState.ACTIVE));
    }

    @Test
    void testFailedOnlyLeavesThroughAdminRetry() {
        assertTrue(TaskState.FAILED.canTransitionTo(TaskState.PENDING));
        assertFalse(TaskState.FAILED.canTransitionTo(TaskState.ACTIVE));
        assertFalse(TaskState.FAILED.canTransitionTo(TaskState.RETRY));
    }

    @Test
    void testCompletedIsFinal() {
        for (TaskState next : TaskState.values()) {
            assertFalse(TaskState.COMPLETED.canTransitionTo(next), "COMPLETED -> " + next);
        }
    }

    @Test
    void testIsQueued() {
        assertTrue(TaskState.PENDING.isQueued());
        assertTrue(TaskState.RETRY.isQueued());
        assertTrue(TaskState.SCHEDULED.isQueued());
        assertFalse(TaskState.ACTIVE.isQueued());
        assertFalse(TaskState.FAILED.isQueued());
    }
}
