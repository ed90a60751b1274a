package com.enterprise.jobqueue.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a task, with the transitions it may legally take
 */
public enum TaskState {
    PENDING,
    SCHEDULED,
    ACTIVE,
    RETRY,
    COMPLETED,
    FAILED;
    
    /**
     * Whether this state may move to the given one
     */
    public boolean canTransitionTo(TaskState next) {
        return allowedTransitions().contains(next);
    }
    
    /**
     * Whether the task is waiting in a queue (ready or not yet due)
     */
    public boolean isQueued() {
        return this == PENDING || this == SCHEDULED || this == RETRY;
    }
    
    private Set<TaskState> allowedTransitions() {
        switch (this) {
            case PENDING:
                return EnumSet.of(ACTIVE);
            case SCHEDULED:
            case RETRY:
                return EnumSet.of(PENDING);
            case ACTIVE:
                // PENDING: put back by a forced shutdown without consuming a retry
                return EnumSet.of(COMPLETED, RETRY, FAILED, PENDING);
            case FAILED:
                return EnumSet.of(PENDING);
            case COMPLETED:
            default:
                return EnumSet.noneOf(TaskState.class);
        }
    }
}
