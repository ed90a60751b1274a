package com.enterprise.jobqueue.idempotency;

/**
 * What the idempotency guard does when its store is unreachable
 */
public enum FailMode {
    /**
     * Run the handler anyway; duplicates become possible
     */
    FAIL_OPEN,
    /**
     * Refuse to run the handler; the attempt fails and is retried
     */
    FAIL_CLOSED
}
