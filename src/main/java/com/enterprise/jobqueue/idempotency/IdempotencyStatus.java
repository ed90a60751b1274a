package com.enterprise.jobqueue.idempotency;

public enum IdempotencyStatus {
    IN_PROGRESS,
    COMPLETED
}
