package com.enterprise.jobqueue.exception;

/**
 * Exception thrown by a fail-closed idempotency guard when its store is unreachable
 */
public class IdempotencyStoreUnavailableException extends JobQueueException {
    
    private final String idempotencyKey;
    
    public IdempotencyStoreUnavailableException(String idempotencyKey, Throwable cause) {
        super(ErrorCode.INTERNAL, "Idempotency check failed for key: " + idempotencyKey, cause);
        this.idempotencyKey = idempotencyKey;
    }
    
    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
