package com.enterprise.jobqueue.idempotency;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Stored marker for an idempotency key
 */
public class IdempotencyRecord {
    
    private final String key;
    private final IdempotencyStatus status;
    private final byte[] cachedResult;
    private final Instant expiresAt;
    
    @JsonCreator
    public IdempotencyRecord(@JsonProperty("key") String key,
                             @JsonProperty("status") IdempotencyStatus status,
                             @JsonProperty("cachedResult") byte[] cachedResult,
                             @JsonProperty("expiresAt") Instant expiresAt) {
        this.key = key;
        this.status = status;
        this.cachedResult = cachedResult;
        this.expiresAt = expiresAt;
    }
    
    public static IdempotencyRecord inProgress(String key, Instant expiresAt) {
        return new IdempotencyRecord(key, IdempotencyStatus.IN_PROGRESS, null, expiresAt);
    }
    
    public static IdempotencyRecord completed(String key, byte[] cachedResult, Instant expiresAt) {
        return new IdempotencyRecord(key, IdempotencyStatus.COMPLETED, cachedResult, expiresAt);
    }
    
    public String getKey() { return key; }
    
    public IdempotencyStatus getStatus() { return status; }
    
    public byte[] getCachedResult() { return cachedResult; }
    
    public Instant getExpiresAt() { return expiresAt; }
}
