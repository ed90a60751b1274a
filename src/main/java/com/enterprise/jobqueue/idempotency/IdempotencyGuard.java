package com.enterprise.jobqueue.idempotency;

import com.enterprise.jobqueue.core.TaskCodec;
import com.enterprise.jobqueue.exception.IdempotencyStoreUnavailableException;
import com.enterprise.jobqueue.store.BackingStore;
import com.enterprise.jobqueue.store.StoreUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Atomic "already started or completed?" check per key within a TTL window.
 * A key is claimed with set-if-absent, so of any number of concurrent reservations
 * for the same key exactly one proceeds.
 */
public class IdempotencyGuard {
    
    private static final Logger logger = LoggerFactory.getLogger(IdempotencyGuard.class);
    
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    public static final String DEFAULT_KEY_PREFIX = "idempotency:";
    
    private final BackingStore store;
    private final ObjectMapper objectMapper;
    private final FailMode failMode;
    private final String keyPrefix;
    private final Duration defaultTtl;
    private final Clock clock;
    
    public IdempotencyGuard(BackingStore store, ObjectMapper objectMapper, FailMode failMode,
                            String keyPrefix, Duration defaultTtl, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("Idempotency store is required");
        }
        this.store = store;
        this.objectMapper = objectMapper;
        this.failMode = failMode;
        this.keyPrefix = keyPrefix;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }
    
    /**
     * Claim the key for the caller
     *
     * @throws IdempotencyStoreUnavailableException when the store is down and the guard fails closed
     */
    public Reservation reserve(String key, Duration ttl) throws IdempotencyStoreUnavailableException {
        if (key == null || key.isEmpty()) {
            return Reservation.unguarded();
        }
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        try {
            IdempotencyRecord record = IdempotencyRecord.inProgress(key, clock.instant().plus(effectiveTtl));
            if (store.putIfAbsent(storeKey(key), encode(record), effectiveTtl)) {
                logger.debug("Idempotency key {} reserved", key);
                return Reservation.acquired();
            }
            Optional<IdempotencyRecord> existing = read(key);
            if (!existing.isPresent()) {
                // expired between the two calls, claim it again
                return reserve(key, ttl);
            }
            logger.info("Idempotency key {} already {}", key, existing.get().getStatus());
            return Reservation.duplicate(existing.get().getCachedResult());
        } catch (StoreUnavailableException e) {
            if (failMode == FailMode.FAIL_CLOSED) {
                logger.error("Idempotency store unavailable, refusing key {}", key, e);
                throw new IdempotencyStoreUnavailableException(key, e);
            }
            logger.warn("Idempotency store unavailable, processing key {} unguarded: {}", key, e.getMessage());
            return Reservation.unguarded();
        }
    }
    
    public Reservation reserve(String key) throws IdempotencyStoreUnavailableException {
        return reserve(key, defaultTtl);
    }
    
    /**
     * Mark the key COMPLETED, optionally caching the result for later duplicates
     */
    public void release(String key, byte[] result, Duration ttl) {
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        IdempotencyRecord record = IdempotencyRecord.completed(key, result, clock.instant().plus(effectiveTtl));
        try {
            store.put(storeKey(key), encode(record), effectiveTtl);
            logger.debug("Idempotency key {} completed", key);
        } catch (StoreUnavailableException e) {
            // the work is done; a duplicate may run again once the IN_PROGRESS record expires
            logger.error("Failed to mark idempotency key {} completed", key, e);
        }
    }
    
    /**
     * Drop an IN_PROGRESS record after a failed attempt so the retry can claim the key again.
     * A COMPLETED record is never removed.
     */
    public void abandon(String key) {
        try {
            Optional<byte[]> raw = store.get(storeKey(key));
            if (!raw.isPresent()) {
                return;
            }
            IdempotencyRecord record = decode(raw.get());
            if (record.getStatus() == IdempotencyStatus.IN_PROGRESS
                    && store.compareAndDelete(storeKey(key), raw.get())) {
                logger.debug("Idempotency key {} abandoned", key);
            }
        } catch (StoreUnavailableException e) {
            logger.warn("Failed to abandon idempotency key {}, the retry waits for its expiry: {}",
                key, e.getMessage());
        }
    }
    
    public Optional<IdempotencyRecord> read(String key) {
        return store.get(storeKey(key)).map(this::decode);
    }
    
    public FailMode getFailMode() {
        return failMode;
    }
    
    public Duration getDefaultTtl() {
        return defaultTtl;
    }
    
    private String storeKey(String key) {
        return keyPrefix + key;
    }
    
    private byte[] encode(IdempotencyRecord record) {
        try {
            return objectMapper.writeValueAsBytes(record);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode idempotency record " + record.getKey(), e);
        }
    }
    
    private IdempotencyRecord decode(byte[] raw) {
        try {
            return objectMapper.readValue(raw, IdempotencyRecord.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode idempotency record", e);
        }
    }
    
    /**
     * Builder for creating guards
     */
    public static class Builder {
        private BackingStore store;
        private ObjectMapper objectMapper;
        private FailMode failMode = FailMode.FAIL_OPEN;
        private String keyPrefix = DEFAULT_KEY_PREFIX;
        private Duration defaultTtl = DEFAULT_TTL;
        private Clock clock = Clock.systemUTC();
        
        public Builder store(BackingStore store) {
            this.store = store;
            return this;
        }
        
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }
        
        public Builder failMode(FailMode failMode) {
            this.failMode = failMode;
            return this;
        }
        
        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }
        
        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }
        
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }
        
        public IdempotencyGuard build() {
            ObjectMapper mapper = objectMapper != null ? objectMapper : TaskCodec.defaultObjectMapper();
            return new IdempotencyGuard(store, mapper, failMode, keyPrefix, defaultTtl, clock);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
}
