package com.enterprise.jobqueue.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Atomic key/list/scored-set primitives the broker and the idempotency guard are
 * built on. Every method is a single atomic operation with respect to every other
 * method of the same store. Implementations signal connectivity problems with
 * {@link StoreUnavailableException}.
 */
public interface BackingStore extends AutoCloseable {
    
    // Lists (FIFO)
    
    void pushTail(String list, String value);
    
    Optional<String> popHead(String list);
    
    List<String> listRange(String list, long offset, int limit);
    
    long listSize(String list);
    
    // Scored sets, ordered by ascending score
    
    void addScored(String set, String member, long score);
    
    /**
     * Remove and return up to {@code limit} members whose score is at most {@code maxScore}
     */
    List<String> popDueScored(String set, long maxScore, int limit);
    
    boolean removeScored(String set, String member);
    
    List<String> scoredRange(String set, long offset, int limit);
    
    long scoredSize(String set);
    
    // Values with an optional time to live (null ttl means no expiry)
    
    Optional<byte[]> get(String key);
    
    void put(String key, byte[] value, Duration ttl);
    
    boolean putIfAbsent(String key, byte[] value, Duration ttl);
    
    boolean compareAndSet(String key, byte[] expected, byte[] update, Duration ttl);
    
    boolean compareAndDelete(String key, byte[] expected);
    
    boolean delete(String key);
    
    /**
     * Drop every value whose time to live has elapsed
     *
     * @return number of values removed
     */
    int purgeExpired();
    
    // Counters
    
    long increment(String counter, long delta);
    
    long counter(String counter);
    
    /**
     * Health probe, throws {@link StoreUnavailableException} when the store cannot serve requests
     */
    void ping();
    
    @Override
    void close();
}
