package com.enterprise.jobqueue.support;

import com.enterprise.jobqueue.store.BackingStore;
import com.enterprise.jobqueue.store.StoreUnavailableException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegating store whose next {@code compareAndDelete} calls fail as if the
 * connection dropped, before anything is applied
 */
public final class FlakyBackingStore implements BackingStore {

    private final BackingStore delegate;
    private final AtomicInteger compareAndDeleteFailures;

    public FlakyBackingStore(BackingStore delegate, int compareAndDeleteFailures) {
        this.delegate = delegate;
        this.compareAndDeleteFailures = new AtomicInteger(compareAndDeleteFailures);
    }

    public int remainingFailures() {
        return Math.max(0, compareAndDeleteFailures.get());
    }

    @Override
    public boolean compareAndDelete(String key, byte[] expected) {
        if (compareAndDeleteFailures.getAndDecrement() > 0) {
            throw new StoreUnavailableException("Connection reset");
        }
        return delegate.compareAndDelete(key, expected);
    }

    @Override
    public void pushTail(String list, String value) {
        delegate.pushTail(list, value);
    }

    @Override
    public Optional<String> popHead(String list) {
        return delegate.popHead(list);
    }

    @Override
    public List<String> listRange(String list, long offset, int limit) {
        return delegate.listRange(list, offset, limit);
    }

    @Override
    public long listSize(String list) {
        return delegate.listSize(list);
    }

    @Override
    public void addScored(String set, String member, long score) {
        delegate.addScored(set, member, score);
    }

    @Override
    public List<String> popDueScored(String set, long maxScore, int limit) {
        return delegate.popDueScored(set, maxScore, limit);
    }

    @Override
    public boolean removeScored(String set, String member) {
        return delegate.removeScored(set, member);
    }

    @Override
    public List<String> scoredRange(String set, long offset, int limit) {
        return delegate.scoredRange(set, offset, limit);
    }

    @Override
    public long scoredSize(String set) {
        return delegate.scoredSize(set);
    }

    @Override
    public Optional<byte[]> get(String key) {
        return delegate.get(key);
    }

    @Override
    public void put(String key, byte[] value, Duration ttl) {
        delegate.put(key, value, ttl);
    }

    @Override
    public boolean putIfAbsent(String key, byte[] value, Duration ttl) {
        return delegate.putIfAbsent(key, value, ttl);
    }

    @Override
    public boolean compareAndSet(String key, byte[] expected, byte[] update, Duration ttl) {
        return delegate.compareAndSet(key, expected, update, ttl);
    }

    @Override
    public boolean delete(String key) {
        return delegate.delete(key);
    }

    @Override
    public int purgeExpired() {
        return delegate.purgeExpired();
    }

    @Override
    public long increment(String counter, long delta) {
        return delegate.increment(counter, delta);
    }

    @Override
    public long counter(String counter) {
        return delegate.counter(counter);
    }

    @Override
    public void ping() {
        delegate.ping();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
