package com.enterprise.jobqueue.idempotency;

import java.util.Optional;

/**
 * Outcome of {@link IdempotencyGuard#reserve}.
 * {@code alreadyHandled} means another attempt has completed, or is still running,
 * for the same key and the handler must not run. {@code held} means this caller
 * owns the IN_PROGRESS record and must release or abandon it.
 */
public final class Reservation {
    
    private static final Reservation UNGUARDED = new Reservation(false, false, null);
    
    private final boolean alreadyHandled;
    private final boolean held;
    private final byte[] cachedResult;
    
    private Reservation(boolean alreadyHandled, boolean held, byte[] cachedResult) {
        this.alreadyHandled = alreadyHandled;
        this.held = held;
        this.cachedResult = cachedResult;
    }
    
    static Reservation acquired() {
        return new Reservation(false, true, null);
    }
    
    static Reservation duplicate(byte[] cachedResult) {
        return new Reservation(true, false, cachedResult);
    }
    
    /**
     * No record was taken: empty key, or a fail-open guard whose store is down
     */
    static Reservation unguarded() {
        return UNGUARDED;
    }
    
    public boolean isAlreadyHandled() {
        return alreadyHandled;
    }
    
    public boolean isHeld() {
        return held;
    }
    
    public Optional<byte[]> getCachedResult() {
        return Optional.ofNullable(cachedResult);
    }
}
