package com.enterprise.jobqueue.store;

/**
 * Raised by a {@link BackingStore} that cannot serve a request, e.g. because it
 * has been closed or its underlying storage failed.
 */
public class StoreUnavailableException extends RuntimeException {
    
    public StoreUnavailableException(String message) {
        super(message);
    }
    
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
