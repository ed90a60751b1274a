package com.enterprise.jobqueue.inspector;

/**
 * Per-queue counts. {@code processed} and {@code failedAttempts} are lifetime
 * attempt counters, the other fields are current task counts per state.
 */
public final class QueueInfo {
    
    private final String name;
    private final int weight;
    private final long pending;
    private final long active;
    private final long scheduled;
    private final long retry;
    private final long failed;
    private final long completed;
    private final long processed;
    private final long failedAttempts;
    
    public QueueInfo(String name, int weight, long pending, long active, long scheduled, long retry,
                     long failed, long completed, long processed, long failedAttempts) {
        this.name = name;
        this.weight = weight;
        this.pending = pending;
        this.active = active;
        this.scheduled = scheduled;
        this.retry = retry;
        this.failed = failed;
        this.completed = completed;
        this.processed = processed;
        this.failedAttempts = failedAttempts;
    }
    
    public String getName() { return name; }
    
    public int getWeight() { return weight; }
    
    /**
     * Every task currently held by the queue, in any state
     */
    public long getSize() {
        return pending + active + scheduled + retry + failed + completed;
    }
    
    public long getPending() { return pending; }
    
    public long getActive() { return active; }
    
    public long getScheduled() { return scheduled; }
    
    public long getRetry() { return retry; }
    
    public long getFailed() { return failed; }
    
    public long getCompleted() { return completed; }
    
    public long getProcessed() { return processed; }
    
    public long getFailedAttempts() { return failedAttempts; }
}
