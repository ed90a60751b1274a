package com.enterprise.jobqueue.inspector;

import java.util.List;

/**
 * Totals over every configured queue
 */
public final class AggregateStats {
    
    private final int queueCount;
    private final long totalPending;
    private final long totalActive;
    private final long totalScheduled;
    private final long totalRetry;
    private final long totalFailed;
    private final long totalCompleted;
    private final long totalProcessed;
    private final long totalFailedAttempts;
    
    private AggregateStats(int queueCount, long totalPending, long totalActive, long totalScheduled,
                           long totalRetry, long totalFailed, long totalCompleted,
                           long totalProcessed, long totalFailedAttempts) {
        this.queueCount = queueCount;
        this.totalPending = totalPending;
        this.totalActive = totalActive;
        this.totalScheduled = totalScheduled;
        this.totalRetry = totalRetry;
        this.totalFailed = totalFailed;
        this.totalCompleted = totalCompleted;
        this.totalProcessed = totalProcessed;
        this.totalFailedAttempts = totalFailedAttempts;
    }
    
    public static AggregateStats of(List<QueueInfo> queues) {
        long pending = 0, active = 0, scheduled = 0, retry = 0, failed = 0, completed = 0;
        long processed = 0, failedAttempts = 0;
        for (QueueInfo queue : queues) {
            pending += queue.getPending();
            active += queue.getActive();
            scheduled += queue.getScheduled();
            retry += queue.getRetry();
            failed += queue.getFailed();
            completed += queue.getCompleted();
            processed += queue.getProcessed();
            failedAttempts += queue.getFailedAttempts();
        }
        return new AggregateStats(queues.size(), pending, active, scheduled, retry, failed, completed,
            processed, failedAttempts);
    }
    
    public int getQueueCount() { return queueCount; }
    
    public long getTotalPending() { return totalPending; }
    
    public long getTotalActive() { return totalActive; }
    
    public long getTotalScheduled() { return totalScheduled; }
    
    public long getTotalRetry() { return totalRetry; }
    
    public long getTotalFailed() { return totalFailed; }
    
    public long getTotalCompleted() { return totalCompleted; }
    
    public long getTotalProcessed() { return totalProcessed; }
    
    public long getTotalFailedAttempts() { return totalFailedAttempts; }
}
