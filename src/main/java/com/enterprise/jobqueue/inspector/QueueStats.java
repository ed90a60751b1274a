package com.enterprise.jobqueue.inspector;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Snapshot of every queue plus their totals
 */
public final class QueueStats {
    
    private final AggregateStats aggregate;
    private final List<QueueInfo> queues;
    private final Instant generatedAt;
    
    public QueueStats(List<QueueInfo> queues, Instant generatedAt) {
        this.queues = Collections.unmodifiableList(queues);
        this.aggregate = AggregateStats.of(queues);
        this.generatedAt = generatedAt;
    }
    
    public AggregateStats getAggregate() {
        return aggregate;
    }
    
    public List<QueueInfo> getQueues() {
        return queues;
    }
    
    public QueueInfo getQueue(String name) {
        return queues.stream()
            .filter(queue -> queue.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown queue: " + name));
    }
    
    public Instant getGeneratedAt() {
        return generatedAt;
    }
}
