package com.enterprise.jobqueue.broker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Credit based weighted round robin over a fixed, ordered set of queues.
 * Each queue starts a cycle with credit equal to its weight. A selection scans the
 * queues in configuration order and picks the first one that has credit left and
 * a ready task. When no queue with credit has work but an exhausted queue does,
 * every credit is reset and a new cycle begins.
 */
public class WeightedRoundRobin {
    
    private final List<QueueDefinition> queues;
    private final int[] credits;
    
    public WeightedRoundRobin(List<QueueDefinition> queues) {
        if (queues == null || queues.isEmpty()) {
            throw new IllegalArgumentException("At least one queue is required");
        }
        this.queues = Collections.unmodifiableList(new ArrayList<>(queues));
        this.credits = new int[queues.size()];
        resetCredits();
    }
    
    /**
     * Pick the next queue to dispatch from and consume one of its credits
     *
     * @param hasReadyTask tells whether a queue currently holds a ready task
     * @return the selected queue name, empty when every queue is empty
     */
    public synchronized <E extends Exception> Optional<String> select(ReadinessProbe<E> hasReadyTask) throws E {
        for (int pass = 0; pass < 2; pass++) {
            boolean exhaustedQueueHasWork = false;
            for (int i = 0; i < queues.size(); i++) {
                String name = queues.get(i).getName();
                if (credits[i] > 0) {
                    if (hasReadyTask.test(name)) {
                        credits[i]--;
                        return Optional.of(name);
                    }
                } else if (!exhaustedQueueHasWork && hasReadyTask.test(name)) {
                    exhaustedQueueHasWork = true;
                }
            }
            if (!exhaustedQueueHasWork) {
                return Optional.empty();
            }
            resetCredits();
        }
        return Optional.empty();
    }
    
    public synchronized int getCredit(String queueName) {
        for (int i = 0; i < queues.size(); i++) {
            if (queues.get(i).getName().equals(queueName)) {
                return credits[i];
            }
        }
        throw new IllegalArgumentException("Unknown queue: " + queueName);
    }
    
    public List<QueueDefinition> getQueues() {
        return queues;
    }
    
    private void resetCredits() {
        for (int i = 0; i < queues.size(); i++) {
            credits[i] = queues.get(i).getWeight();
        }
    }
    
    /**
     * Readiness check that may fail with a checked exception
     */
    @FunctionalInterface
    public interface ReadinessProbe<E extends Exception> {
        boolean test(String queueName) throws E;
    }
}
