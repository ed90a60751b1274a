package com.enterprise.jobqueue.patterns;

import com.enterprise.jobqueue.broker.QueueDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Maps event types to the handlers that receive a copy of each event.
 * Shared by the publishing side, which needs handler ids and queues, and the
 * worker side, which needs the handler functions.
 */
public class FanoutRegistry {

    private final Map<String, List<Registration>> handlers = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void register(String eventType, String handlerId, FanoutEventHandler handler) {
        register(eventType, handlerId, handler, QueueDefinition.DEFAULT);
    }

    /**
     * Register a handler for an event type, targeting the given queue
     *
     * @throws IllegalArgumentException on an empty event type or handler id, a null
     *         handler, or a handler id already registered for the event type
     */
    public void register(String eventType, String handlerId, FanoutEventHandler handler, String queue) {
        if (eventType == null || eventType.isEmpty()) {
            throw new IllegalArgumentException("Event type cannot be empty");
        }
        if (handlerId == null || handlerId.isEmpty()) {
            throw new IllegalArgumentException("Handler id cannot be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        String targetQueue = queue == null || queue.isEmpty() ? QueueDefinition.DEFAULT : queue;

        lock.writeLock().lock();
        try {
            List<Registration> registered = handlers.computeIfAbsent(eventType, k -> new ArrayList<>());
            for (Registration existing : registered) {
                if (existing.getHandlerId().equals(handlerId)) {
                    throw new IllegalArgumentException(
                        "Handler " + handlerId + " already registered for event type " + eventType);
                }
            }
            registered.add(new Registration(handlerId, handler, targetQueue));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean unregister(String eventType, String handlerId) {
        lock.writeLock().lock();
        try {
            List<Registration> registered = handlers.get(eventType);
            return registered != null && registered.removeIf(r -> r.getHandlerId().equals(handlerId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Snapshot of the handlers for an event type, in registration order
     */
    public List<Registration> handlers(String eventType) {
        lock.readLock().lock();
        try {
            List<Registration> registered = handlers.get(eventType);
            return registered == null ? Collections.emptyList() : new ArrayList<>(registered);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Registration> find(String eventType, String handlerId) {
        return handlers(eventType).stream()
            .filter(r -> r.getHandlerId().equals(handlerId))
            .findFirst();
    }

    public static final class Registration {
        private final String handlerId;
        private final FanoutEventHandler handler;
        private final String queue;

        Registration(String handlerId, FanoutEventHandler handler, String queue) {
            this.handlerId = handlerId;
            this.handler = handler;
            this.queue = queue;
        }

        public String getHandlerId() { return handlerId; }
        public FanoutEventHandler getHandler() { return handler; }
        public String getQueue() { return queue; }
    }
}
