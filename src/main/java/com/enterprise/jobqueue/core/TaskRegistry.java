package com.enterprise.jobqueue.core;

import com.enterprise.jobqueue.exception.HandlerNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping of task type to handler, built once at startup
 */
public final class TaskRegistry {
    
    private final Map<String, TaskHandler> handlers;
    
    private TaskRegistry(Map<String, TaskHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }
    
    public Optional<TaskHandler> find(String taskType) {
        return Optional.ofNullable(handlers.get(taskType));
    }
    
    public TaskHandler getHandler(String taskType) throws HandlerNotFoundException {
        TaskHandler handler = handlers.get(taskType);
        if (handler == null) {
            throw new HandlerNotFoundException(taskType);
        }
        return handler;
    }
    
    public boolean isRegistered(String taskType) {
        return handlers.containsKey(taskType);
    }
    
    public Set<String> getTaskTypes() {
        return handlers.keySet();
    }
    
    public int size() {
        return handlers.size();
    }
    
    /**
     * Builder for creating registries
     */
    public static class Builder {
        private final Map<String, TaskHandler> handlers = new LinkedHashMap<>();
        
        public Builder register(String taskType, TaskHandler handler) {
            if (taskType == null || taskType.trim().isEmpty()) {
                throw new IllegalArgumentException("Task type cannot be empty");
            }
            if (handler == null) {
                throw new IllegalArgumentException("Handler for " + taskType + " cannot be null");
            }
            if (handlers.containsKey(taskType)) {
                throw new IllegalArgumentException("Handler already registered for task type: " + taskType);
            }
            handlers.put(taskType, handler);
            return this;
        }
        
        public TaskRegistry build() {
            return new TaskRegistry(handlers);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
}
