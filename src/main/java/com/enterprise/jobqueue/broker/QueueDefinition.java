package com.enterprise.jobqueue.broker;

import java.util.Objects;

/**
 * A named queue and its scheduling weight
 */
public final class QueueDefinition {
    
    public static final String CRITICAL = "critical";
    public static final String DEFAULT = "default";
    public static final String LOW = "low";
    
    private final String name;
    private final int weight;
    
    public QueueDefinition(String name, int weight) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Queue name cannot be empty");
        }
        if (weight <= 0) {
            throw new IllegalArgumentException("Queue weight must be positive: " + name + "=" + weight);
        }
        this.name = name;
        this.weight = weight;
    }
    
    public static QueueDefinition of(String name, int weight) {
        return new QueueDefinition(name, weight);
    }
    
    public String getName() {
        return name;
    }
    
    public int getWeight() {
        return weight;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueueDefinition)) return false;
        QueueDefinition that = (QueueDefinition) o;
        return weight == that.weight && name.equals(that.name);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, weight);
    }
    
    @Override
    public String toString() {
        return name + ":" + weight;
    }
}
