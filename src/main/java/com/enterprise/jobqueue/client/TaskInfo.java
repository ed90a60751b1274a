package com.enterprise.jobqueue.client;

import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskState;

import java.time.Instant;

/**
 * What a producer learns about a task it just enqueued
 */
public final class TaskInfo {
    
    private final String id;
    private final String type;
    private final String queue;
    private final TaskState state;
    private final int maxRetry;
    private final Instant processAt;
    
    private TaskInfo(String id, String type, String queue, TaskState state, int maxRetry, Instant processAt) {
        this.id = id;
        this.type = type;
        this.queue = queue;
        this.state = state;
        this.maxRetry = maxRetry;
        this.processAt = processAt;
    }
    
    static TaskInfo of(Task task) {
        return new TaskInfo(task.getId(), task.getType(), task.getQueue(), task.getState(),
            task.getMaxRetry(), task.getProcessAt());
    }
    
    public String getId() { return id; }
    
    public String getType() { return type; }
    
    public String getQueue() { return queue; }
    
    public TaskState getState() { return state; }
    
    public int getMaxRetry() { return maxRetry; }
    
    public Instant getProcessAt() { return processAt; }
    
    @Override
    public String toString() {
        return "TaskInfo{id=" + id + ", type=" + type + ", queue=" + queue + ", state=" + state + "}";
    }
}
