package com.enterprise.jobqueue.worker;

import com.enterprise.jobqueue.core.TaskHandler;

/**
 * Wraps the next handler of the chain with cross-cutting behaviour
 */
@FunctionalInterface
public interface TaskMiddleware {
    
    TaskHandler apply(TaskHandler next);
}
