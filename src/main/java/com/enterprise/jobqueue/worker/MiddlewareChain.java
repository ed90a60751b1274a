package com.enterprise.jobqueue.worker;

import com.enterprise.jobqueue.core.TaskHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered middleware list. The first middleware is the outermost one.
 */
public final class MiddlewareChain {
    
    private final List<TaskMiddleware> middlewares;
    
    public MiddlewareChain(List<TaskMiddleware> middlewares) {
        this.middlewares = Collections.unmodifiableList(new ArrayList<>(middlewares));
    }
    
    public static MiddlewareChain empty() {
        return new MiddlewareChain(Collections.emptyList());
    }
    
    /**
     * Wrap the terminal handler with every middleware, last one innermost
     */
    public TaskHandler then(TaskHandler terminal) {
        TaskHandler handler = terminal;
        for (int i = middlewares.size() - 1; i >= 0; i--) {
            handler = middlewares.get(i).apply(handler);
        }
        return handler;
    }
    
    public List<TaskMiddleware> getMiddlewares() {
        return middlewares;
    }
    
    public int size() {
        return middlewares.size();
    }
}
