package com.enterprise.jobqueue.patterns;

import com.enterprise.jobqueue.core.TaskContext;

/**
 * Consumer of one fan-out event on the worker side
 */
@FunctionalInterface
public interface FanoutEventHandler {

    void handle(TaskContext context, FanoutEvent event) throws Exception;
}
