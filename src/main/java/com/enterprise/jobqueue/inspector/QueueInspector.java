package com.enterprise.jobqueue.inspector;

import com.enterprise.jobqueue.exception.BrokerUnavailableException;
import com.enterprise.jobqueue.exception.InvalidPageException;
import com.enterprise.jobqueue.exception.InvalidQueueException;
import com.enterprise.jobqueue.exception.TaskNotFoundException;

import java.util.List;

/**
 * Administrative view over queued and failed work
 */
public interface QueueInspector {
    
    /**
     * Per-queue and aggregate counts; read-only
     */
    QueueStats getStats() throws BrokerUnavailableException;
    
    /**
     * Active, pending, retrying and scheduled tasks of a queue, in that order
     */
    JobPage<JobInfo> listJobs(String queue, PageRequest page)
        throws InvalidQueueException, BrokerUnavailableException;
    
    /**
     * Failed tasks of a queue, oldest failure first
     */
    JobPage<FailedJobInfo> listFailedJobs(String queue, PageRequest page)
        throws InvalidQueueException, BrokerUnavailableException;
    
    /**
     * Requeue a failed task with a fresh retry budget
     */
    JobInfo retryFailedJob(String queue, String taskId)
        throws InvalidQueueException, TaskNotFoundException, BrokerUnavailableException;
    
    /**
     * Permanently remove a failed task
     */
    void deleteFailedJob(String queue, String taskId)
        throws InvalidQueueException, TaskNotFoundException, BrokerUnavailableException;
    
    List<String> getValidQueues();
    
    default JobPage<JobInfo> listJobs(String queue, int page, int pageSize)
            throws InvalidQueueException, InvalidPageException, BrokerUnavailableException {
        return listJobs(queue, PageRequest.of(page, pageSize));
    }
    
    default JobPage<FailedJobInfo> listFailedJobs(String queue, int page, int pageSize)
            throws InvalidQueueException, InvalidPageException, BrokerUnavailableException {
        return listFailedJobs(queue, PageRequest.of(page, pageSize));
    }
}
