package com.enterprise.jobqueue.inspector;

import com.enterprise.jobqueue.broker.QueueDefinition;
import com.enterprise.jobqueue.broker.TaskBroker;
import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskState;
import com.enterprise.jobqueue.exception.BrokerUnavailableException;
import com.enterprise.jobqueue.exception.InvalidQueueException;
import com.enterprise.jobqueue.exception.TaskNotFoundException;
import com.enterprise.jobqueue.monitoring.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Queue inspector reading directly from the broker
 */
public class BrokerQueueInspector implements QueueInspector {
    
    private static final Logger logger = LoggerFactory.getLogger(BrokerQueueInspector.class);
    
    // Listing order of listJobs
    private static final List<TaskState> QUEUED_STATES = Arrays.asList(
        TaskState.ACTIVE, TaskState.PENDING, TaskState.RETRY, TaskState.SCHEDULED);
    
    private final TaskBroker broker;
    private final MetricsCollector metricsCollector;
    
    public BrokerQueueInspector(TaskBroker broker) {
        this(broker, null);
    }
    
    public BrokerQueueInspector(TaskBroker broker, MetricsCollector metricsCollector) {
        this.broker = broker;
        this.metricsCollector = metricsCollector;
    }
    
    @Override
    public QueueStats getStats() throws BrokerUnavailableException {
        List<QueueInfo> queues = new ArrayList<>();
        for (QueueDefinition queue : broker.getQueues()) {
            String name = queue.getName();
            queues.add(new QueueInfo(
                name,
                queue.getWeight(),
                broker.countTasks(name, TaskState.PENDING),
                broker.countTasks(name, TaskState.ACTIVE),
                broker.countTasks(name, TaskState.SCHEDULED),
                broker.countTasks(name, TaskState.RETRY),
                broker.countTasks(name, TaskState.FAILED),
                broker.countTasks(name, TaskState.COMPLETED),
                broker.getProcessedCount(name),
                broker.getFailedCount(name)));
        }
        return new QueueStats(queues, broker.getClock().instant());
    }
    
    @Override
    public JobPage<JobInfo> listJobs(String queue, PageRequest page)
            throws InvalidQueueException, BrokerUnavailableException {
        validateQueue(queue);
        
        long[] counts = new long[QUEUED_STATES.size()];
        long total = 0;
        for (int i = 0; i < counts.length; i++) {
            counts[i] = broker.countTasks(queue, QUEUED_STATES.get(i));
            total += counts[i];
        }
        
        // Walk the concatenated state segments to the requested window
        List<JobInfo> items = new ArrayList<>();
        long offset = page.getOffset();
        int remaining = page.getPageSize();
        for (int i = 0; i < counts.length && remaining > 0; i++) {
            if (offset >= counts[i]) {
                offset -= counts[i];
                continue;
            }
            List<Task> chunk = broker.listTasks(queue, QUEUED_STATES.get(i), offset, remaining);
            for (Task task : chunk) {
                items.add(JobInfo.from(task));
            }
            remaining -= chunk.size();
            offset = 0;
        }
        
        return new JobPage<>(items, new Pagination(page.getPage(), page.getPageSize(), total));
    }
    
    @Override
    public JobPage<FailedJobInfo> listFailedJobs(String queue, PageRequest page)
            throws InvalidQueueException, BrokerUnavailableException {
        validateQueue(queue);
        
        long total = broker.countTasks(queue, TaskState.FAILED);
        List<FailedJobInfo> items = broker.listTasks(queue, TaskState.FAILED, page.getOffset(), page.getPageSize())
            .stream()
            .map(FailedJobInfo::from)
            .collect(Collectors.toList());
        
        return new JobPage<>(items, new Pagination(page.getPage(), page.getPageSize(), total));
    }
    
    @Override
    public JobInfo retryFailedJob(String queue, String taskId)
            throws InvalidQueueException, TaskNotFoundException, BrokerUnavailableException {
        validateQueue(queue);
        Task requeued = broker.retryFailed(queue, taskId);
        if (metricsCollector != null) {
            metricsCollector.recordEnqueued(queue, requeued.getType());
        }
        return JobInfo.from(requeued);
    }
    
    @Override
    public void deleteFailedJob(String queue, String taskId)
            throws InvalidQueueException, TaskNotFoundException, BrokerUnavailableException {
        validateQueue(queue);
        broker.deleteFailed(queue, taskId);
    }
    
    @Override
    public List<String> getValidQueues() {
        return broker.getQueues().stream()
            .map(QueueDefinition::getName)
            .collect(Collectors.toList());
    }
    
    private void validateQueue(String queue) throws InvalidQueueException {
        if (queue == null || !broker.isKnownQueue(queue)) {
            logger.debug("Rejected inspector request for queue {}", queue);
            throw new InvalidQueueException(queue);
        }
    }
}
