package com.enterprise.jobqueue.scheduler;

import com.enterprise.jobqueue.client.TaskClient;
import com.enterprise.jobqueue.client.TaskInfo;
import com.enterprise.jobqueue.exception.JobQueueException;
import it.sauronsoftware.cron4j.Scheduler;
import it.sauronsoftware.cron4j.SchedulingPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Enqueues tasks on cron schedules. It only produces tasks; a worker pool
 * on the same broker consumes them.
 */
public class PeriodicTaskScheduler {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicTaskScheduler.class);

    private final TaskClient client;
    private final Scheduler cronScheduler;
    private final Map<String, ScheduledJob> entries = Collections.synchronizedMap(new LinkedHashMap<>());

    public PeriodicTaskScheduler(TaskClient client) {
        this.client = client;
        this.cronScheduler = new Scheduler();
    }

    /**
     * Check a cron spec without registering anything
     */
    public static void validateCronspec(String cronspec) {
        if (cronspec == null || !SchedulingPattern.validate(cronspec)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronspec);
        }
    }

    /**
     * Register a job and return its entry id
     */
    public String register(ScheduledJob job) {
        validateCronspec(job.getCronspec());

        String[] holder = new String[1];
        synchronized (entries) {
            holder[0] = cronScheduler.schedule(job.getCronspec(), () -> fire(holder[0]));
            entries.put(holder[0], job);
        }

        logger.info("Registered scheduled job entry={} type={} cronspec='{}' description='{}'",
                   holder[0], job.getTaskType(), job.getCronspec(), job.getDescription());
        return holder[0];
    }

    /**
     * Remove a job; returns false when the entry id is unknown
     */
    public boolean unregister(String entryId) {
        ScheduledJob removed = entries.remove(entryId);
        if (removed == null) {
            return false;
        }
        cronScheduler.deschedule(entryId);
        logger.info("Unregistered scheduled job entry={} type={}", entryId, removed.getTaskType());
        return true;
    }

    public Map<String, ScheduledJob> getEntries() {
        synchronized (entries) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    /**
     * Enqueue the job of an entry now. Called by cron4j on every matching minute.
     */
    Optional<TaskInfo> fire(String entryId) {
        ScheduledJob job = entries.get(entryId);
        if (job == null) {
            return Optional.empty();
        }
        try {
            TaskInfo info = client.enqueue(job.getTaskType(), job.getPayload(), job.getOptions());
            logger.debug("Scheduled job entry={} enqueued task {}", entryId, info.getId());
            return Optional.of(info);
        } catch (JobQueueException e) {
            logger.error("Scheduled job entry={} failed to enqueue task of type {}",
                        entryId, job.getTaskType(), e);
            return Optional.empty();
        }
    }

    public void start() {
        if (!cronScheduler.isStarted()) {
            cronScheduler.start();
            logger.info("PeriodicTaskScheduler started with {} entries", entries.size());
        }
    }

    public void stop() {
        if (cronScheduler.isStarted()) {
            cronScheduler.stop();
            logger.info("PeriodicTaskScheduler stopped");
        }
    }

    public boolean isRunning() {
        return cronScheduler.isStarted();
    }
}
