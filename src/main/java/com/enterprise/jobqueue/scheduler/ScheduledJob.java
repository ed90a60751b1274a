package com.enterprise.jobqueue.scheduler;

import com.enterprise.jobqueue.client.EnqueueOptions;

/**
 * A task to enqueue on a cron schedule.
 * <p>
 * The cron spec has five fields: minute, hour, day of month, month, day of week.
 */
public final class ScheduledJob {

    private final String cronspec;
    private final String taskType;
    private final Object payload;
    private final EnqueueOptions options;
    private final String description;

    private ScheduledJob(Builder builder) {
        this.cronspec = builder.cronspec;
        this.taskType = builder.taskType;
        this.payload = builder.payload;
        this.options = builder.options;
        this.description = builder.description;
    }

    public String getCronspec() { return cronspec; }
    public String getTaskType() { return taskType; }
    public Object getPayload() { return payload; }
    public EnqueueOptions getOptions() { return options; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        return "ScheduledJob{" +
                "cronspec='" + cronspec + '\'' +
                ", taskType='" + taskType + '\'' +
                ", description='" + description + '\'' +
                '}';
    }

    public static class Builder {
        private String cronspec;
        private String taskType;
        private Object payload = new byte[0];
        private EnqueueOptions options = EnqueueOptions.defaults();
        private String description = "";

        public Builder cronspec(String cronspec) {
            this.cronspec = cronspec;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder options(EnqueueOptions options) {
            this.options = options;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public ScheduledJob build() {
            if (taskType == null || taskType.trim().isEmpty()) {
                throw new IllegalArgumentException("Task type cannot be empty");
            }
            if (cronspec == null || cronspec.trim().isEmpty()) {
                throw new IllegalArgumentException("Cron spec cannot be empty");
            }
            if (options == null) {
                options = EnqueueOptions.defaults();
            }
            return new ScheduledJob(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
