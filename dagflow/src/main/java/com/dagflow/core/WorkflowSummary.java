package com.dagflow.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one {@code executeWorkflow} call.
 *
 * <p>{@code failedTasks} counts permanently failed tasks only. Tasks left pending behind
 * a failed dependency are counted in {@code totalTasks} and nowhere else.</p>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowSummary {
    private final String workflowId;
    private final WorkflowState status;
    private final int completedTasks;
    private final int failedTasks;
    private final int totalTasks;
    private final Instant startTime;
    private final Instant endTime;
    private final Duration executionTime;
    private final Map<String, String> errors;

    private WorkflowSummary(Builder builder) {
        this.workflowId = builder.workflowId;
        this.status = builder.status;
        this.completedTasks = builder.completedTasks;
        this.failedTasks = builder.failedTasks;
        this.totalTasks = builder.totalTasks;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.executionTime = builder.executionTime;
        this.errors = new LinkedHashMap<>(builder.errors);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public WorkflowState getStatus() {
        return status;
    }

    public int getCompletedTasks() {
        return completedTasks;
    }

    public int getFailedTasks() {
        return failedTasks;
    }

    public int getTotalTasks() {
        return totalTasks;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getExecutionTime() {
        return executionTime;
    }

    /**
     * Last error message per task id, for tasks that ended FAILED.
     */
    public Map<String, String> getErrors() {
        return Collections.unmodifiableMap(errors);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == WorkflowState.COMPLETED;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == WorkflowState.FAILED;
    }

    @Override
    public String toString() {
        return String.format("WorkflowSummary[%s, %s, completed=%d, failed=%d, total=%d, time=%s]",
                workflowId, status, completedTasks, failedTasks, totalTasks, executionTime);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String workflowId;
        private WorkflowState status;
        private int completedTasks;
        private int failedTasks;
        private int totalTasks;
        private Instant startTime;
        private Instant endTime;
        private Duration executionTime = Duration.ZERO;
        private final Map<String, String> errors = new LinkedHashMap<>();

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder status(WorkflowState status) {
            this.status = status;
            return this;
        }

        public Builder completedTasks(int completedTasks) {
            this.completedTasks = completedTasks;
            return this;
        }

        public Builder failedTasks(int failedTasks) {
            this.failedTasks = failedTasks;
            return this;
        }

        public Builder totalTasks(int totalTasks) {
            this.totalTasks = totalTasks;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder addError(String taskId, String error) {
            this.errors.put(taskId, error);
            return this;
        }

        public WorkflowSummary build() {
            if (startTime != null && endTime != null) {
                executionTime = Duration.between(startTime, endTime);
            }
            return new WorkflowSummary(this);
        }
    }
}
