package com.dagflow.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable view of a workflow and its tasks, as returned by
 * {@code WorkflowEngine#getWorkflowStatus}. Two snapshots taken without an execution in
 * between are equal.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowStatusSnapshot {
    String workflowId;
    String name;
    String description;
    WorkflowState status;
    Instant createdTime;
    Instant startTime;
    Instant endTime;
    int totalTasks;
    @Singular("statusCount")
    Map<TaskStatus, Integer> statusCounts;
    @Singular
    Map<String, TaskSnapshot> tasks;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
