package com.dagflow.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of a task's state.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskSnapshot {
    String taskId;
    String name;
    TaskStatus status;
    List<String> dependencies;
    Object result;
    String error;
    Instant startTime;
    Instant endTime;
    int retryCount;
    int maxRetries;
    Duration timeout;
}
