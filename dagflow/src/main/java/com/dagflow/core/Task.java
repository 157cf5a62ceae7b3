package com.dagflow.core;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Task is one schedulable unit of work inside a {@link Workflow}.
 *
 * <p>Identity, inputs, dependencies and retry policy are fixed at construction. The
 * runtime fields ({@code status}, {@code result}, {@code error}, timestamps and
 * {@code retryCount}) are written only by the engine through the transition methods
 * below, which synchronize on the task so that a workflow cancellation and the end of an
 * attempt never interleave.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Task fetch = Task.builder()
 *     .taskId("fetch")
 *     .functionName("http.fetch")
 *     .kwarg("url", "https://example.org")
 *     .maxRetries(2)
 *     .timeout(Duration.ofSeconds(30))
 *     .build();
 *
 * Task parse = Task.builder()
 *     .taskId("parse")
 *     .function(context -> parse(context.getKwarg("format")))
 *     .dependsOn("fetch")
 *     .build();
 * }</pre>
 *
 * @see Workflow
 * @see TaskStatus
 */
@Getter
public class Task {
    private final String taskId;
    private final String name;
    private final WorkReference work;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final List<String> dependencies;
    private final Map<String, Object> metadata;
    private final int maxRetries;
    private final Duration timeout;

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile Object result;
    private volatile String error;
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile int retryCount = 0;

    private Task(Builder builder) {
        this.taskId = builder.taskId;
        this.name = builder.name != null ? builder.name : builder.taskId;
        this.work = builder.work;
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs));
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(builder.dependencies));
        this.metadata = Collections.synchronizedMap(new LinkedHashMap<>(builder.metadata));
        this.maxRetries = builder.maxRetries;
        this.timeout = builder.timeout;
    }

    /**
     * Per-attempt deadline, or null when the engine's default task timeout applies.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public boolean hasExplicitTimeout() {
        return timeout != null;
    }

    /**
     * True iff the task is PENDING and every dependency has completed. Dependencies that
     * never complete (failed, or not part of the workflow) keep the task pending forever.
     */
    public boolean isReady(Set<String> completedIds) {
        return status == TaskStatus.PENDING && completedIds.containsAll(dependencies);
    }

    public boolean canRetry() {
        return status == TaskStatus.FAILED && retryCount < maxRetries;
    }

    public boolean isPermanentlyFailed() {
        return status == TaskStatus.FAILED && retryCount >= maxRetries;
    }

    public synchronized void markReady() {
        if (status != TaskStatus.PENDING) {
            throw new IllegalStateException("Task " + taskId + " is not pending: " + status);
        }
        status = TaskStatus.READY;
    }

    public synchronized void markRunning(Instant now) {
        if (status != TaskStatus.READY) {
            throw new IllegalStateException("Task " + taskId + " is not ready: " + status);
        }
        status = TaskStatus.RUNNING;
        startTime = now;
        endTime = null;
        result = null;
        error = null;
    }

    /**
     * Records a successful attempt. A task cancelled while running keeps CANCELLED.
     */
    public synchronized void complete(Object value, Instant now) {
        endTime = now;
        if (status == TaskStatus.RUNNING) {
            status = TaskStatus.COMPLETED;
            result = value;
        }
    }

    public synchronized void fail(String message, Instant now) {
        endTime = now;
        if (status == TaskStatus.RUNNING) {
            status = TaskStatus.FAILED;
            error = message;
        }
    }

    public synchronized boolean cancelIfRunning() {
        if (status != TaskStatus.RUNNING) {
            return false;
        }
        status = TaskStatus.CANCELLED;
        return true;
    }

    // Dispatch was abandoned before the attempt started.
    public synchronized void revertToPending() {
        if (status == TaskStatus.READY) {
            status = TaskStatus.PENDING;
        }
    }

    public synchronized void resetForRetry() {
        if (!canRetry()) {
            throw new IllegalStateException("Task " + taskId + " cannot be retried");
        }
        retryCount++;
        status = TaskStatus.PENDING;
        error = null;
    }

    public synchronized void resetForRerun() {
        status = TaskStatus.PENDING;
        retryCount = 0;
        result = null;
        error = null;
        startTime = null;
        endTime = null;
    }

    public synchronized TaskSnapshot snapshot() {
        return TaskSnapshot.builder()
                .taskId(taskId)
                .name(name)
                .status(status)
                .dependencies(dependencies)
                .result(result)
                .error(error)
                .startTime(startTime)
                .endTime(endTime)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .timeout(timeout)
                .build();
    }

    @Override
    public String toString() {
        return "Task[" + taskId + ", " + status + ", work=" + work + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String taskId;
        private String name;
        private WorkReference work;
        private final List<Object> args = new ArrayList<>();
        private final Map<String, Object> kwargs = new LinkedHashMap<>();
        private final List<String> dependencies = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private int maxRetries = 0;
        private Duration timeout;

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder work(WorkReference work) {
            this.work = work;
            return this;
        }

        public Builder function(TaskFunction function) {
            return work(WorkReference.of(function));
        }

        public Builder asyncFunction(AsyncTaskFunction function) {
            return work(WorkReference.ofAsync(function));
        }

        public Builder functionName(String functionName) {
            return work(WorkReference.named(functionName));
        }

        public Builder args(Object... args) {
            this.args.addAll(Arrays.asList(args));
            return this;
        }

        public Builder args(Collection<?> args) {
            this.args.addAll(args);
            return this;
        }

        public Builder kwarg(String key, Object value) {
            this.kwargs.put(key, value);
            return this;
        }

        public Builder kwargs(Map<String, ?> kwargs) {
            this.kwargs.putAll(kwargs);
            return this;
        }

        public Builder dependsOn(String... taskIds) {
            this.dependencies.addAll(Arrays.asList(taskIds));
            return this;
        }

        public Builder dependencies(Collection<String> taskIds) {
            this.dependencies.addAll(taskIds);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Task build() {
            if (taskId == null || taskId.isBlank()) {
                throw new IllegalStateException("Task id is required");
            }
            if (work == null) {
                throw new IllegalStateException("Task " + taskId + " requires a function or function name");
            }
            if (maxRetries < 0) {
                throw new IllegalStateException("maxRetries cannot be negative: " + maxRetries);
            }
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new IllegalStateException("Task timeout must be positive: " + timeout);
            }
            if (dependencies.contains(null)) {
                throw new IllegalStateException("Task " + taskId + " has a null dependency");
            }
            return new Task(this);
        }
    }
}
