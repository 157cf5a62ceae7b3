package com.dagflow.core;

import com.dagflow.core.exception.CyclicDependencyException;
import com.dagflow.core.exception.DuplicateIdentifierException;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Workflow owns a set of {@link Task}s keyed by task id and answers graph questions
 * about them: is the dependency graph acyclic, and which tasks are ready to run.
 *
 * <p>Workflows are created through the engine and executed by it. Tasks may be added
 * between executions; adding tasks while an execution is in progress is not
 * supported.</p>
 *
 * @see Task
 */
@Getter
public class Workflow {
    private final String workflowId;
    private final String name;
    private final String description;
    private final Map<String, Object> metadata;
    private final Instant createdTime;
    private final Map<String, Task> tasks = Collections.synchronizedMap(new LinkedHashMap<>());

    private volatile WorkflowState status = WorkflowState.PENDING;
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile CancellationToken cancellationToken = new CancellationToken();

    public Workflow(String workflowId, String name, String description, Map<String, Object> metadata) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("Workflow id cannot be empty");
        }
        this.workflowId = workflowId;
        this.name = name != null ? name : workflowId;
        this.description = description != null ? description : "";
        Map<String, Object> copy = new LinkedHashMap<>();
        if (metadata != null) {
            copy.putAll(metadata);
        }
        this.metadata = Collections.synchronizedMap(copy);
        this.createdTime = Instant.now();
    }

    public void addTask(Task task) {
        synchronized (tasks) {
            if (tasks.containsKey(task.getTaskId())) {
                throw new DuplicateIdentifierException("Task", task.getTaskId());
            }
            tasks.put(task.getTaskId(), task);
        }
    }

    public Map<String, Task> getTasks() {
        synchronized (tasks) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
        }
    }

    public Optional<Task> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public int getTaskCount() {
        return tasks.size();
    }

    public List<Task> getTasksByStatus(TaskStatus status) {
        return getTasks().values().stream()
                .filter(task -> task.getStatus() == status)
                .collect(Collectors.toList());
    }

    /**
     * Checks the dependency graph for cycles using a depth-first search with three-color
     * marking. Dependencies that name no task in this workflow are ignored here; see
     * {@link #getMissingDependencies()}.
     *
     * @throws CyclicDependencyException naming a task on the first cycle found
     */
    public void validateDag() {
        Map<String, Task> snapshot = getTasks();
        Map<String, Mark> marks = new HashMap<>();
        List<String> path = new ArrayList<>();
        for (String taskId : snapshot.keySet()) {
            if (!marks.containsKey(taskId)) {
                visit(taskId, snapshot, marks, path);
            }
        }
    }

    private void visit(String taskId, Map<String, Task> graph, Map<String, Mark> marks, List<String> path) {
        marks.put(taskId, Mark.ON_STACK);
        path.add(taskId);

        for (String dependency : graph.get(taskId).getDependencies()) {
            if (!graph.containsKey(dependency)) {
                continue;
            }
            Mark mark = marks.get(dependency);
            if (mark == Mark.ON_STACK) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                throw new CyclicDependencyException(taskId, cycle);
            }
            if (mark == null) {
                visit(dependency, graph, marks, path);
            }
        }

        path.remove(path.size() - 1);
        marks.put(taskId, Mark.DONE);
    }

    private enum Mark {
        ON_STACK,
        DONE
    }

    /**
     * Dependency ids that do not name a task in this workflow, per referencing task.
     * Such tasks can never become ready.
     */
    public Map<String, Set<String>> getMissingDependencies() {
        Map<String, Task> snapshot = getTasks();
        Map<String, Set<String>> missing = new LinkedHashMap<>();
        for (Task task : snapshot.values()) {
            Set<String> unknown = task.getDependencies().stream()
                    .filter(dependency -> !snapshot.containsKey(dependency))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            if (!unknown.isEmpty()) {
                missing.put(task.getTaskId(), unknown);
            }
        }
        return missing;
    }

    public List<Task> getReadyTasks(Set<String> completedIds) {
        return getTasks().values().stream()
                .filter(task -> task.isReady(completedIds))
                .collect(Collectors.toList());
    }

    public boolean isRunning() {
        return status == WorkflowState.RUNNING;
    }

    /**
     * Moves to RUNNING for a new execution and installs a fresh cancellation token.
     */
    public synchronized void markRunning(Instant now) {
        status = WorkflowState.RUNNING;
        startTime = now;
        endTime = null;
        cancellationToken = new CancellationToken();
    }

    /**
     * Records the terminal state unless the workflow was cancelled meanwhile.
     */
    public synchronized void finish(WorkflowState finalState, Instant now) {
        if (status != WorkflowState.CANCELLED) {
            status = finalState;
        }
        if (endTime == null) {
            endTime = now;
        }
    }

    /**
     * Validation failure before the workflow started running.
     */
    public synchronized void markFailed(Instant now) {
        status = WorkflowState.FAILED;
        endTime = now;
    }

    /**
     * Marks the workflow and every running task CANCELLED and flips the cancellation
     * token. Functions already executing are not interrupted.
     *
     * @return false if the workflow was not running
     */
    public synchronized boolean cancel(Instant now) {
        if (status != WorkflowState.RUNNING) {
            return false;
        }
        status = WorkflowState.CANCELLED;
        endTime = now;
        cancellationToken.cancel();
        for (Task task : getTasks().values()) {
            task.cancelIfRunning();
        }
        return true;
    }

    public boolean isCancelled() {
        return status == WorkflowState.CANCELLED;
    }

    public synchronized WorkflowStatusSnapshot snapshot() {
        Collection<Task> all = getTasks().values();
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        WorkflowStatusSnapshot.WorkflowStatusSnapshotBuilder builder = WorkflowStatusSnapshot.builder()
                .workflowId(workflowId)
                .name(name)
                .description(description)
                .status(status)
                .createdTime(createdTime)
                .startTime(startTime)
                .endTime(endTime)
                .totalTasks(all.size());
        synchronized (metadata) {
            builder.metadata(metadata);
        }
        for (Task task : all) {
            TaskSnapshot taskSnapshot = task.snapshot();
            counts.merge(taskSnapshot.getStatus(), 1, Integer::sum);
            builder.task(task.getTaskId(), taskSnapshot);
        }
        return builder.statusCounts(counts).build();
    }

    @Override
    public String toString() {
        return "Workflow[" + workflowId + ", " + status + ", tasks=" + tasks.size() + "]";
    }
}
