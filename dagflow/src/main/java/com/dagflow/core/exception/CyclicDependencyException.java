package com.dagflow.core.exception;

import java.util.List;

/**
 * Raised by DAG validation. {@link #getTaskId()} is the task whose dependency closed the
 * cycle; {@link #getCycle()} lists the tasks on it in dependency order, starting and
 * ending with the same id.
 */
public class CyclicDependencyException extends WorkflowConfigurationException {
    private final String taskId;
    private final List<String> cycle;

    public CyclicDependencyException(String taskId, List<String> cycle) {
        super(String.format("Circular dependency detected involving task: %s (%s)",
                taskId, String.join(" -> ", cycle)));
        this.taskId = taskId;
        this.cycle = List.copyOf(cycle);
    }

    public String getTaskId() {
        return taskId;
    }

    public List<String> getCycle() {
        return cycle;
    }
}
