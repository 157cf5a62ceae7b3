package com.dagflow.core;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * TaskContext is what a task function receives for one attempt.
 *
 * <p>It carries the task's positional and named inputs and exposes cancellation.
 * {@link #isCancelled()} turns true when the workflow is cancelled
 * or when this attempt's deadline expires. Cancellation is cooperative: the engine never
 * kills a function that ignores the flag, although a blocking function's worker thread
 * is interrupted on deadline expiry.</p>
 *
 * <pre>{@code
 * engine.registerFunction("poll", context -> {
 *     while (!context.isCancelled()) {
 *         if (checkDone()) {
 *             return "done";
 *         }
 *         Thread.sleep(100);
 *     }
 *     return null;
 * });
 * }</pre>
 */
public class TaskContext {
    private final String workflowId;
    private final String taskId;
    private final int attempt;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final CancellationToken workflowToken;
    private volatile boolean cancelled = false;

    public TaskContext(String workflowId, String taskId, int attempt,
                       List<Object> args, Map<String, Object> kwargs,
                       CancellationToken workflowToken) {
        this.workflowId = workflowId;
        this.taskId = taskId;
        this.attempt = attempt;
        this.args = args != null ? Collections.unmodifiableList(args) : List.of();
        this.kwargs = kwargs != null ? Collections.unmodifiableMap(kwargs) : Map.of();
        this.workflowToken = workflowToken != null ? workflowToken : new CancellationToken();
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * Zero for the first attempt, incremented on every retry.
     */
    public int getAttempt() {
        return attempt;
    }

    public List<Object> getArgs() {
        return args;
    }

    public Object getArg(int index) {
        return args.get(index);
    }

    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    public Object getKwarg(String name) {
        return kwargs.get(name);
    }

    @SuppressWarnings("unchecked")
    public <T> T getKwarg(String name, T defaultValue) {
        Object value = kwargs.get(name);
        return value != null ? (T) value : defaultValue;
    }

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || workflowToken.isCancelled();
    }
}
