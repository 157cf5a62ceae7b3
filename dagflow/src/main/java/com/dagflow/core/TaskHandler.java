package com.dagflow.core;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Resolved, invocable work for a task: either a blocking {@link TaskFunction} or an
 * {@link AsyncTaskFunction}.
 */
public final class TaskHandler {
    private final TaskFunction blockingFunction;
    private final AsyncTaskFunction asyncFunction;

    private TaskHandler(TaskFunction blockingFunction, AsyncTaskFunction asyncFunction) {
        this.blockingFunction = blockingFunction;
        this.asyncFunction = asyncFunction;
    }

    public static TaskHandler blocking(TaskFunction function) {
        return new TaskHandler(Objects.requireNonNull(function, "function"), null);
    }

    public static TaskHandler async(AsyncTaskFunction function) {
        return new TaskHandler(null, Objects.requireNonNull(function, "function"));
    }

    public boolean isAsync() {
        return asyncFunction != null;
    }

    /**
     * Starts one attempt. Blocking functions are submitted to {@code workers}; async
     * functions are invoked on the calling thread and their future returned as is.
     * Anything an async function throws before returning is reported through the
     * returned future, as it is for blocking functions.
     */
    public Future<?> start(TaskContext context, ExecutorService workers) {
        if (asyncFunction == null) {
            return workers.submit(() -> blockingFunction.apply(context));
        }
        CompletableFuture<?> future;
        try {
            future = asyncFunction.apply(context);
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
        if (future == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Async task function returned no future"));
        }
        return future;
    }
}
