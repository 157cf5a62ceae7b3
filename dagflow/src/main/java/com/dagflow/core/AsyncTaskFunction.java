package com.dagflow.core;

import java.util.concurrent.CompletableFuture;

/**
 * A unit of work that completes asynchronously.
 *
 * <p>The returned future is awaited directly under the task deadline; on expiry the
 * engine cancels it.</p>
 */
@FunctionalInterface
public interface AsyncTaskFunction {

    CompletableFuture<?> apply(TaskContext context);
}
