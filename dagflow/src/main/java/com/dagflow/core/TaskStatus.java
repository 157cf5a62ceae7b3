package com.dagflow.core;

/**
 * Lifecycle of a single task.
 *
 * <p>{@code PENDING -> READY -> RUNNING -> COMPLETED | FAILED}, with {@code FAILED -> PENDING}
 * on retry and {@code RUNNING -> CANCELLED} on workflow cancellation. {@link #SKIPPED} is
 * reserved and never assigned by the engine.</p>
 */
public enum TaskStatus {
    PENDING,
    READY,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    SKIPPED
}
