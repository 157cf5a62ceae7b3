package com.dagflow.core;

/**
 * Shared flag observed by every attempt of one workflow execution.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
