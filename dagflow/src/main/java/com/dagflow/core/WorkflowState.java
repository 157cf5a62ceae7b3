package com.dagflow.core;

// PAUSED is reserved; nothing transitions into it yet.
public enum WorkflowState {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED
}
