package com.dagflow.core.exception;

import com.dagflow.core.WorkflowState;

public class IllegalWorkflowStateException extends WorkflowConfigurationException {
    private final WorkflowState state;

    public IllegalWorkflowStateException(String workflowId, WorkflowState state, String operation) {
        super(String.format("Cannot %s workflow %s in state %s", operation, workflowId, state));
        this.state = state;
    }

    public WorkflowState getState() {
        return state;
    }
}
