package com.dagflow.core.exception;

public class WorkflowNotFoundException extends WorkflowConfigurationException {
    private final String workflowId;

    public WorkflowNotFoundException(String workflowId) {
        super("Workflow not found: " + workflowId);
        this.workflowId = workflowId;
    }

    public String getWorkflowId() {
        return workflowId;
    }
}
