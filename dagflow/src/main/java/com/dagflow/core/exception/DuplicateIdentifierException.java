package com.dagflow.core.exception;

public class DuplicateIdentifierException extends WorkflowConfigurationException {
    private final String identifier;

    public DuplicateIdentifierException(String kind, String identifier) {
        super(String.format("%s already exists: %s", kind, identifier));
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
