package com.dagflow.core;

import java.util.Optional;

/**
 * What a task runs: a direct {@link TaskHandler} or the name of a function registered
 * with the engine and looked up at dispatch time.
 */
public final class WorkReference {
    private final TaskHandler handler;
    private final String functionName;

    private WorkReference(TaskHandler handler, String functionName) {
        this.handler = handler;
        this.functionName = functionName;
    }

    public static WorkReference of(TaskFunction function) {
        return new WorkReference(TaskHandler.blocking(function), null);
    }

    public static WorkReference ofAsync(AsyncTaskFunction function) {
        return new WorkReference(TaskHandler.async(function), null);
    }

    public static WorkReference named(String functionName) {
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("Function name cannot be empty");
        }
        return new WorkReference(null, functionName);
    }

    public boolean isNamed() {
        return functionName != null;
    }

    public Optional<TaskHandler> getHandler() {
        return Optional.ofNullable(handler);
    }

    public Optional<String> getFunctionName() {
        return Optional.ofNullable(functionName);
    }

    @Override
    public String toString() {
        return isNamed() ? "named(" + functionName + ")" : (handler.isAsync() ? "direct(async)" : "direct");
    }
}
