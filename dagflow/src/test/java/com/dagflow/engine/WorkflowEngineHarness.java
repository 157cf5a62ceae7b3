package com.dagflow.engine;

/**
 * Owns the engine under test. {@link #reset()} replaces it with a fresh one so tests
 * never share workflows or registered functions.
 */
public class WorkflowEngineHarness implements AutoCloseable {
    private final int maxConcurrentTasks;
    private WorkflowEngine engine;

    public WorkflowEngineHarness(int maxConcurrentTasks) {
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.engine = new WorkflowEngine(maxConcurrentTasks);
    }

    public WorkflowEngine engine() {
        return engine;
    }

    public WorkflowEngine reset() {
        engine.shutdown();
        engine = new WorkflowEngine(maxConcurrentTasks);
        return engine;
    }

    @Override
    public void close() {
        engine.shutdown();
    }
}
