package com.dagflow.builder;

import com.dagflow.core.AsyncTaskFunction;
import com.dagflow.core.Task;
import com.dagflow.core.TaskFunction;
import com.dagflow.core.Workflow;
import com.dagflow.core.exception.DuplicateIdentifierException;
import com.dagflow.engine.WorkflowEngine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fluent construction of a workflow and its tasks.
 *
 * <pre>{@code
 * Workflow workflow = WorkflowBuilder.create("orders")
 *     .name("Order processing")
 *     .addTask("validate").function(validate)
 *         .then("reserve").functionName("inventory.reserve").retries(2)
 *         .end()
 *     .parallel().dependsOn("reserve")
 *         .task("charge", charge)
 *         .task("notify", "mail.send")
 *         .join("ship", ship)
 *     .build(engine);
 * }</pre>
 */
public class WorkflowBuilder {
    private final String workflowId;
    private String name;
    private String description;
    private final Map<String, Object> metadata = new HashMap<>();
    private final List<Task> tasks = new ArrayList<>();

    public WorkflowBuilder(String workflowId) {
        this.workflowId = workflowId;
    }

    public static WorkflowBuilder create(String workflowId) {
        return new WorkflowBuilder(workflowId);
    }

    public WorkflowBuilder name(String name) {
        this.name = name;
        return this;
    }

    public WorkflowBuilder description(String description) {
        this.description = description;
        return this;
    }

    public WorkflowBuilder metadata(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    public WorkflowBuilder addTask(Task task) {
        tasks.add(task);
        return this;
    }

    public TaskChainBuilder addTask(String taskId) {
        return new TaskChainBuilder(this, taskId);
    }

    public ParallelTaskBuilder parallel() {
        return new ParallelTaskBuilder(this);
    }

    /**
     * Creates the workflow in {@code engine} and adds every task collected so far.
     *
     * @throws DuplicateIdentifierException if two collected tasks share an id; nothing
     *         is registered with the engine in that case
     */
    public Workflow build(WorkflowEngine engine) {
        Set<String> taskIds = new HashSet<>();
        for (Task task : tasks) {
            if (!taskIds.add(task.getTaskId())) {
                throw new DuplicateIdentifierException("Task", task.getTaskId());
            }
        }

        Workflow workflow = engine.createWorkflow(workflowId, name, description, metadata);
        for (Task task : tasks) {
            workflow.addTask(task);
        }
        return workflow;
    }

    public class TaskChainBuilder {
        private final WorkflowBuilder workflowBuilder;
        private final Task.Builder taskBuilder;

        TaskChainBuilder(WorkflowBuilder workflowBuilder, String taskId) {
            this.workflowBuilder = workflowBuilder;
            this.taskBuilder = Task.builder().taskId(taskId);
        }

        public TaskChainBuilder name(String name) {
            taskBuilder.name(name);
            return this;
        }

        public TaskChainBuilder function(TaskFunction function) {
            taskBuilder.function(function);
            return this;
        }

        public TaskChainBuilder asyncFunction(AsyncTaskFunction function) {
            taskBuilder.asyncFunction(function);
            return this;
        }

        public TaskChainBuilder functionName(String functionName) {
            taskBuilder.functionName(functionName);
            return this;
        }

        public TaskChainBuilder args(Object... args) {
            taskBuilder.args(args);
            return this;
        }

        public TaskChainBuilder withInput(String key, Object value) {
            taskBuilder.kwarg(key, value);
            return this;
        }

        public TaskChainBuilder timeout(Duration timeout) {
            taskBuilder.timeout(timeout);
            return this;
        }

        public TaskChainBuilder retries(int count) {
            taskBuilder.maxRetries(count);
            return this;
        }

        public TaskChainBuilder dependsOn(String... taskIds) {
            taskBuilder.dependsOn(taskIds);
            return this;
        }

        /**
         * Finishes the current task and starts one that depends on it.
         */
        public TaskChainBuilder then(String nextTaskId) {
            Task current = taskBuilder.build();
            workflowBuilder.addTask(current);

            TaskChainBuilder nextBuilder = new TaskChainBuilder(workflowBuilder, nextTaskId);
            nextBuilder.taskBuilder.dependsOn(current.getTaskId());
            return nextBuilder;
        }

        public WorkflowBuilder end() {
            workflowBuilder.addTask(taskBuilder.build());
            return workflowBuilder;
        }
    }

    public class ParallelTaskBuilder {
        private final WorkflowBuilder workflowBuilder;
        private final List<Task.Builder> parallelTasks = new ArrayList<>();
        private final Set<String> dependencies = new LinkedHashSet<>();

        ParallelTaskBuilder(WorkflowBuilder workflowBuilder) {
            this.workflowBuilder = workflowBuilder;
        }

        public ParallelTaskBuilder dependsOn(String... taskIds) {
            dependencies.addAll(Arrays.asList(taskIds));
            return this;
        }

        public ParallelTaskBuilder task(String taskId, TaskFunction function) {
            parallelTasks.add(Task.builder().taskId(taskId).function(function));
            return this;
        }

        public ParallelTaskBuilder task(String taskId, String functionName) {
            parallelTasks.add(Task.builder().taskId(taskId).functionName(functionName));
            return this;
        }

        /**
         * Adds the branches and a task that runs once all of them have completed.
         */
        public WorkflowBuilder join(String joinTaskId, TaskFunction function) {
            List<String> branchIds = addBranches();
            workflowBuilder.addTask(Task.builder()
                    .taskId(joinTaskId)
                    .function(function)
                    .dependencies(branchIds)
                    .build());
            return workflowBuilder;
        }

        public WorkflowBuilder end() {
            addBranches();
            return workflowBuilder;
        }

        // Shared dependencies are applied here so dependsOn() may follow task().
        private List<String> addBranches() {
            List<String> branchIds = new ArrayList<>();
            for (Task.Builder branch : parallelTasks) {
                Task task = branch.dependencies(dependencies).build();
                workflowBuilder.addTask(task);
                branchIds.add(task.getTaskId());
            }
            return branchIds;
        }
    }
}
