package com.dagflow.engine;

import com.dagflow.core.AsyncTaskFunction;
import com.dagflow.core.Task;
import com.dagflow.core.TaskContext;
import com.dagflow.core.TaskFunction;
import com.dagflow.core.TaskHandler;
import com.dagflow.core.TaskStatus;
import com.dagflow.core.Workflow;
import com.dagflow.core.WorkflowState;
import com.dagflow.core.WorkflowStatusSnapshot;
import com.dagflow.core.WorkflowSummary;
import com.dagflow.core.exception.CyclicDependencyException;
import com.dagflow.core.exception.DuplicateIdentifierException;
import com.dagflow.core.exception.IllegalWorkflowStateException;
import com.dagflow.core.exception.WorkflowNotFoundException;
import com.dagflow.registry.TaskFunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * WorkflowEngine owns workflows and executes them wave by wave.
 *
 * <p>An execution validates the dependency graph, then repeatedly takes every task whose
 * dependencies have completed, dispatches that wave concurrently and waits for all of it
 * before computing the next one. Failed tasks with retries left go back to PENDING and
 * are picked up by a later wave; tasks whose retries are exhausted are permanently
 * failed, and anything depending on them stays PENDING.</p>
 *
 * <p><b>Concurrency:</b> a semaphore of {@code maxConcurrentTasks} permits is shared by
 * all workflows of this engine. Wave members are dispatched on a pool of the same size,
 * so a wave larger than the bound queues there without a thread per task. Each attempt
 * runs under its own deadline. Blocking functions run on a separate worker pool so the
 * deadline can be enforced; their worker is interrupted when it expires.</p>
 *
 * <p><b>Errors:</b> unknown ids, duplicate ids and dependency cycles are thrown to the
 * caller before any task runs. Everything a task function does wrong is recorded on the
 * task and reflected in the returned {@link WorkflowSummary}.</p>
 *
 * <p><b>Cancellation</b> is status-only plus a cooperative token: see
 * {@link #cancelWorkflow(String)}.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * WorkflowEngine engine = new WorkflowEngine(4);
 * engine.registerFunction("load", context -> loadRows(context.getKwarg("table")));
 *
 * Workflow workflow = engine.createWorkflow("nightly", "Nightly load", "", Map.of());
 * workflow.addTask(Task.builder().taskId("extract").functionName("load").kwarg("table", "orders").build());
 * workflow.addTask(Task.builder().taskId("report").function(context -> "ok").dependsOn("extract").build());
 *
 * WorkflowSummary summary = engine.executeWorkflow("nightly");
 * }</pre>
 *
 * @see Workflow
 * @see TaskFunctionRegistry
 */
public class WorkflowEngine {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowEngine.class);

    public static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofSeconds(300);

    private final int maxConcurrentTasks;
    private final Duration defaultTaskTimeout;
    private final TaskFunctionRegistry functionRegistry;
    private final Map<String, Workflow> workflows;
    private final Set<String> runningTaskIds;
    private final Semaphore taskSlots;
    private final ExecutorService dispatchExecutor;
    private final ExecutorService workerExecutor;
    private final ExecutorService coordinatorExecutor;

    public WorkflowEngine(int maxConcurrentTasks) {
        this(maxConcurrentTasks, DEFAULT_TASK_TIMEOUT, new TaskFunctionRegistry(), "dagflow-");
    }

    public WorkflowEngine(int maxConcurrentTasks, Duration defaultTaskTimeout,
                          TaskFunctionRegistry functionRegistry, String threadNamePrefix) {
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1: " + maxConcurrentTasks);
        }
        if (defaultTaskTimeout == null || defaultTaskTimeout.isZero() || defaultTaskTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTaskTimeout must be positive: " + defaultTaskTimeout);
        }
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.defaultTaskTimeout = defaultTaskTimeout;
        this.functionRegistry = functionRegistry != null ? functionRegistry : new TaskFunctionRegistry();
        this.workflows = new ConcurrentHashMap<>();
        this.runningTaskIds = ConcurrentHashMap.newKeySet();
        this.taskSlots = new Semaphore(maxConcurrentTasks, true);
        this.dispatchExecutor = Executors.newFixedThreadPool(maxConcurrentTasks,
                threadFactory(threadNamePrefix + "dispatch-"));
        this.workerExecutor = Executors.newCachedThreadPool(threadFactory(threadNamePrefix + "worker-"));
        this.coordinatorExecutor = Executors.newCachedThreadPool(threadFactory(threadNamePrefix + "workflow-"));

        logger.info("Workflow engine started with {} concurrent task slots, default task timeout {}",
                maxConcurrentTasks, defaultTaskTimeout);
    }

    private static CustomizableThreadFactory threadFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    public Workflow createWorkflow(String workflowId, String name) {
        return createWorkflow(workflowId, name, null, null);
    }

    public Workflow createWorkflow(String workflowId, String name, String description, Map<String, Object> metadata) {
        Workflow workflow = new Workflow(workflowId, name, description, metadata);
        if (workflows.putIfAbsent(workflowId, workflow) != null) {
            throw new DuplicateIdentifierException("Workflow", workflowId);
        }
        logger.info("Created workflow: {} ({})", workflowId, workflow.getName());
        return workflow;
    }

    public Optional<Workflow> getWorkflow(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    public Optional<WorkflowStatusSnapshot> getWorkflowStatus(String workflowId) {
        return getWorkflow(workflowId).map(Workflow::snapshot);
    }

    public Set<String> listWorkflowIds() {
        return Collections.unmodifiableSet(new HashSet<>(workflows.keySet()));
    }

    /**
     * Drops a workflow from the engine.
     *
     * @return false if no such workflow exists
     * @throws IllegalWorkflowStateException if the workflow is running
     */
    public boolean removeWorkflow(String workflowId) {
        Workflow workflow = workflows.get(workflowId);
        if (workflow == null) {
            return false;
        }
        synchronized (workflow) {
            if (workflow.isRunning()) {
                throw new IllegalWorkflowStateException(workflowId, workflow.getStatus(), "remove");
            }
            workflows.remove(workflowId, workflow);
        }
        logger.info("Removed workflow: {}", workflowId);
        return true;
    }

    public void registerFunction(String name, TaskFunction function) {
        functionRegistry.registerFunction(name, function);
    }

    public void registerAsyncFunction(String name, AsyncTaskFunction function) {
        functionRegistry.registerAsyncFunction(name, function);
    }

    /**
     * Executes a workflow to completion on the calling thread.
     *
     * <p>Tasks that completed in an earlier execution are kept; every other task is
     * reset to PENDING with a fresh retry budget.</p>
     *
     * @throws WorkflowNotFoundException if the id is unknown
     * @throws CyclicDependencyException if the dependency graph has a cycle; the workflow
     *         is marked FAILED and no task runs
     * @throws IllegalWorkflowStateException if the workflow is already running
     */
    public WorkflowSummary executeWorkflow(String workflowId) {
        Workflow workflow = requireWorkflow(workflowId);
        Set<String> completedIds = new HashSet<>();
        Set<String> permanentlyFailedIds = new HashSet<>();

        synchronized (workflow) {
            if (workflow.isRunning()) {
                throw new IllegalWorkflowStateException(workflowId, workflow.getStatus(), "execute");
            }
            try {
                workflow.validateDag();
            } catch (CyclicDependencyException e) {
                workflow.markFailed(Instant.now());
                logger.error("Workflow {} rejected: {}", workflowId, e.getMessage());
                throw e;
            }
            for (Task task : workflow.getTasks().values()) {
                if (task.getStatus() == TaskStatus.COMPLETED) {
                    completedIds.add(task.getTaskId());
                } else {
                    task.resetForRerun();
                }
            }
            workflow.markRunning(Instant.now());
        }

        workflow.getMissingDependencies().forEach((taskId, missing) ->
                logger.warn("Task {} in workflow {} depends on unknown tasks {} and will never run",
                        taskId, workflowId, missing));
        logger.info("Starting workflow execution: {} ({} tasks)", workflowId, workflow.getTaskCount());

        try {
            int wave = 0;
            while (!workflow.isCancelled()) {
                List<Task> ready = workflow.getReadyTasks(completedIds);
                if (ready.isEmpty()) {
                    break;
                }
                wave++;
                logger.debug("Workflow {} wave {}: dispatching {} task(s)", workflowId, wave, ready.size());

                ready.forEach(Task::markReady);
                runWave(workflow, ready);

                for (Task task : ready) {
                    if (task.getStatus() == TaskStatus.COMPLETED) {
                        completedIds.add(task.getTaskId());
                    } else if (task.canRetry()) {
                        logger.info("Retrying task {} in workflow {} ({}/{}): {}", task.getTaskId(), workflowId,
                                task.getRetryCount() + 1, task.getMaxRetries(), task.getError());
                        task.resetForRetry();
                    } else if (task.getStatus() == TaskStatus.FAILED) {
                        logger.warn("Task {} in workflow {} failed permanently: {}",
                                task.getTaskId(), workflowId, task.getError());
                        permanentlyFailedIds.add(task.getTaskId());
                    }
                }
            }

            workflow.finish(aggregate(workflow, permanentlyFailedIds), Instant.now());
        } catch (Exception e) {
            logger.error("Workflow execution failed: {}", workflowId, e);
            workflow.getTasksByStatus(TaskStatus.READY).forEach(Task::revertToPending);
            workflow.finish(WorkflowState.FAILED, Instant.now());
        }

        WorkflowSummary summary = summarize(workflow, permanentlyFailedIds);
        logger.info("Finished workflow execution: {}", summary);
        return summary;
    }

    /**
     * Runs {@link #executeWorkflow(String)} on an engine thread. Configuration errors
     * complete the returned future exceptionally.
     */
    public CompletableFuture<WorkflowSummary> submitWorkflow(String workflowId) {
        return CompletableFuture.supplyAsync(() -> executeWorkflow(workflowId), coordinatorExecutor);
    }

    /**
     * Marks a running workflow and its running tasks CANCELLED.
     *
     * <p>No further waves are dispatched, and {@link TaskContext#isCancelled()} turns true
     * for attempts in flight. Functions that do not check it run to completion; their
     * outcome is recorded in {@code endTime} but the task stays CANCELLED.</p>
     *
     * @return false if the workflow is not running
     * @throws WorkflowNotFoundException if the id is unknown
     */
    public boolean cancelWorkflow(String workflowId) {
        Workflow workflow = requireWorkflow(workflowId);
        boolean cancelled = workflow.cancel(Instant.now());
        if (cancelled) {
            logger.info("Cancelled workflow: {}", workflowId);
        } else {
            logger.debug("Workflow {} not running, nothing to cancel", workflowId);
        }
        return cancelled;
    }

    /**
     * Currently executing attempts, as {@code workflowId/taskId}.
     */
    public Set<String> getRunningTaskIds() {
        return Collections.unmodifiableSet(new HashSet<>(runningTaskIds));
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public Duration getDefaultTaskTimeout() {
        return defaultTaskTimeout;
    }

    public TaskFunctionRegistry getFunctionRegistry() {
        return functionRegistry;
    }

    public void shutdown() {
        logger.info("Stopping workflow engine");
        coordinatorExecutor.shutdown();
        dispatchExecutor.shutdown();
        workerExecutor.shutdown();

        try {
            if (!coordinatorExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                coordinatorExecutor.shutdownNow();
            }
            if (!dispatchExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                dispatchExecutor.shutdownNow();
            }
            if (!workerExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            coordinatorExecutor.shutdownNow();
            dispatchExecutor.shutdownNow();
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Workflow engine stopped");
    }

    private Workflow requireWorkflow(String workflowId) {
        Workflow workflow = workflows.get(workflowId);
        if (workflow == null) {
            throw new WorkflowNotFoundException(workflowId);
        }
        return workflow;
    }

    private void runWave(Workflow workflow, List<Task> wave) {
        List<CompletableFuture<Void>> attempts = new ArrayList<>(wave.size());
        for (Task task : wave) {
            attempts.add(CompletableFuture.runAsync(() -> executeTask(workflow, task), dispatchExecutor));
        }
        CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).join();
    }

    /**
     * One attempt of one task. Never throws: every outcome ends up on the task.
     */
    void executeTask(Workflow workflow, Task task) {
        try {
            taskSlots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.revertToPending();
            return;
        }

        String runningKey = workflow.getWorkflowId() + "/" + task.getTaskId();
        try {
            if (workflow.getCancellationToken().isCancelled()) {
                task.revertToPending();
                return;
            }
            task.markRunning(Instant.now());
            runningTaskIds.add(runningKey);
            if (workflow.getCancellationToken().isCancelled()) {
                // cancelled between the check above and markRunning
                task.cancelIfRunning();
                return;
            }
            logger.debug("Executing task {} in workflow {} (attempt {})",
                    task.getTaskId(), workflow.getWorkflowId(), task.getRetryCount() + 1);
            runAttempt(workflow, task);
        } finally {
            runningTaskIds.remove(runningKey);
            taskSlots.release();
        }
    }

    private void runAttempt(Workflow workflow, Task task) {
        Optional<TaskHandler> handler = resolve(task);
        if (handler.isEmpty()) {
            String functionName = task.getWork().getFunctionName().orElse("<none>");
            task.fail("Function not registered: " + functionName, Instant.now());
            logger.warn("No function registered for task {}: {}", task.getTaskId(), functionName);
            return;
        }

        TaskContext context = new TaskContext(workflow.getWorkflowId(), task.getTaskId(), task.getRetryCount(),
                task.getArgs(), task.getKwargs(), workflow.getCancellationToken());
        Duration timeout = task.hasExplicitTimeout() ? task.getTimeout() : defaultTaskTimeout;
        Future<?> future = null;

        try {
            future = handler.get().start(context, workerExecutor);
            Object value = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            task.complete(value, Instant.now());
            logger.debug("Task {} completed in workflow {}", task.getTaskId(), workflow.getWorkflowId());
        } catch (TimeoutException e) {
            context.cancel();
            future.cancel(true);
            task.fail("Task timed out after " + formatSeconds(timeout) + "s", Instant.now());
            logger.warn("Task {} in workflow {} timed out after {}", task.getTaskId(), workflow.getWorkflowId(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause() != null ? e.getCause() : e);
            task.fail(describe(cause), Instant.now());
            logger.warn("Task {} in workflow {} failed: {}", task.getTaskId(), workflow.getWorkflowId(), describe(cause));
            logger.debug("Task failure detail", cause);
        } catch (CancellationException e) {
            task.fail("Task was cancelled", Instant.now());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            if (future != null) {
                future.cancel(true);
            }
            task.fail("Task interrupted", Instant.now());
        } catch (Exception e) {
            task.fail(describe(e), Instant.now());
            logger.warn("Task {} in workflow {} failed to start: {}", task.getTaskId(), workflow.getWorkflowId(), describe(e));
        }
    }

    private Optional<TaskHandler> resolve(Task task) {
        if (task.getWork().isNamed()) {
            return functionRegistry.lookup(task.getWork().getFunctionName().get());
        }
        return task.getWork().getHandler();
    }

    private static WorkflowState aggregate(Workflow workflow, Set<String> permanentlyFailedIds) {
        boolean allCompleted = workflow.getTasks().values().stream()
                .allMatch(task -> task.getStatus() == TaskStatus.COMPLETED);
        if (allCompleted) {
            return WorkflowState.COMPLETED;
        }
        if (!permanentlyFailedIds.isEmpty()) {
            return WorkflowState.FAILED;
        }
        // Remaining tasks are stuck behind dependencies that do not exist.
        return WorkflowState.COMPLETED;
    }

    private static WorkflowSummary summarize(Workflow workflow, Set<String> permanentlyFailedIds) {
        Map<String, Task> tasks = workflow.getTasks();
        WorkflowSummary.Builder builder = WorkflowSummary.builder()
                .workflowId(workflow.getWorkflowId())
                .status(workflow.getStatus())
                .completedTasks((int) tasks.values().stream()
                        .filter(task -> task.getStatus() == TaskStatus.COMPLETED)
                        .count())
                .failedTasks(permanentlyFailedIds.size())
                .totalTasks(tasks.size())
                .startTime(workflow.getStartTime())
                .endTime(workflow.getEndTime());
        for (Task task : tasks.values()) {
            if (task.getStatus() == TaskStatus.FAILED && task.getError() != null) {
                builder.addError(task.getTaskId(), task.getError());
            }
        }
        return builder.build();
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable throwable) {
        return throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
    }

    private static String formatSeconds(Duration duration) {
        return BigDecimal.valueOf(duration.toMillis()).movePointLeft(3).stripTrailingZeros().toPlainString();
    }
}
