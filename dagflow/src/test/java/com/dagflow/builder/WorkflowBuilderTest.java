package com.dagflow.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dagflow.core.Task;
import com.dagflow.core.Workflow;
import com.dagflow.core.WorkflowState;
import com.dagflow.core.WorkflowSummary;
import com.dagflow.core.exception.DuplicateIdentifierException;
import com.dagflow.engine.WorkflowEngineHarness;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class WorkflowBuilderTest {

    private WorkflowEngineHarness harness;

    @BeforeEach
    public void setUp() {
        harness = new WorkflowEngineHarness(4);
    }

    @AfterEach
    public void tearDown() {
        harness.close();
    }

    @Test
    public void testChainAddsDependencies() {
        Workflow workflow = WorkflowBuilder.create("chain")
                .name("Chain")
                .description("three steps")
                .metadata("owner", "ops")
                .addTask("extract").function(context -> "rows")
                    .then("transform").functionName("transform").retries(2).timeout(Duration.ofSeconds(5))
                    .then("load").function(context -> "loaded").withInput("table", "orders")
                    .end()
                .build(harness.engine());

        Map<String, Task> tasks = workflow.getTasks();
        assertEquals(List.of("extract", "transform", "load"), List.copyOf(tasks.keySet()));
        assertTrue(tasks.get("extract").getDependencies().isEmpty());
        assertEquals(List.of("extract"), tasks.get("transform").getDependencies());
        assertEquals(List.of("transform"), tasks.get("load").getDependencies());
        assertEquals(2, tasks.get("transform").getMaxRetries());
        assertEquals(Duration.ofSeconds(5), tasks.get("transform").getTimeout());
        assertEquals("orders", tasks.get("load").getKwargs().get("table"));
        assertEquals("Chain", workflow.getName());
        assertEquals("ops", workflow.getMetadata().get("owner"));
        assertTrue(harness.engine().getWorkflow("chain").isPresent());
    }

    @Test
    public void testParallelBranchesJoin() {
        harness.engine().registerFunction("notify", context -> "sent");

        Workflow workflow = WorkflowBuilder.create("fan-out")
                .addTask("validate").function(context -> "valid").end()
                .parallel().dependsOn("validate")
                    .task("charge", context -> "charged")
                    .task("notify", "notify")
                    .join("ship", context -> "shipped")
                .build(harness.engine());

        assertEquals(List.of("validate"), workflow.getTask("charge").orElseThrow().getDependencies());
        assertEquals(List.of("validate"), workflow.getTask("notify").orElseThrow().getDependencies());
        assertEquals(List.of("charge", "notify"), workflow.getTask("ship").orElseThrow().getDependencies());

        WorkflowSummary summary = harness.engine().executeWorkflow("fan-out");

        assertEquals(WorkflowState.COMPLETED, summary.getStatus());
        assertEquals(4, summary.getCompletedTasks());
        assertEquals("sent", workflow.getTask("notify").orElseThrow().getResult());
        assertEquals("shipped", workflow.getTask("ship").orElseThrow().getResult());
    }

    @Test
    public void testParallelWithoutJoin() {
        Workflow workflow = WorkflowBuilder.create("independent")
                .parallel()
                    .task("a", context -> 1)
                    .task("b", context -> 2)
                    .end()
                .addTask(Task.builder().taskId("c").function(context -> 3).dependsOn("a").build())
                .build(harness.engine());

        assertEquals(3, workflow.getTaskCount());
        assertTrue(workflow.getTask("a").orElseThrow().getDependencies().isEmpty());
        assertEquals(WorkflowState.COMPLETED, harness.engine().executeWorkflow("independent").getStatus());
    }

    @Test
    public void testDuplicateTaskIdsRegisterNothing() {
        WorkflowBuilder broken = WorkflowBuilder.create("dup")
                .addTask("a").function(context -> 1).end()
                .addTask("a").function(context -> 2).end();

        assertThrows(DuplicateIdentifierException.class, () -> broken.build(harness.engine()));
        assertFalse(harness.engine().getWorkflow("dup").isPresent());

        Workflow fixed = WorkflowBuilder.create("dup")
                .addTask("a").function(context -> 1).end()
                .build(harness.engine());
        assertEquals(1, fixed.getTaskCount());
    }

    @Test
    public void testMetadataMayHoldNull() {
        Workflow workflow = WorkflowBuilder.create("annotated")
                .metadata("ticket", null)
                .addTask("a").function(context -> 1).end()
                .build(harness.engine());

        assertTrue(workflow.getMetadata().containsKey("ticket"));
        assertEquals(WorkflowState.COMPLETED, harness.engine().executeWorkflow("annotated").getStatus());
    }
}
