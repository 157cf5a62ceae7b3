package com.dagflow.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.dagflow.core.Task;
import com.dagflow.core.Workflow;
import com.dagflow.core.WorkflowState;
import com.dagflow.core.WorkflowSummary;
import com.dagflow.engine.WorkflowEngine;
import com.dagflow.registry.TaskFunctionRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DagflowApplicationTests {

    @Autowired
    private WorkflowEngine workflowEngine;

    @Autowired
    private TaskFunctionRegistry taskFunctionRegistry;

    @Autowired
    private EngineProperties engineProperties;

    @Test
    void contextLoads() {
        assertEquals(3, engineProperties.getMaxConcurrentTasks());
        assertEquals(3, workflowEngine.getMaxConcurrentTasks());
        assertEquals(Duration.ofSeconds(30), workflowEngine.getDefaultTaskTimeout());
        assertSame(taskFunctionRegistry, workflowEngine.getFunctionRegistry());
    }

    @Test
    void runsWorkflowWithRegistryBeanFunctions() {
        taskFunctionRegistry.registerFunction("greet", context -> "hello " + context.getKwarg("who"));
        Workflow workflow = workflowEngine.createWorkflow("spring-wired", "Spring wired");
        workflow.addTask(Task.builder().taskId("greet").functionName("greet").kwarg("who", "dagflow").build());

        WorkflowSummary summary = workflowEngine.executeWorkflow("spring-wired");

        assertEquals(WorkflowState.COMPLETED, summary.getStatus());
        assertEquals("hello dagflow", workflow.getTask("greet").orElseThrow().getResult());
    }
}
