package com.dagflow.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dagflow.engine.WorkflowEngineHarness;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SnapshotJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private WorkflowEngineHarness harness;

    @BeforeEach
    public void setUp() {
        harness = new WorkflowEngineHarness(2);
        Workflow workflow = harness.engine().createWorkflow("report", "Report");
        workflow.addTask(Task.builder().taskId("fetch").function(context -> "payload").build());
        workflow.addTask(Task.builder().taskId("render").dependsOn("fetch").function(context -> {
            throw new IllegalStateException("template missing");
        }).build());
    }

    @AfterEach
    public void tearDown() {
        harness.close();
    }

    @Test
    public void testSummaryUsesSnakeCase() throws Exception {
        WorkflowSummary summary = harness.engine().executeWorkflow("report");

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(summary));

        assertEquals("report", json.get("workflow_id").asText());
        assertEquals("FAILED", json.get("status").asText());
        assertEquals(1, json.get("completed_tasks").asInt());
        assertEquals(1, json.get("failed_tasks").asInt());
        assertEquals(2, json.get("total_tasks").asInt());
        assertEquals("template missing", json.get("errors").get("render").asText());
        assertTrue(json.has("execution_time"));
        assertFalse(json.has("success"));
    }

    @Test
    public void testStatusSnapshotUsesSnakeCase() throws Exception {
        harness.engine().executeWorkflow("report");
        WorkflowStatusSnapshot snapshot = harness.engine().getWorkflowStatus("report").orElseThrow();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(snapshot));

        assertEquals("report", json.get("workflow_id").asText());
        assertEquals(2, json.get("total_tasks").asInt());
        assertEquals(1, json.get("status_counts").get("COMPLETED").asInt());
        assertEquals(1, json.get("status_counts").get("FAILED").asInt());
        JsonNode render = json.get("tasks").get("render");
        assertEquals("template missing", render.get("error").asText());
        assertEquals(0, render.get("retry_count").asInt());
        assertEquals("fetch", render.get("dependencies").get(0).asText());
        assertFalse(render.has("result"));
        assertTrue(json.get("tasks").get("fetch").has("start_time"));
    }
}
