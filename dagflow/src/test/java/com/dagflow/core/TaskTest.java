package com.dagflow.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class TaskTest {

    private static Task task(String id, String... deps) {
        return Task.builder().taskId(id).function(context -> id).dependsOn(deps).build();
    }

    @Test
    public void testReadyOnlyWhenAllDependenciesCompleted() {
        Task task = task("T", "X", "Y");

        assertFalse(task.isReady(Set.of()));
        assertFalse(task.isReady(Set.of("X")));
        assertTrue(task.isReady(Set.of("X", "Y")));
        assertTrue(task.isReady(Set.of("X", "Y", "Z")));
    }

    @Test
    public void testTaskWithoutDependenciesIsReadyImmediately() {
        assertTrue(task("root").isReady(Set.of()));
    }

    @Test
    public void testNotReadyOnceStatusLeavesPending() {
        Task task = task("T", "X");
        task.markReady();

        assertEquals(TaskStatus.READY, task.getStatus());
        assertFalse(task.isReady(Set.of("X")));
    }

    @Test
    public void testRetryBookkeeping() {
        Task task = Task.builder().taskId("T").function(context -> null).maxRetries(1).build();

        task.markReady();
        task.markRunning(Instant.now());
        task.fail("boom", Instant.now());
        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertEquals("boom", task.getError());
        assertTrue(task.canRetry());
        assertFalse(task.isPermanentlyFailed());

        task.resetForRetry();
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(1, task.getRetryCount());
        assertNull(task.getError());

        task.markReady();
        task.markRunning(Instant.now());
        task.fail("boom again", Instant.now());
        assertFalse(task.canRetry());
        assertTrue(task.isPermanentlyFailed());
        assertThrows(IllegalStateException.class, task::resetForRetry);
    }

    @Test
    public void testCompletionAfterCancelKeepsCancelled() {
        Task task = task("T");
        task.markReady();
        task.markRunning(Instant.now());

        assertTrue(task.cancelIfRunning());
        task.complete("late", Instant.now());

        assertEquals(TaskStatus.CANCELLED, task.getStatus());
        assertNull(task.getResult());
        assertTrue(task.getEndTime() != null);
        assertFalse(task.cancelIfRunning());
    }

    @Test
    public void testBuilderDefaults() {
        Task task = task("fetch");

        assertEquals("fetch", task.getName());
        assertEquals(0, task.getMaxRetries());
        assertNull(task.getTimeout());
        assertFalse(task.hasExplicitTimeout());
        assertNull(task.snapshot().getTimeout());
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(List.of(), task.getDependencies());
    }

    @Test
    public void testExplicitTimeoutIsReported() {
        Task task = Task.builder().taskId("T").function(context -> null).timeout(Duration.ofSeconds(7)).build();

        assertTrue(task.hasExplicitTimeout());
        assertEquals(Duration.ofSeconds(7), task.snapshot().getTimeout());
    }

    @Test
    public void testMetadataAcceptsNullValues() {
        Task task = Task.builder().taskId("T").function(context -> null)
                .metadata("note", null)
                .metadata("owner", "ops")
                .build();

        assertTrue(task.getMetadata().containsKey("note"));
        assertNull(task.getMetadata().get("note"));
        assertEquals("ops", task.getMetadata().get("owner"));
    }

    @Test
    public void testBuilderRejectsInvalidConfiguration() {
        assertThrows(IllegalStateException.class, () -> Task.builder().taskId("T").build());
        assertThrows(IllegalStateException.class, () -> Task.builder().function(context -> null).build());
        assertThrows(IllegalStateException.class,
                () -> Task.builder().taskId("T").function(context -> null).maxRetries(-1).build());
        assertThrows(IllegalStateException.class,
                () -> Task.builder().taskId("T").function(context -> null).timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> Task.builder().taskId("T").functionName(" "));
    }

    @Test
    public void testArgsAndKwargsAreCopied() {
        Task task = Task.builder()
                .taskId("T")
                .functionName("sum")
                .args(1, 2)
                .kwarg("scale", 10)
                .build();

        assertEquals(List.of(1, 2), task.getArgs());
        assertEquals(10, task.getKwargs().get("scale"));
        assertTrue(task.getWork().isNamed());
        assertThrows(UnsupportedOperationException.class, () -> task.getArgs().add(3));
    }
}
