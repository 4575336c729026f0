package com.carelogs.pipeline.service.aggregate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BoundedTaskGroup: ordering, failures, timeout and MDC propagation.
 */
class BoundedTaskGroupTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should return outcomes in submission order whatever the completion order")
    void runAll_shouldKeepSubmissionOrder() {
        List<Callable<UnitOutcome<String>>> units = List.of(
                () -> {
                    Thread.sleep(200);
                    return UnitOutcome.succeeded("first");
                },
                () -> UnitOutcome.succeeded("second"),
                () -> UnitOutcome.skipped("nothing to do"));

        List<UnitOutcome<String>> outcomes;
        try (BoundedTaskGroup group = new BoundedTaskGroup(new WorkerPoolSettings(3, Duration.ZERO), 3, "test-")) {
            outcomes = group.runAll(units);
        }

        assertEquals("first", outcomes.get(0).getValue());
        assertEquals("second", outcomes.get(1).getValue());
        assertEquals(UnitOutcome.Status.SKIPPED, outcomes.get(2).getStatus());
    }

    @Test
    @DisplayName("Should turn a throwing unit into FAILED without affecting the others")
    void runAll_throwingUnit_shouldFail() {
        List<Callable<UnitOutcome<String>>> units = List.of(
                () -> {
                    throw new IllegalStateException("model client closed");
                },
                () -> UnitOutcome.succeeded("ok"));

        List<UnitOutcome<String>> outcomes;
        try (BoundedTaskGroup group = new BoundedTaskGroup(new WorkerPoolSettings(2, Duration.ZERO), 2, "test-")) {
            outcomes = group.runAll(units);
        }

        assertEquals(UnitOutcome.Status.FAILED, outcomes.get(0).getStatus());
        assertTrue(outcomes.get(0).getReason().contains("IllegalStateException"));
        assertTrue(outcomes.get(1).isSucceeded());
    }

    @Test
    @DisplayName("Should cancel units still running at the batch timeout and keep finished ones")
    void runAll_timeout_shouldFailUnfinishedUnits() {
        List<Callable<UnitOutcome<String>>> units = List.of(
                () -> UnitOutcome.succeeded("fast"),
                () -> {
                    Thread.sleep(10_000);
                    return UnitOutcome.succeeded("too late");
                });

        List<UnitOutcome<String>> outcomes;
        try (BoundedTaskGroup group = new BoundedTaskGroup(
                new WorkerPoolSettings(2, Duration.ofMillis(300)), 2, "test-")) {
            outcomes = group.runAll(units);
        }

        assertTrue(outcomes.get(0).isSucceeded());
        assertEquals(UnitOutcome.Status.FAILED, outcomes.get(1).getStatus());
        assertEquals("Timed out", outcomes.get(1).getReason());
    }

    @Test
    @DisplayName("Should copy the caller's MDC onto worker threads")
    void runAll_shouldPropagateMdc() {
        MDC.put("batchId", "batch-0042");
        List<Callable<UnitOutcome<String>>> units = List.of(
                () -> UnitOutcome.succeeded(MDC.get("batchId")),
                () -> UnitOutcome.succeeded(Thread.currentThread().getName()));

        List<UnitOutcome<String>> outcomes;
        try (BoundedTaskGroup group = new BoundedTaskGroup(new WorkerPoolSettings(2, Duration.ZERO), 2, "classify-")) {
            outcomes = group.runAll(units);
        }

        assertEquals("batch-0042", outcomes.get(0).getValue());
        assertTrue(outcomes.get(1).getValue().startsWith("classify-"));
    }

    @Test
    @DisplayName("Should size the pool by units when fewer than the configured workers")
    void resolvedWorkers_shouldBeBoundedByUnits() {
        WorkerPoolSettings settings = new WorkerPoolSettings(8, Duration.ZERO);

        assertEquals(3, settings.resolvedWorkers(3));
        assertEquals(8, settings.resolvedWorkers(100));
        assertEquals(1, settings.resolvedWorkers(0));
        assertTrue(new WorkerPoolSettings(0, Duration.ZERO).resolvedWorkers(1000) >= 1);
        assertFalse(settings.hasTimeout());
    }
}
