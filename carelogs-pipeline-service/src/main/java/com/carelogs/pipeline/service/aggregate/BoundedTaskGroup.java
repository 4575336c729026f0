package com.carelogs.pipeline.service.aggregate;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size worker pool scoped to a single batch.
 *
 * Created per aggregation, drained by {@link #runAll}, torn down by {@link #close()}.
 * Outcomes come back in submission order whatever the completion order was. A unit that
 * throws, or is still running when the batch timeout expires, becomes a FAILED outcome.
 * The caller's MDC is copied onto every worker.
 */
@Slf4j
public class BoundedTaskGroup implements AutoCloseable {

    private final ExecutorService executor;
    private final WorkerPoolSettings settings;

    public BoundedTaskGroup(WorkerPoolSettings settings, int unitCount, String threadNamePrefix) {
        this.settings = settings;
        this.executor = Executors.newFixedThreadPool(
                settings.resolvedWorkers(unitCount),
                new CustomizableThreadFactory(threadNamePrefix));
    }

    public <T> List<UnitOutcome<T>> runAll(List<Callable<UnitOutcome<T>>> units) {
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        List<Callable<UnitOutcome<T>>> tasks = new ArrayList<>(units.size());
        for (Callable<UnitOutcome<T>> unit : units) {
            tasks.add(withMdc(callerMdc, unit));
        }

        List<Future<UnitOutcome<T>>> futures;
        try {
            futures = settings.hasTimeout()
                    ? executor.invokeAll(tasks, settings.batchTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    : executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for batch units", e);
        }

        List<UnitOutcome<T>> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(collect(i, futures.get(i)));
        }
        return outcomes;
    }

    private <T> UnitOutcome<T> collect(int unitIndex, Future<UnitOutcome<T>> future) {
        try {
            UnitOutcome<T> outcome = future.get();
            return outcome != null ? outcome : UnitOutcome.failed("Unit " + unitIndex + " returned no outcome");
        } catch (CancellationException e) {
            log.error("Unit {} did not finish within {} and was cancelled", unitIndex, settings.batchTimeout());
            return UnitOutcome.failed("Timed out");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Failed to process unit {}. Error: {}", unitIndex, cause.getMessage(), cause);
            return UnitOutcome.failed(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UnitOutcome.failed("Interrupted");
        }
    }

    private static <T> Callable<T> withMdc(Map<String, String> callerMdc, Callable<T> unit) {
        return () -> {
            if (callerMdc != null) {
                MDC.setContextMap(callerMdc);
            }
            try {
                return unit.call();
            } finally {
                MDC.clear();
            }
        };
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
