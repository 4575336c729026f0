package com.carelogs.pipeline.service.aggregate;

import java.time.Duration;

/**
 * Sizing of the per-batch worker pool.
 *
 * @param maxWorkers   worker threads per batch; 0 or less means one per available processor
 * @param batchTimeout upper bound for draining all units of one batch; zero means no bound
 */
public record WorkerPoolSettings(int maxWorkers, Duration batchTimeout) {

    public int resolvedWorkers(int unitCount) {
        int workers = maxWorkers > 0 ? maxWorkers : Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(workers, unitCount));
    }

    public boolean hasTimeout() {
        return batchTimeout != null && !batchTimeout.isZero() && !batchTimeout.isNegative();
    }
}
