package com.carelogs.pipeline.service.aggregate;

import com.carelogs.common.model.OutputItem;

import java.util.List;
import java.util.Map;

/**
 * What one aggregation produced: the items to persist plus per-mode counters for the
 * batch summary log.
 */
public interface AggregationReport<T extends OutputItem> {

    List<T> items();

    /**
     * Number of units dispatched (records or clients)
     */
    int unitCount();

    /**
     * Named counters in display order, e.g. red/amber/green/skipped/failed
     */
    Map<String, Integer> counters();
}
