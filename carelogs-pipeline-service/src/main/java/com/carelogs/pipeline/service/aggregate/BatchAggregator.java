package com.carelogs.pipeline.service.aggregate;

import com.carelogs.common.model.Batch;
import com.carelogs.common.model.OutputItem;

/**
 * Fans a batch out into independent units of work and collects their results.
 */
public interface BatchAggregator<T extends OutputItem> {

    AggregationReport<T> aggregate(Batch batch);

    /**
     * Label for a unit in log lines ("records", "clients")
     */
    String unitName();
}
