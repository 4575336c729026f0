package com.carelogs.pipeline.service.aggregate;

import com.carelogs.common.model.ClientSummaryItem;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One summary item per client that had at least one usable note.
 */
public record SummarizationReport(
        List<ClientSummaryItem> items,
        int skipped,
        int failed,
        int unitCount) implements AggregationReport<ClientSummaryItem> {

    public SummarizationReport {
        items = List.copyOf(items);
    }

    @Override
    public Map<String, Integer> counters() {
        Map<String, Integer> counters = new LinkedHashMap<>();
        counters.put("summarised", items.size());
        counters.put("skipped", skipped);
        counters.put("failed", failed);
        return counters;
    }
}
