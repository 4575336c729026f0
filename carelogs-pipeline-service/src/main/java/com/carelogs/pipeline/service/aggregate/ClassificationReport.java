package com.carelogs.pipeline.service.aggregate;

import com.carelogs.common.model.Category;
import com.carelogs.common.model.ClassifiedVisitItem;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classification items in record order plus the per-category tally.
 */
public record ClassificationReport(
        List<ClassifiedVisitItem> items,
        Map<Category, Integer> tally,
        int skipped,
        int failed,
        int unitCount) implements AggregationReport<ClassifiedVisitItem> {

    public ClassificationReport {
        items = List.copyOf(items);
        tally = new EnumMap<>(tally);
    }

    public int count(Category category) {
        return tally.getOrDefault(category, 0);
    }

    @Override
    public Map<String, Integer> counters() {
        Map<String, Integer> counters = new LinkedHashMap<>();
        for (Category category : Category.values()) {
            counters.put(category.wireName(), count(category));
        }
        counters.put("skipped", skipped);
        counters.put("failed", failed);
        return counters;
    }
}
