package com.carelogs.pipeline.service.aggregate;

import com.carelogs.common.model.Batch;
import com.carelogs.common.model.Category;
import com.carelogs.common.model.ClassifiedVisitItem;
import com.carelogs.common.model.VisitRecord;
import com.carelogs.pipeline.service.VisitNoteClassifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Classifies every record of a batch in parallel, one unit of work per record.
 *
 * Each item is keyed by its record's original index, so completion order is irrelevant.
 * The tally is computed on the calling thread once all workers have returned.
 */
@Slf4j
public class ClassificationAggregator implements BatchAggregator<ClassifiedVisitItem> {

    private final VisitNoteClassifier classifier;
    private final WorkerPoolSettings poolSettings;
    private final Clock clock;

    public ClassificationAggregator(VisitNoteClassifier classifier, WorkerPoolSettings poolSettings, Clock clock) {
        this.classifier = classifier;
        this.poolSettings = poolSettings;
        this.clock = clock;
    }

    @Override
    public String unitName() {
        return "records";
    }

    @Override
    public ClassificationReport aggregate(Batch batch) {
        List<VisitRecord> records = batch.records();
        List<Callable<UnitOutcome<ClassifiedVisitItem>>> units = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            int index = i;
            VisitRecord record = records.get(i);
            Optional<String> rejection = batch.rejectionOf(i);
            units.add(() -> rejection.isPresent()
                    ? rejectedRecord(index, rejection.get())
                    : classifyRecord(index, record, batch.batchId()));
        }

        List<UnitOutcome<ClassifiedVisitItem>> outcomes;
        try (BoundedTaskGroup group = new BoundedTaskGroup(poolSettings, units.size(), "classify-")) {
            outcomes = group.runAll(units);
        }

        List<ClassifiedVisitItem> items = new ArrayList<>();
        Map<Category, Integer> tally = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            tally.put(category, 0);
        }
        int skipped = 0;
        int failed = 0;

        for (UnitOutcome<ClassifiedVisitItem> outcome : outcomes) {
            switch (outcome.getStatus()) {
                case SUCCEEDED -> {
                    ClassifiedVisitItem item = outcome.getValue();
                    items.add(item);
                    tally.merge(item.getClassification(), 1, Integer::sum);
                }
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }

        return new ClassificationReport(items, tally, skipped, failed, records.size());
    }

    private UnitOutcome<ClassifiedVisitItem> rejectedRecord(int index, String reason) {
        log.error("Record {} could not be read: {}", index, reason);
        return UnitOutcome.failed(reason);
    }

    private UnitOutcome<ClassifiedVisitItem> classifyRecord(int index, VisitRecord record, String batchId) {
        if (!record.hasUsableNote()) {
            log.warn("Record {} has an empty note, skipping classification.", index);
            return UnitOutcome.skipped("Empty note");
        }

        Category category = classifier.classify(record.note());
        String timestamp = LocalDateTime.now(clock).toString();
        return UnitOutcome.succeeded(ClassifiedVisitItem.of(index, batchId, record, category, timestamp));
    }
}
