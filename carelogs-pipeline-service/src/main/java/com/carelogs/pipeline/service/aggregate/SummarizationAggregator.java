package com.carelogs.pipeline.service.aggregate;

import com.carelogs.common.exception.MalformedBatchException;
import com.carelogs.common.model.Batch;
import com.carelogs.common.model.ClientSummaryItem;
import com.carelogs.common.model.VisitRecord;
import com.carelogs.pipeline.service.VisitNoteSummarizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Groups a batch by client and summarises each client's notes in parallel, one unit of
 * work per client.
 *
 * Notes go to the model oldest first, ordered by the lexical value of visit_date, so dates
 * must be ISO-like for that order to be chronological.
 *
 * A summary covers all of a client's visits, so a batch with any unreadable element is
 * refused as a whole rather than summarised from a partial history.
 */
@Slf4j
public class SummarizationAggregator implements BatchAggregator<ClientSummaryItem> {

    public static final String UNKNOWN_CLIENT = "Unknown";

    private final VisitNoteSummarizer summarizer;
    private final WorkerPoolSettings poolSettings;
    private final Clock clock;

    public SummarizationAggregator(VisitNoteSummarizer summarizer, WorkerPoolSettings poolSettings, Clock clock) {
        this.summarizer = summarizer;
        this.poolSettings = poolSettings;
        this.clock = clock;
    }

    @Override
    public String unitName() {
        return "clients";
    }

    @Override
    public SummarizationReport aggregate(Batch batch) {
        if (batch.hasRejectedRecords()) {
            int first = batch.rejectedRecords().keySet().stream().min(Integer::compare).orElseThrow();
            throw new MalformedBatchException(batch.rejectedRecords().get(first));
        }

        Map<String, List<VisitRecord>> recordsByClient = new LinkedHashMap<>();
        for (VisitRecord record : batch.records()) {
            recordsByClient.computeIfAbsent(record.clientOr(UNKNOWN_CLIENT), client -> new ArrayList<>()).add(record);
        }

        List<Callable<UnitOutcome<ClientSummaryItem>>> units = new ArrayList<>(recordsByClient.size());
        recordsByClient.forEach((client, records) ->
                units.add(() -> summarizeClient(client, records, batch.batchId())));

        List<UnitOutcome<ClientSummaryItem>> outcomes;
        try (BoundedTaskGroup group = new BoundedTaskGroup(poolSettings, units.size(), "summarise-")) {
            outcomes = group.runAll(units);
        }

        List<ClientSummaryItem> items = new ArrayList<>();
        int skipped = 0;
        int failed = 0;
        for (UnitOutcome<ClientSummaryItem> outcome : outcomes) {
            switch (outcome.getStatus()) {
                case SUCCEEDED -> items.add(outcome.getValue());
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }

        return new SummarizationReport(items, skipped, failed, recordsByClient.size());
    }

    private UnitOutcome<ClientSummaryItem> summarizeClient(String client, List<VisitRecord> records, String batchId) {
        List<VisitRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(VisitRecord::visitDate));

        List<String> notes = sorted.stream()
                .filter(VisitRecord::hasUsableNote)
                .map(record -> record.note().strip())
                .toList();

        if (notes.isEmpty()) {
            log.warn("Client '{}' has no non-empty notes, skipping.", client);
            return UnitOutcome.skipped("No non-empty notes");
        }

        String summary = summarizer.summarize(notes);

        // Taken over every record of the client, including those whose note was empty
        String latestVisitDate = records.stream()
                .map(VisitRecord::visitDate)
                .max(Comparator.naturalOrder())
                .orElse("");

        return UnitOutcome.succeeded(new ClientSummaryItem(
                client,
                batchId,
                latestVisitDate,
                records.size(),
                summary,
                LocalDateTime.now(clock).toString()));
    }
}
