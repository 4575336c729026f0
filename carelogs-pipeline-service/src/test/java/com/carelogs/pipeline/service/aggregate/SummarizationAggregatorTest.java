package com.carelogs.pipeline.service.aggregate;

import com.carelogs.common.exception.MalformedBatchException;
import com.carelogs.common.model.Batch;
import com.carelogs.common.model.ClientSummaryItem;
import com.carelogs.common.model.VisitRecord;
import com.carelogs.pipeline.service.StubTextGenerationStrategy;
import com.carelogs.pipeline.service.VisitNoteSummarizer;
import com.carelogs.pipeline.service.strategy.TextGenerationStrategy.GenerationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SummarizationAggregator: grouping, note order and per-client fields.
 */
class SummarizationAggregatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-01T09:00:00Z"), ZoneOffset.UTC);
    private static final WorkerPoolSettings POOL = new WorkerPoolSettings(4, Duration.ZERO);

    private final StubTextGenerationStrategy strategy =
            new StubTextGenerationStrategy(prompt -> GenerationResult.success("Summary text."));
    private final SummarizationAggregator aggregator =
            new SummarizationAggregator(new VisitNoteSummarizer(strategy), POOL, CLOCK);

    private static VisitRecord record(String client, String date, String note) {
        return new VisitRecord(note, client, "CP-3", date, null);
    }

    @Test
    @DisplayName("Should summarise clients with notes and skip clients without any")
    void aggregate_shouldSkipClientsWithoutNotes() {
        Batch batch = new Batch("batch-0042", List.of(
                record("A", "2024-01-01", "Ate little"),
                record("A", "2024-01-02", "Ate well"),
                record("A", "2024-01-03", "Walked to the shop"),
                record("B", "2024-01-02", "")));

        SummarizationReport report = aggregator.aggregate(batch);

        assertEquals(1, report.items().size());
        ClientSummaryItem item = report.items().get(0);
        assertEquals("A", item.getClient());
        assertEquals(3, item.getVisitCount());
        assertEquals("2024-01-03", item.getLatestVisitDate());
        assertEquals("Summary text.", item.getSummary());
        assertEquals("2024-02-01T09:00", item.getTimestamp());
        assertEquals(1, report.skipped());
        assertEquals(2, report.unitCount());
    }

    @Test
    @DisplayName("Should send notes oldest first regardless of file order")
    void aggregate_shouldOrderNotesByVisitDate() {
        Batch batch = new Batch("batch-0042", List.of(
                record("A", "2024-01-03", "third"),
                record("A", "2024-01-01", "first"),
                record("A", "2024-01-02", "  second  ")));

        aggregator.aggregate(batch);

        assertEquals(1, strategy.getPrompts().size());
        assertTrue(strategy.getPrompts().get(0).contains("1. first\n2. second\n3. third"));
    }

    @Test
    @DisplayName("Should take the latest visit date over all records, including empty-note ones")
    void aggregate_latestDateIncludesEmptyNotes() {
        Batch batch = new Batch("batch-0042", List.of(
                record("A", "2024-01-01", "Ate well"),
                record("A", "2024-01-09", " ")));

        ClientSummaryItem item = aggregator.aggregate(batch).items().get(0);

        assertEquals("2024-01-09", item.getLatestVisitDate());
        assertEquals(2, item.getVisitCount());
        assertFalse(strategy.getPrompts().get(0).contains("2. "));
    }

    @Test
    @DisplayName("Should group records without a client under Unknown, in first-seen order")
    void aggregate_missingClient_shouldGroupUnderUnknown() {
        Batch batch = new Batch("batch-0042", List.of(
                record(null, "2024-01-01", "No client recorded"),
                record("Z", "2024-01-01", "Stable"),
                record(null, "2024-01-02", "Still no client")));

        SummarizationReport report = aggregator.aggregate(batch);

        assertEquals(List.of("Unknown", "Z"), report.items().stream().map(ClientSummaryItem::getClient).toList());
        assertEquals(2, report.items().get(0).getVisitCount());
    }

    @Test
    @DisplayName("Should keep the error sentinel as the summary when the model call fails")
    void aggregate_failedCall_shouldStoreSentinel() {
        SummarizationAggregator failing = new SummarizationAggregator(
                new VisitNoteSummarizer(new StubTextGenerationStrategy(prompt -> GenerationResult.failed("Throttled"))),
                POOL, CLOCK);

        SummarizationReport report = failing.aggregate(
                new Batch("batch-0042", List.of(record("A", "2024-01-01", "Ate well"))));

        assertEquals(VisitNoteSummarizer.SUMMARY_UNAVAILABLE, report.items().get(0).getSummary());
        assertEquals(0, report.failed());
    }

    @Test
    @DisplayName("Should refuse a batch with an unreadable record instead of summarising a partial history")
    void aggregate_rejectedRecord_shouldThrowMalformed() {
        Batch batch = new Batch("batch-0042",
                List.of(record("A", "2024-01-01", "Ate well"), new VisitRecord(null, null, null, null, null)),
                Map.of(1, "Record 1 is not a JSON object"));

        MalformedBatchException ex = assertThrows(MalformedBatchException.class, () -> aggregator.aggregate(batch));

        assertEquals("Record 1 is not a JSON object", ex.getMessage());
        assertTrue(strategy.getPrompts().isEmpty());
    }
}
