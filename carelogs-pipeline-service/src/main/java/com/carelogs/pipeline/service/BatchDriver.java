package com.carelogs.pipeline.service;

import com.carelogs.common.dto.BatchAcknowledgment;
import com.carelogs.common.exception.MalformedBatchException;
import com.carelogs.common.exception.ObjectStoreException;
import com.carelogs.common.message.StorageEvent;
import com.carelogs.common.message.StorageNotification;
import com.carelogs.common.model.Batch;
import com.carelogs.common.model.OutputItem;
import com.carelogs.common.service.BatchIds;
import com.carelogs.common.service.ObjectStoreReader;
import com.carelogs.pipeline.service.aggregate.AggregationReport;
import com.carelogs.pipeline.service.aggregate.BatchAggregator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one pipeline (classification or summarisation) for a triggering event:
 *
 * per notification: derive batch id → download → parse → aggregate → persist → report
 *
 * A notification that fails never stops its siblings, and nothing is re-raised: the event
 * is always acknowledged as a success. Per-notification results are returned as
 * {@link NotificationOutcome}s and logged.
 */
@Slf4j
public class BatchDriver<T extends OutputItem> {

    static final String MDC_BATCH_ID = "batchId";

    private final String pipelineName;
    private final String completionMessage;
    private final ObjectStoreReader objectStoreReader;
    private final BatchParser batchParser;
    private final BatchAggregator<T> aggregator;
    private final BulkPersister<T> persister;

    public BatchDriver(String pipelineName, String completionMessage, ObjectStoreReader objectStoreReader,
            BatchParser batchParser, BatchAggregator<T> aggregator, BulkPersister<T> persister) {
        this.pipelineName = pipelineName;
        this.completionMessage = completionMessage;
        this.objectStoreReader = objectStoreReader;
        this.batchParser = batchParser;
        this.aggregator = aggregator;
        this.persister = persister;
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public BatchAcknowledgment handle(StorageEvent event) {
        log.info("[{}] Received event with {} records, {} storage notifications",
                pipelineName, event.recordCount(), event.notifications().size());

        List<NotificationOutcome> outcomes = new ArrayList<>();
        for (StorageNotification notification : event.notifications()) {
            outcomes.add(process(notification));
        }

        long failed = outcomes.stream()
                .filter(o -> o.status() == NotificationOutcome.Status.FAILED
                        || o.status() == NotificationOutcome.Status.MALFORMED)
                .count();
        if (failed > 0) {
            log.warn("[{}] {} of {} notifications could not be processed", pipelineName, failed, outcomes.size());
        }

        return BatchAcknowledgment.of(completionMessage, event.recordCount());
    }

    public NotificationOutcome process(StorageNotification notification) {
        String location = notification.location();
        log.info("[{}] Processing object: {}", pipelineName, location);

        String batchId = BatchIds.derive(notification.key());
        MDC.put(MDC_BATCH_ID, batchId);
        try {
            log.info("Extracted batch ID: {}", batchId);

            byte[] content = objectStoreReader.get(notification.bucket(), notification.key());
            Batch batch = batchParser.parse(batchId, content);
            log.info("Found {} records to process in batch '{}'", batch.size(), batchId);

            if (batch.isEmpty()) {
                log.warn("No records found to process in {}", location);
                return NotificationOutcome.empty(location);
            }

            AggregationReport<T> report = aggregator.aggregate(batch);
            int producedCount = report.items().size();
            int persistedCount = persister.persist(report.items());

            logSummary(batch, report, persistedCount);
            return NotificationOutcome.processed(location, batch.size(), producedCount, persistedCount);

        } catch (MalformedBatchException e) {
            log.error("Failed to parse batch from {}: {}", location, e.getMessage());
            return NotificationOutcome.malformed(location, e.getMessage());
        } catch (ObjectStoreException e) {
            log.error("Failed to download {} ({}): {}", location, e.getReason(), e.getMessage(), e);
            return NotificationOutcome.failed(location, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Pipeline failed for {}: {}", pipelineName, location, e.getMessage(), e);
            return NotificationOutcome.failed(location, e.getMessage());
        } finally {
            MDC.remove(MDC_BATCH_ID);
        }
    }

    private void logSummary(Batch batch, AggregationReport<T> report, int persistedCount) {
        int producedCount = report.items().size();

        log.info("=== {} SUMMARY ===", pipelineName.toUpperCase());
        log.info("Processed {} {} from {} records, saved {}/{} items to '{}'",
                report.unitCount(), aggregator.unitName(), batch.size(),
                persistedCount, producedCount, persister.getTableName());
        if (producedCount != report.unitCount()) {
            log.warn("{} {} produced no item (skipped or failed).",
                    report.unitCount() - producedCount, aggregator.unitName());
        }
        if (persistedCount < producedCount) {
            log.error("{} produced items failed to write to the store.", producedCount - persistedCount);
        }
        for (Map.Entry<String, Integer> counter : report.counters().entrySet()) {
            log.info("   {}: {}", counter.getKey(), counter.getValue());
        }
    }
}
