package com.carelogs.pipeline.config;

import com.carelogs.common.message.StorageEventParser;
import com.carelogs.common.model.ClassifiedVisitItem;
import com.carelogs.common.model.ClientSummaryItem;
import com.carelogs.common.service.ObjectStoreReader;
import com.carelogs.common.store.KeyValueStoreWriter;
import com.carelogs.pipeline.service.BatchDriver;
import com.carelogs.pipeline.service.BatchParser;
import com.carelogs.pipeline.service.BulkPersister;
import com.carelogs.pipeline.service.VisitNoteClassifier;
import com.carelogs.pipeline.service.VisitNoteSummarizer;
import com.carelogs.pipeline.service.aggregate.ClassificationAggregator;
import com.carelogs.pipeline.service.aggregate.SummarizationAggregator;
import com.carelogs.pipeline.service.aggregate.WorkerPoolSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the classification and summarisation pipelines.
 *
 * Both share the object store, parser and worker pool settings; each writes to its own table.
 */
@Slf4j
@Configuration
public class PipelineConfig {

    @Value("${carelogs.pipeline.max-workers:0}")
    private int maxWorkers;

    @Value("${carelogs.pipeline.batch-timeout:15m}")
    private Duration batchTimeout;

    @Value("${carelogs.store.visits-table:awslambdahackathoncarelogs}")
    private String visitsTable;

    @Value("${carelogs.store.summaries-table:awslambdahackathonsummaries}")
    private String summariesTable;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public WorkerPoolSettings workerPoolSettings() {
        WorkerPoolSettings settings = new WorkerPoolSettings(maxWorkers, batchTimeout);
        log.info("Worker pool: {} workers per batch, batch timeout {}",
                maxWorkers > 0 ? maxWorkers : "one per processor", settings.hasTimeout() ? batchTimeout : "none");
        return settings;
    }

    @Bean
    public StorageEventParser storageEventParser(ObjectMapper objectMapper) {
        return new StorageEventParser(objectMapper);
    }

    @Bean
    public BatchParser batchParser(ObjectMapper objectMapper) {
        return new BatchParser(objectMapper);
    }

    @Bean
    public BatchDriver<ClassifiedVisitItem> classificationDriver(ObjectStoreReader objectStoreReader, BatchParser batchParser,
            VisitNoteClassifier classifier, WorkerPoolSettings poolSettings, Clock clock,
            KeyValueStoreWriter storeWriter) {
        return new BatchDriver<>(
                "classification",
                "Processing complete.",
                objectStoreReader,
                batchParser,
                new ClassificationAggregator(classifier, poolSettings, clock),
                new BulkPersister<>(storeWriter, visitsTable, ClassifiedVisitItem.class));
    }

    @Bean
    public BatchDriver<ClientSummaryItem> summarisationDriver(ObjectStoreReader objectStoreReader, BatchParser batchParser,
            VisitNoteSummarizer summarizer, WorkerPoolSettings poolSettings, Clock clock,
            KeyValueStoreWriter storeWriter) {
        return new BatchDriver<>(
                "summarisation",
                "Summarisation complete.",
                objectStoreReader,
                batchParser,
                new SummarizationAggregator(summarizer, poolSettings, clock),
                new BulkPersister<>(storeWriter, summariesTable, ClientSummaryItem.class));
    }
}
