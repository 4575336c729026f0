package com.carelogs.pipeline.service;

import com.carelogs.common.dto.BatchAcknowledgment;
import com.carelogs.common.message.StorageEvent;
import com.carelogs.common.message.StorageEventParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point shared by the queue listener and the HTTP trigger: parses the raw event and
 * hands it to the driver of the requested pipeline.
 */
@Slf4j
@Service
public class VisitBatchDispatcher {

    private final StorageEventParser eventParser;
    private final BatchDriver<?> classificationDriver;
    private final BatchDriver<?> summarisationDriver;

    public VisitBatchDispatcher(StorageEventParser eventParser,
            @Qualifier("classificationDriver") BatchDriver<?> classificationDriver,
            @Qualifier("summarisationDriver") BatchDriver<?> summarisationDriver) {
        this.eventParser = eventParser;
        this.classificationDriver = classificationDriver;
        this.summarisationDriver = summarisationDriver;
    }

    /**
     * @throws com.carelogs.common.exception.MalformedEventException if the event itself
     *                                                              cannot be parsed
     */
    public BatchAcknowledgment dispatch(PipelineMode mode, String eventJson) {
        StorageEvent event = eventParser.parse(eventJson);
        BatchDriver<?> driver = switch (mode) {
            case CLASSIFY -> classificationDriver;
            case SUMMARISE -> summarisationDriver;
        };
        return driver.handle(event);
    }
}
