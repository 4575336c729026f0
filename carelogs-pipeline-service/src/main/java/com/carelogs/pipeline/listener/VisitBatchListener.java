package com.carelogs.pipeline.listener;

import com.carelogs.common.config.RabbitMQConfig;
import com.carelogs.common.dto.BatchAcknowledgment;
import com.carelogs.common.exception.MalformedEventException;
import com.carelogs.pipeline.service.PipelineMode;
import com.carelogs.pipeline.service.VisitBatchDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Consumes upload events from RabbitMQ.
 *
 * Messages are always acknowledged: per-object failures are already logged by the driver,
 * and an unparseable envelope is logged here rather than redelivered forever.
 */
@Slf4j
@Component
public class VisitBatchListener {

    @Autowired
    private VisitBatchDispatcher dispatcher;

    @RabbitListener(queues = RabbitMQConfig.CLASSIFY_QUEUE)
    public void onClassifyEvent(Message message) {
        handle(PipelineMode.CLASSIFY, message);
    }

    @RabbitListener(queues = RabbitMQConfig.SUMMARISE_QUEUE)
    public void onSummariseEvent(Message message) {
        handle(PipelineMode.SUMMARISE, message);
    }

    private void handle(PipelineMode mode, Message message) {
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            BatchAcknowledgment acknowledgment = dispatcher.dispatch(mode, body);
            log.info("{}: {} ({} objects)", mode.pathName(), acknowledgment.message(),
                    acknowledgment.processedObjects());
        } catch (MalformedEventException e) {
            log.error("Discarding malformed {} event: {}", mode.pathName(), e.getMessage());
        }
    }
}
