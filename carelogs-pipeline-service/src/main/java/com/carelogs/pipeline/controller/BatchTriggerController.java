package com.carelogs.pipeline.controller;

import com.carelogs.common.dto.ApiResponse;
import com.carelogs.common.dto.BatchAcknowledgment;
import com.carelogs.pipeline.service.PipelineMode;
import com.carelogs.pipeline.service.VisitBatchDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual trigger: POST the same upload event JSON the queues carry.
 *
 * POST /api/batches/classify
 * POST /api/batches/summarise
 */
@Slf4j
@RestController
@RequestMapping("/api/batches")
public class BatchTriggerController {

    @Autowired
    private VisitBatchDispatcher dispatcher;

    @PostMapping(value = "/{mode}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse<BatchAcknowledgment>> trigger(@PathVariable("mode") String mode,
            @RequestBody String eventJson) {
        PipelineMode pipelineMode = PipelineMode.fromPathName(mode);
        log.info("Manual {} trigger received", pipelineMode.pathName());

        BatchAcknowledgment acknowledgment = dispatcher.dispatch(pipelineMode, eventJson);
        return ResponseEntity.ok(ApiResponse.success(acknowledgment, acknowledgment.message()));
    }
}
