package com.carelogs.pipeline.service;

import com.carelogs.common.exception.MalformedBatchException;
import com.carelogs.common.model.Batch;
import com.carelogs.common.model.VisitRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses an uploaded batch file: a UTF-8 JSON array of visit record objects.
 *
 * Only content that is not JSON, or whose root is not an array, fails the whole file. An
 * element that is not an object or cannot bind to {@link VisitRecord} is rejected at its
 * index and the rest of the file is still returned.
 */
@Slf4j
public class BatchParser {

    private static final int SAMPLE_RECORDS = 3;

    private final ObjectMapper objectMapper;

    public BatchParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Batch parse(String batchId, byte[] content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (IOException e) {
            throw new MalformedBatchException("Batch content is not valid JSON: " + e.getMessage(), e);
        }

        if (root == null || !root.isArray()) {
            throw new MalformedBatchException("Batch content must be a JSON array of visit records");
        }

        List<VisitRecord> records = new ArrayList<>(root.size());
        Map<Integer, String> rejected = new HashMap<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) {
                reject(rejected, records, i, "Record " + i + " is not a JSON object");
                continue;
            }
            try {
                records.add(objectMapper.treeToValue(element, VisitRecord.class));
            } catch (JsonProcessingException e) {
                reject(rejected, records, i, "Record " + i + " has an invalid shape: " + e.getOriginalMessage());
            }
        }

        if (log.isDebugEnabled() && !records.isEmpty()) {
            logStructure(root);
        }
        return new Batch(batchId, records, rejected);
    }

    private void reject(Map<Integer, String> rejected, List<VisitRecord> records, int index, String reason) {
        log.warn("{}, rejecting it.", reason);
        rejected.put(index, reason);
        records.add(new VisitRecord(null, null, null, null, null));
    }

    private void logStructure(JsonNode root) {
        List<String> fieldNames = new ArrayList<>();
        root.get(0).fieldNames().forEachRemaining(fieldNames::add);
        log.debug("Record keys: {}", fieldNames);
        for (int i = 0; i < Math.min(SAMPLE_RECORDS, root.size()); i++) {
            log.debug("Record {}: {}", i + 1, root.get(i).toPrettyString());
        }
        if (root.size() > SAMPLE_RECORDS) {
            log.debug("... and {} more records", root.size() - SAMPLE_RECORDS);
        }
    }
}
