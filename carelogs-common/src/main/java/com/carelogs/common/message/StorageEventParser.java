package com.carelogs.common.message;

import com.carelogs.common.exception.MalformedEventException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses object-storage upload events into {@link StorageNotification}s.
 *
 * Accepts both shapes the upload bucket can emit:
 * - direct: {"Records": [{"s3": {"bucket": {"name"}, "object": {"key"}}}]}
 * - SNS fan-out: {"Records": [{"Sns": {"Message": "<JSON-encoded direct event>"}}]}
 *
 * A malformed record is logged and dropped; it never takes its siblings down with it.
 */
@Slf4j
public class StorageEventParser {

    private final ObjectMapper objectMapper;

    public StorageEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StorageEvent parse(String eventJson) {
        JsonNode root;
        try {
            root = objectMapper.readTree(eventJson);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Event is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.path("Records").isArray()) {
            throw new MalformedEventException("Event has no Records array", null);
        }

        JsonNode records = root.path("Records");
        List<StorageNotification> notifications = new ArrayList<>();

        for (JsonNode record : records) {
            if (record.has("Sns")) {
                notifications.addAll(unwrapSnsRecord(record.path("Sns")));
            } else if (record.has("s3")) {
                toNotification(record).ifPresent(notifications::add);
            } else {
                log.warn("Record doesn't contain an SNS message or storage record, ignoring it");
            }
        }

        return new StorageEvent(records.size(), notifications);
    }

    private List<StorageNotification> unwrapSnsRecord(JsonNode sns) {
        List<StorageNotification> notifications = new ArrayList<>();
        try {
            JsonNode message = objectMapper.readTree(sns.path("Message").asText(""));
            for (JsonNode s3Record : message.path("Records")) {
                toNotification(s3Record).ifPresent(notifications::add);
            }
        } catch (JsonProcessingException e) {
            log.error("Failed to parse SNS message body: {}", e.getOriginalMessage());
        }
        return notifications;
    }

    private Optional<StorageNotification> toNotification(JsonNode record) {
        String bucket = record.path("s3").path("bucket").path("name").asText("");
        String rawKey = record.path("s3").path("object").path("key").asText("");

        if (bucket.isEmpty() || rawKey.isEmpty()) {
            log.warn("Storage record without bucket name or object key, ignoring it");
            return Optional.empty();
        }

        // Object keys arrive form-encoded: spaces as '+', everything else percent-escaped
        try {
            String key = URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
            return Optional.of(new StorageNotification(bucket, key));
        } catch (IllegalArgumentException e) {
            log.warn("Object key '{}' is not validly encoded, ignoring it: {}", rawKey, e.getMessage());
            return Optional.empty();
        }
    }
}
