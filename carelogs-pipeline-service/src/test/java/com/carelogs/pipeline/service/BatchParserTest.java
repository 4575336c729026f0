package com.carelogs.pipeline.service;

import com.carelogs.common.exception.MalformedBatchException;
import com.carelogs.common.model.Batch;
import com.carelogs.common.model.VisitRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BatchParser: record binding and malformed content.
 */
class BatchParserTest {

    private final BatchParser parser = new BatchParser(new ObjectMapper());

    private Batch parse(String json) {
        return parser.parse("batch-0042", json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should bind records in file order and normalise absent fields")
    void parse_shouldBindRecords() {
        Batch batch = parse("""
                [
                  {"note": "Helped with lunch", "client": "C-17", "care_pro": "CP-3",
                   "visit_date": "2024-01-02", "shift": "am"},
                  {"client": "C-18"}
                ]
                """);

        assertEquals("batch-0042", batch.batchId());
        assertEquals(2, batch.size());

        VisitRecord first = batch.records().get(0);
        assertEquals("Helped with lunch", first.note());
        assertEquals("CP-3", first.carePro());
        assertEquals("2024-01-02", first.visitDate());

        VisitRecord second = batch.records().get(1);
        assertEquals("", second.note());
        assertEquals("", second.visitDate());
        assertFalse(second.hasUsableNote());
    }

    @Test
    @DisplayName("Should keep a missing client absent")
    void parse_missingClient_shouldStayNull() {
        VisitRecord record = parse("[{\"note\": \"ok\"}]").records().get(0);

        assertNull(record.client());
        assertEquals("Unknown", record.clientOr("Unknown"));
    }

    @Test
    @DisplayName("Should coerce numeric fields to strings")
    void parse_shouldCoerceScalars() {
        VisitRecord record = parse("[{\"note\": \"ok\", \"client\": 1042}]").records().get(0);

        assertEquals("1042", record.client());
    }

    @Test
    @DisplayName("Should accept an empty array")
    void parse_emptyArray_shouldBeEmptyBatch() {
        assertTrue(parse("[]").isEmpty());
    }

    @Test
    @DisplayName("Should reject content that is not JSON")
    void parse_notJson_shouldThrow() {
        assertThrows(MalformedBatchException.class, () -> parse("note,client\nfell,C-1"));
    }

    @Test
    @DisplayName("Should reject a JSON object at the root")
    void parse_objectRoot_shouldThrow() {
        assertThrows(MalformedBatchException.class, () -> parse("{\"records\": []}"));
    }

    @Test
    @DisplayName("Should reject a non-object element at its index and keep the others")
    void parse_nonObjectElement_shouldRejectOnlyThatIndex() {
        Batch batch = parse("[{\"note\": \"ok\"}, \"stray text\", {\"note\": \"fine\"}]");

        assertEquals(3, batch.size());
        assertEquals("ok", batch.records().get(0).note());
        assertEquals("fine", batch.records().get(2).note());
        assertEquals(Set.of(1), batch.rejectedRecords().keySet());
        assertTrue(batch.rejectionOf(1).orElseThrow().startsWith("Record 1 is not a JSON object"));
        assertTrue(batch.rejectionOf(0).isEmpty());
        assertFalse(batch.records().get(1).hasUsableNote());
    }

    @Test
    @DisplayName("Should reject a record whose note is not a scalar, and a bare number, without failing the file")
    void parse_mixedBadElements_shouldRejectPerIndex() {
        Batch batch = parse("[{\"note\": \"patient fell and was injured\"}, {\"note\": {\"text\": \"x\"}}, 42]");

        assertEquals(3, batch.size());
        assertEquals(Set.of(1, 2), batch.rejectedRecords().keySet());
        assertTrue(batch.rejectionOf(1).orElseThrow().startsWith("Record 1 has an invalid shape"));
        assertTrue(batch.rejectionOf(2).orElseThrow().startsWith("Record 2 is not a JSON object"));
        assertEquals("patient fell and was injured", batch.records().get(0).note());
    }
}
