package com.carelogs.common.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered visit records parsed from one uploaded object.
 * Exists for the duration of a single notification and is never persisted as a unit.
 *
 * Elements of the file that could not be read as a visit record keep their position: the
 * record at that index is an empty placeholder and {@link #rejectedRecords()} holds the reason.
 */
public record Batch(String batchId, List<VisitRecord> records, Map<Integer, String> rejectedRecords) {

    public Batch {
        records = List.copyOf(records);
        rejectedRecords = Map.copyOf(rejectedRecords);
    }

    public Batch(String batchId, List<VisitRecord> records) {
        this(batchId, records, Map.of());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public boolean hasRejectedRecords() {
        return !rejectedRecords.isEmpty();
    }

    public Optional<String> rejectionOf(int index) {
        return Optional.ofNullable(rejectedRecords.get(index));
    }
}
