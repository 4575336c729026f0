package com.carelogs.pipeline.service;

/**
 * How one storage notification ended.
 *
 * Only PROCESSED carries counts; the other states mean nothing was written.
 */
public record NotificationOutcome(
        Status status,
        String location,
        int recordCount,
        int producedCount,
        int persistedCount,
        String detail) {

    public enum Status {
        PROCESSED,
        EMPTY,
        MALFORMED,
        FAILED
    }

    public static NotificationOutcome processed(String location, int recordCount, int producedCount,
            int persistedCount) {
        return new NotificationOutcome(Status.PROCESSED, location, recordCount, producedCount, persistedCount, null);
    }

    public static NotificationOutcome empty(String location) {
        return new NotificationOutcome(Status.EMPTY, location, 0, 0, 0, null);
    }

    public static NotificationOutcome malformed(String location, String detail) {
        return new NotificationOutcome(Status.MALFORMED, location, 0, 0, 0, detail);
    }

    public static NotificationOutcome failed(String location, String detail) {
        return new NotificationOutcome(Status.FAILED, location, 0, 0, 0, detail);
    }
}
