package com.carelogs.pipeline.service.aggregate;

/**
 * Result of one unit of work (one record, or one client's records).
 *
 * SKIPPED means the unit had no usable text; FAILED means the unit itself broke.
 * Neither produces an output item, and they are counted separately.
 */
public class UnitOutcome<T> {

    public enum Status {
        SUCCEEDED,
        SKIPPED,
        FAILED
    }

    private final Status status;
    private final T value;
    private final String reason;

    private UnitOutcome(Status status, T value, String reason) {
        this.status = status;
        this.value = value;
        this.reason = reason;
    }

    public static <T> UnitOutcome<T> succeeded(T value) {
        return new UnitOutcome<>(Status.SUCCEEDED, value, null);
    }

    public static <T> UnitOutcome<T> skipped(String reason) {
        return new UnitOutcome<>(Status.SKIPPED, null, reason);
    }

    public static <T> UnitOutcome<T> failed(String reason) {
        return new UnitOutcome<>(Status.FAILED, null, reason);
    }

    public Status getStatus() {
        return status;
    }

    public T getValue() {
        return value;
    }

    public String getReason() {
        return reason;
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }
}
