package com.carelogs.common.exception;

/**
 * Raised when an uploaded batch object cannot be fetched from object storage.
 */
public class ObjectStoreException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        ACCESS_DENIED,
        OTHER
    }

    private final Reason reason;

    public ObjectStoreException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
