package com.carelogs.common.exception;

/**
 * Store-level rejection of a batch write. The whole write call is considered failed.
 */
public class StoreWriteException extends RuntimeException {

    private final String errorCode;

    public StoreWriteException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public StoreWriteException(String message) {
        this(message, "Unknown", null);
    }

    public String getErrorCode() {
        return errorCode;
    }
}
