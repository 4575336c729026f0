package com.carelogs.common.exception;

/**
 * Batch file content that cannot be parsed into visit records.
 */
public class MalformedBatchException extends RuntimeException {

    public MalformedBatchException(String message) {
        super(message);
    }

    public MalformedBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
