package com.carelogs.common.exception;

/**
 * Triggering event envelope that is not valid JSON or has no Records array.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
