package com.carelogs.common.dto;

/**
 * Fixed-shape reply to a triggering event.
 *
 * Always reports success: per-object failures are visible only in logs and tallies.
 *
 * @param processedObjects number of top-level records in the triggering event
 */
public record BatchAcknowledgment(int statusCode, String message, int processedObjects) {

    public static BatchAcknowledgment of(String message, int processedObjects) {
        return new BatchAcknowledgment(200, message, processedObjects);
    }
}
