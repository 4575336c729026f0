package com.carelogs.common.service;

import lombok.extern.slf4j.Slf4j;

/**
 * Derives the batch identifier from an uploaded object's key.
 *
 * Expected object key format: {batchId}.json (flat file structure)
 */
@Slf4j
public final class BatchIds {

    private static final int MIN_PLAUSIBLE_LENGTH = 6;

    private BatchIds() {
    }

    /**
     * Object key with its final extension removed.
     * "batch-2024-06-01.json" → "batch-2024-06-01"
     * "uploads/v1.2/batch" → "uploads/v1.2/batch" (dot is in a directory, not the file name)
     * ".hidden" → ".hidden" (leading dot is not an extension)
     */
    public static String derive(String objectKey) {
        int lastSlash = objectKey.lastIndexOf('/');
        int lastDot = objectKey.lastIndexOf('.');

        String batchId = objectKey;
        // Leading dots of the file name do not start an extension
        int nameStart = lastSlash + 1;
        int firstNonDot = nameStart;
        while (firstNonDot < objectKey.length() && objectKey.charAt(firstNonDot) == '.') {
            firstNonDot++;
        }
        if (lastDot > firstNonDot) {
            batchId = objectKey.substring(0, lastDot);
        }

        if (batchId.length() < MIN_PLAUSIBLE_LENGTH) {
            log.warn("Extracted batch ID '{}' doesn't look valid.", batchId);
        }
        return batchId;
    }
}
